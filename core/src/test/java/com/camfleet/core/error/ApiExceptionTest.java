package com.camfleet.core.error;

import com.camfleet.core.msg.ErrorResponse;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class ApiExceptionTest {

    @Test
    void testRateLimited_MessageCarriesWait() {
        ApiException e = ApiException.rateLimited(40);

        assertEquals(429, e.getHttpStatus());
        assertEquals(ErrorCategory.RATE_LIMIT, e.getErrorCode().getCategory());
        assertEquals("Too many requests, wait 40ms", e.getMessage());
    }

    @Test
    void testUpstream_SummarizesCauseWithoutStackTrace() {
        ApiException e = ApiException.upstream(ErrorCode.STREAM_START_FAILED, "Stream start failed",
                new IllegalStateException("encoder unavailable"));

        ErrorResponse body = e.toErrorResponse();

        assertEquals("STREAM_START_FAILED", body.getCode());
        assertEquals("Stream start failed: encoder unavailable", body.getMessage());
    }

    @Test
    void testSummarize_FallsBackToTypeName() {
        assertEquals("NullPointerException", ApiException.summarize(new NullPointerException()));
    }

    @Test
    void testStatusMapping() {
        assertEquals(400, ErrorCode.MISSING_BODY.getHttpStatus());
        assertEquals(404, ErrorCode.METHOD_NOT_ALLOWED.getHttpStatus());
        assertEquals(408, ErrorCode.REQUEST_TIMEOUT.getHttpStatus());
        assertEquals(501, ErrorCode.NOT_IMPLEMENTED.getHttpStatus());
        assertEquals(ErrorCategory.UPSTREAM, ErrorCode.MEASURE_FAILED.getCategory());
    }
}
