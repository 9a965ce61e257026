package com.camfleet.device.http;

import com.camfleet.core.error.ApiException;
import com.camfleet.core.msg.SuccessResponse;
import com.camfleet.core.util.JsonUtils;
import lombok.Getter;

import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Response produced by a handler or middleware, written to the wire by {@link DeviceHttpServer}.
 * <p>
 * Every result carries {@code Access-Control-Allow-Origin: *} and, unless told otherwise,
 * {@code Content-Type: application/json}.
 * </p>
 */
@Getter
public final class HttpResult {
    public static final String CONTENT_TYPE = "Content-Type";
    public static final String ALLOW_ORIGIN = "Access-Control-Allow-Origin";
    public static final String APPLICATION_JSON = "application/json";

    private static final byte[] EMPTY = new byte[0];

    private final int status;
    private final Map<String, String> headers;
    private final byte[] body;

    private HttpResult(int status, Map<String, String> headers, byte[] body) {
        Map<String, String> all = new LinkedHashMap<>(headers);
        all.putIfAbsent(ALLOW_ORIGIN, "*");
        all.putIfAbsent(CONTENT_TYPE, APPLICATION_JSON);
        this.status = status;
        this.headers = Collections.unmodifiableMap(all);
        this.body = body != null ? body : EMPTY;
    }

    public static HttpResult json(int status, Object payload) {
        try {
            return new HttpResult(status, Map.of(), JsonUtils.writeValueAsBytes(payload));
        } catch (UncheckedIOException e) {
            throw ApiException.encodingFailed(e.getCause());
        }
    }

    public static HttpResult ok(Object payload) {
        return json(200, payload);
    }

    public static HttpResult success(String message) {
        return ok(SuccessResponse.of(message));
    }

    public static HttpResult error(ApiException error) {
        return json(error.getHttpStatus(), error.toErrorResponse());
    }

    public static HttpResult text(int status, String contentType, String body) {
        return new HttpResult(status, Map.of(CONTENT_TYPE, contentType), body.getBytes(StandardCharsets.UTF_8));
    }

    public static HttpResult empty(int status, Map<String, String> headers) {
        return new HttpResult(status, headers, EMPTY);
    }

    public String bodyAsString() {
        return new String(body, StandardCharsets.UTF_8);
    }
}
