package com.camfleet.device.controller;

import com.camfleet.core.error.ApiException;
import com.camfleet.core.error.ErrorCode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.concurrent.TimeoutException;

/**
 * Bounds a collaborator call and maps its failures to typed API errors.
 */
final class HandlerCalls {
    private static final Logger log = LoggerFactory.getLogger(HandlerCalls.class);

    private HandlerCalls() {
    }

    /**
     * @param operation     collaborator call, subscribed once
     * @param timeout       deadline for the whole call
     * @param failureCode   code reported when the collaborator signals an error
     * @param name          human name of the operation, e.g. "Stream start"
     */
    static <T> Mono<T> bounded(Mono<T> operation, Duration timeout, ErrorCode failureCode, String name) {
        return Mono.defer(() -> operation)
                .timeout(timeout)
                .onErrorMap(e -> !(e instanceof ApiException), e -> {
                    if (e instanceof TimeoutException) {
                        log.warn("{}: no answer within {}ms", name, timeout.toMillis());
                        return ApiException.timeout(name, timeout.toMillis());
                    }
                    log.warn("{} failed: {}", name, ApiException.summarize(e));
                    return ApiException.upstream(failureCode, name + " failed", e);
                });
    }
}
