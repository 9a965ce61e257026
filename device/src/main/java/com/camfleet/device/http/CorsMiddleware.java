package com.camfleet.device.http;

import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Answers CORS preflight requests. The allow-origin header on ordinary responses is added by
 * {@link HttpResult} itself.
 */
public class CorsMiddleware implements Middleware {
    static final Map<String, String> PREFLIGHT_HEADERS = Map.of(
            HttpResult.ALLOW_ORIGIN, "*",
            "Access-Control-Allow-Methods", "GET, POST, PUT, DELETE, OPTIONS",
            "Access-Control-Allow-Headers", "Content-Type, Authorization",
            "Access-Control-Max-Age", "86400"
    );

    @Override
    public Mono<HttpResult> process(HttpRequest request, RouteHandler next) {
        if (request.getMethod() == HttpMethod.OPTIONS) {
            return Mono.just(HttpResult.empty(200, PREFLIGHT_HEADERS));
        }
        return next.handle(request);
    }
}
