package com.camfleet.device.http;

import com.camfleet.core.error.ApiException;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * Bearer token check for REST requests and WebSocket upgrades.
 */
public class AuthMiddleware implements Middleware {
    private final boolean enabled;
    private final byte[] expected;

    public AuthMiddleware(boolean enabled, String bearerToken) {
        this.enabled = enabled;
        this.expected = ("Bearer " + bearerToken).getBytes(StandardCharsets.UTF_8);
    }

    @Override
    public Mono<HttpResult> process(HttpRequest request, RouteHandler next) {
        if (!isAuthorized(request.authorizationHeader().orElse(null))) {
            return Mono.error(ApiException.unauthorized());
        }
        return next.handle(request);
    }

    /**
     * @param authorizationHeader raw header value, may be null
     * @return true when auth is disabled or the header carries the configured token
     */
    public boolean isAuthorized(String authorizationHeader) {
        if (!enabled) {
            return true;
        }
        if (authorizationHeader == null) {
            return false;
        }
        byte[] actual = authorizationHeader.getBytes(StandardCharsets.UTF_8);
        // length first, then a comparison whose time does not depend on where bytes differ
        return actual.length == expected.length && MessageDigest.isEqual(actual, expected);
    }
}
