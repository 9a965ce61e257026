package com.camfleet.device.http;

import java.util.Optional;

public enum HttpMethod {
    GET,
    POST,
    PUT,
    DELETE,
    OPTIONS;

    public static Optional<HttpMethod> parse(String name) {
        for (HttpMethod method : values()) {
            if (method.name().equalsIgnoreCase(name)) {
                return Optional.of(method);
            }
        }
        return Optional.empty();
    }
}
