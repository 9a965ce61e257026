package com.camfleet.device.http;

import com.camfleet.core.error.ApiException;
import com.camfleet.core.util.JsonUtils;
import com.fasterxml.jackson.core.JsonProcessingException;
import lombok.Value;

import java.io.UncheckedIOException;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Transport-independent view of one HTTP request: what the middleware chain and handlers see.
 * <p>
 * Header names are stored lower-cased, so lookups are case-insensitive.
 * </p>
 */
@Value
public class HttpRequest {
    HttpMethod method;
    String path;
    Map<String, String> headers;
    byte[] body;

    public static HttpRequest of(HttpMethod method, String path, Map<String, String> headers, byte[] body) {
        Map<String, String> normalized = new HashMap<>();
        if (headers != null) {
            headers.forEach((k, v) -> normalized.put(k.toLowerCase(Locale.ROOT), v));
        }
        return new HttpRequest(method, path, Map.copyOf(normalized), body);
    }

    public static HttpRequest of(HttpMethod method, String path) {
        return of(method, path, Map.of(), null);
    }

    public Optional<String> header(String name) {
        return Optional.ofNullable(headers.get(name.toLowerCase(Locale.ROOT)));
    }

    public Optional<String> authorizationHeader() {
        return header("Authorization");
    }

    /**
     * Decodes the JSON body.
     *
     * @throws ApiException {@code MISSING_BODY} when there is no body, {@code INVALID_REQUEST}
     *                      when it is not valid JSON for the target type
     */
    public <T> T decodeBody(Class<T> type) {
        if (body == null || body.length == 0) {
            throw ApiException.missingBody();
        }
        try {
            T value = JsonUtils.readValue(body, type);
            if (value == null) {
                throw ApiException.missingBody();
            }
            return value;
        } catch (UncheckedIOException | IllegalArgumentException e) {
            throw ApiException.invalidRequest(describe(e));
        }
    }

    private static String describe(RuntimeException e) {
        if (e.getCause() instanceof JsonProcessingException) {
            return ((JsonProcessingException) e.getCause()).getOriginalMessage();
        }
        return ApiException.summarize(e.getCause() != null ? e.getCause() : e);
    }
}
