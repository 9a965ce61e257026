package com.camfleet.console.client;

import lombok.Value;

/**
 * Where and how to reach one device control server.
 */
@Value
public class DeviceAddress {
    String host;
    int port;
    /**
     * Bearer token; empty when the device runs without auth.
     */
    String token;

    /**
     * Registry identity of the device at this address.
     */
    public String id() {
        return idOf(host, port);
    }

    public String baseUrl() {
        return "http://" + host + ":" + port;
    }

    public boolean hasToken() {
        return token != null && !token.isEmpty();
    }

    public static String idOf(String host, int port) {
        return host + ":" + port;
    }

    @Override
    public String toString() {
        return id();
    }
}
