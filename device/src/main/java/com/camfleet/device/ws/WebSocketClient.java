package com.camfleet.device.ws;

import lombok.Getter;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;
import reactor.util.concurrent.Queues;

/**
 * Handle for one connected WebSocket peer.
 * <p>
 * The hub only holds this handle; the connection itself is owned by the Reactor Netty
 * handler, which unregisters the handle when the connection goes away. Outbound frames go
 * through a bounded buffer, so a slow peer loses frames instead of stalling senders.
 * </p>
 */
public class WebSocketClient {
    @Getter
    private final String id;
    private final Sinks.Many<String> sink;
    private volatile boolean closed;

    public WebSocketClient(String id, int bufferSize) {
        this.id = id;
        this.sink = Sinks.many().unicast().onBackpressureBuffer(Queues.<String>get(bufferSize).get());
    }

    /**
     * Queues a text frame for this peer without blocking.
     *
     * @return false if the client is closed or its buffer is full
     */
    public synchronized boolean send(String frame) {
        if (closed) {
            return false;
        }
        return sink.tryEmitNext(frame).isSuccess();
    }

    /**
     * Frames to write to the connection; completes when the client is closed.
     */
    public Flux<String> frames() {
        return sink.asFlux();
    }

    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        sink.tryEmitComplete();
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public String toString() {
        return "WebSocketClient[" + id + "]";
    }
}
