package com.camfleet.device.ws;

import com.camfleet.device.metrics.MetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Registry of connected WebSocket clients for one device, with a broadcast primitive.
 * <p>
 * The lock only guards the client set. {@link #broadcast} copies the set under the lock and
 * writes outside it, so a slow client never delays the others and registration is never
 * blocked by I/O. Clients are removed by their own disconnect callback, not by a failed write.
 * </p>
 */
public class WebSocketHub {
    private static final Logger log = LoggerFactory.getLogger(WebSocketHub.class);

    private final Object lock = new Object();
    private final Set<WebSocketClient> clients = new LinkedHashSet<>();
    private final MetricsService metricsService;

    public WebSocketHub(MetricsService metricsService) {
        this.metricsService = metricsService;
        metricsService.registerClientGauge(this::clientCount);
    }

    public void add(WebSocketClient client) {
        int count;
        synchronized (lock) {
            clients.add(client);
            count = clients.size();
        }
        log.info("WebSocket client {} connected ({} total)", client.getId(), count);
    }

    public void remove(WebSocketClient client) {
        boolean removed;
        int count;
        synchronized (lock) {
            removed = clients.remove(client);
            count = clients.size();
        }
        if (removed) {
            log.info("WebSocket client {} disconnected ({} total)", client.getId(), count);
        }
    }

    /**
     * Sends the payload to every client connected at the time of the call.
     *
     * @return number of clients the frame was queued for
     */
    public int broadcast(String payload) {
        List<WebSocketClient> snapshot;
        synchronized (lock) {
            if (clients.isEmpty()) {
                return 0;
            }
            snapshot = new ArrayList<>(clients);
        }

        int delivered = 0;
        for (WebSocketClient client : snapshot) {
            if (client.send(payload)) {
                delivered++;
            } else if (client.isClosed()) {
                metricsService.recordDropClosed();
            } else {
                metricsService.recordDropBufferFull();
                log.debug("Dropping frame for slow client {}", client.getId());
            }
        }
        return delivered;
    }

    public void closeAll() {
        List<WebSocketClient> snapshot;
        synchronized (lock) {
            snapshot = new ArrayList<>(clients);
            clients.clear();
        }
        snapshot.forEach(WebSocketClient::close);
        if (!snapshot.isEmpty()) {
            log.info("Closed {} WebSocket clients", snapshot.size());
        }
    }

    public int clientCount() {
        synchronized (lock) {
            return clients.size();
        }
    }
}
