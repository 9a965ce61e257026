package com.camfleet.console.discovery;

import com.camfleet.core.discovery.ServiceRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Browser over a fixed list of {@code alias@host:port} entries, separated by commas.
 */
public class StaticDiscoveryBrowser implements DiscoveryBrowser {
    private static final Logger log = LoggerFactory.getLogger(StaticDiscoveryBrowser.class);

    private final List<ServiceRecord> records;

    public StaticDiscoveryBrowser(String entries) {
        this.records = Collections.unmodifiableList(parse(entries));
        log.info("Static discovery configured with {} entries", records.size());
    }

    @Override
    public Mono<List<ServiceRecord>> browse() {
        return Mono.just(records);
    }

    static List<ServiceRecord> parse(String entries) {
        List<ServiceRecord> parsed = new ArrayList<>();
        if (entries == null || entries.isBlank()) {
            return parsed;
        }
        for (String raw : entries.split(",")) {
            String entry = raw.trim();
            if (entry.isEmpty()) {
                continue;
            }
            int at = entry.indexOf('@');
            int colon = entry.lastIndexOf(':');
            if (at <= 0 || colon < at + 2 || colon == entry.length() - 1) {
                log.warn("Ignoring malformed discovery entry '{}', expected alias@host:port", entry);
                continue;
            }
            try {
                int port = Integer.parseInt(entry.substring(colon + 1));
                parsed.add(ServiceRecord.advertise(entry.substring(0, at), entry.substring(at + 1, colon), port));
            } catch (NumberFormatException e) {
                log.warn("Ignoring discovery entry '{}' with invalid port", entry);
            }
        }
        return parsed;
    }
}
