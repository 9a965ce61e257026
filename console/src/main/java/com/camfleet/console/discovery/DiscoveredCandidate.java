package com.camfleet.console.discovery;

import com.camfleet.console.client.DeviceAddress;
import com.camfleet.core.discovery.ServiceRecord;
import lombok.Value;

import java.util.Map;

/**
 * An unclaimed device seen in the latest browse cycle. Never persisted.
 */
@Value
public class DiscoveredCandidate {
    String id;
    String alias;
    String host;
    int port;
    Map<String, String> metadata;

    static DiscoveredCandidate from(ServiceRecord record) {
        return new DiscoveredCandidate(
                DeviceAddress.idOf(record.getHost(), record.getPort()),
                record.getAlias(),
                record.getHost(),
                record.getPort(),
                record.getTxt());
    }
}
