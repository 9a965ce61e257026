package com.camfleet.console.discovery;

import com.camfleet.core.discovery.ServiceRecord;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * One browse cycle over {@value ServiceRecord#SERVICE_TYPE} advertisements.
 */
public interface DiscoveryBrowser {

    /**
     * Everything currently announced. Each call is a fresh cycle; nothing carries over.
     */
    Mono<List<ServiceRecord>> browse();
}
