package com.camfleet.core.discovery;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ServiceRecordTest {

    @Test
    void testAdvertise_CarriesTxtMetadata() {
        ServiceRecord record = ServiceRecord.advertise("Stage Left", "10.0.0.5", 8888);

        assertEquals("Stage Left", record.getTxt().get(ServiceRecord.TXT_ALIAS));
        assertEquals("1.0", record.getTxt().get(ServiceRecord.TXT_VERSION));
        assertEquals("camfleet-v1", record.getTxt().get(ServiceRecord.TXT_PROTOCOL));
        assertTrue(record.speaksProtocol());
    }

    @Test
    void testFromTxt_AliasFromTxtWins() {
        ServiceRecord record = ServiceRecord.fromTxt("cam-17._camfleet._tcp.local.", "10.0.0.7", 8888,
                Map.of(ServiceRecord.TXT_ALIAS, "Balcony"));

        assertEquals("Balcony", record.getAlias());
    }

    @Test
    void testFromTxt_FallsBackToInstanceName() {
        ServiceRecord record = ServiceRecord.fromTxt("cam-17._camfleet._tcp.local.", "10.0.0.7", 8888, null);

        assertEquals("cam-17", record.getAlias());
        assertTrue(record.speaksProtocol());
    }

    @Test
    void testForeignProtocol_NotSpoken() {
        ServiceRecord record = ServiceRecord.fromTxt("x", "10.0.0.7", 8888,
                Map.of(ServiceRecord.TXT_PROTOCOL, "other-v2"));

        assertFalse(record.speaksProtocol());
    }
}
