package com.camfleet.core.discovery;

import lombok.Builder;
import lombok.Value;
import lombok.With;

import java.util.HashMap;
import java.util.Map;

/**
 * Network-service advertisement of one device, as published by the device and consumed by the
 * console's discovery browser.
 * <p>
 * The alias is the advertised instance name; TXT metadata carries {@code alias},
 * {@code version} and {@code protocol}.
 * </p>
 */
@Value
@Builder(toBuilder = true)
@With
public class ServiceRecord {
    public static final String SERVICE_TYPE = "_camfleet._tcp.local.";
    public static final String PROTOCOL = "camfleet-v1";
    public static final String VERSION = "1.0";

    public static final String TXT_ALIAS = "alias";
    public static final String TXT_VERSION = "version";
    public static final String TXT_PROTOCOL = "protocol";

    String alias;
    String host;
    int port;
    Map<String, String> txt;

    public static ServiceRecord advertise(String alias, String host, int port) {
        Map<String, String> txt = new HashMap<>();
        txt.put(TXT_ALIAS, alias);
        txt.put(TXT_VERSION, VERSION);
        txt.put(TXT_PROTOCOL, PROTOCOL);
        return new ServiceRecord(alias, host, port, Map.copyOf(txt));
    }

    /**
     * Builds a record from a resolved service instance; the TXT alias wins over the instance name.
     */
    public static ServiceRecord fromTxt(String instanceName, String host, int port, Map<String, String> txt) {
        Map<String, String> safeTxt = txt == null ? Map.of() : Map.copyOf(txt);
        String alias = safeTxt.getOrDefault(TXT_ALIAS, stripServiceType(instanceName));
        return new ServiceRecord(alias, host, port, safeTxt);
    }

    /**
     * @return true when the advertised protocol is absent (older devices) or matches ours
     */
    public boolean speaksProtocol() {
        String protocol = txt == null ? null : txt.get(TXT_PROTOCOL);
        return protocol == null || PROTOCOL.equals(protocol);
    }

    private static String stripServiceType(String fullName) {
        if (fullName == null) {
            return "";
        }
        String name = fullName;
        if (name.endsWith(SERVICE_TYPE)) {
            name = name.substring(0, name.length() - SERVICE_TYPE.length());
        }
        while (name.endsWith(".")) {
            name = name.substring(0, name.length() - 1);
        }
        return name;
    }
}
