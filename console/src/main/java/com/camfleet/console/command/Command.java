package com.camfleet.console.command;

import com.camfleet.core.error.ApiException;
import lombok.Value;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * An operation, its payload and the devices it targets.
 * <p>
 * Targets are de-duplicated in request order, so a group result has exactly one entry per
 * distinct id.
 * </p>
 */
@Value
public class Command {
    CommandType type;
    Set<String> targets;
    Object payload;

    private Command(CommandType type, Set<String> targets, Object payload) {
        this.type = type;
        this.targets = targets;
        this.payload = payload;
    }

    /**
     * @throws ApiException INVALID_REQUEST when the payload is missing or of the wrong type
     */
    public static Command of(CommandType type, Collection<String> targets, Object payload) {
        if (payload == null && type.payloadRequired()) {
            throw ApiException.invalidRequest(type.wireName() + " requires a payload");
        }
        if (payload != null && (type.payloadType() == null || !type.payloadType().isInstance(payload))) {
            throw ApiException.invalidRequest("unexpected payload for " + type.wireName());
        }
        return new Command(type, Collections.unmodifiableSet(new LinkedHashSet<>(targets)), payload);
    }

    public static Command single(CommandType type, String deviceId, Object payload) {
        return of(type, Set.of(deviceId), payload);
    }

    public <T> T payloadAs(Class<T> type) {
        return type.cast(payload);
    }
}
