package com.phillippitts.sendspin.service.protocol;

import org.json.JSONObject;

import java.util.Objects;
import java.util.Optional;

/**
 * Decoded JSON envelope {@code {"type": ..., "payload": {...}}}.
 *
 * @param type raw wire type, possibly one this client does not know
 * @param payload payload object; empty when the envelope carried none
 */
public record SendspinMessage(String type, JSONObject payload) {

    public SendspinMessage {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(payload, "payload must not be null");
    }

    /** Known message type, or empty if the controller sent something newer than this client. */
    public Optional<MessageType> messageType() {
        return MessageType.fromWireName(type);
    }
}
