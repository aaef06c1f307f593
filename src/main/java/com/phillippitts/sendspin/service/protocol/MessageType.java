package com.phillippitts.sendspin.service.protocol;

import java.util.Arrays;
import java.util.Optional;

/**
 * JSON control message types and their wire names.
 */
public enum MessageType {
    CLIENT_HELLO("client/hello"),
    SERVER_HELLO("server/hello"),
    CLIENT_TIME("client/time"),
    SERVER_TIME("server/time"),
    CLIENT_STATE("client/state"),
    SERVER_STATE("server/state"),
    SERVER_COMMAND("server/command"),
    STREAM_START("stream/start"),
    STREAM_CLEAR("stream/clear"),
    STREAM_END("stream/end"),
    STREAM_REQUEST_FORMAT("stream/request-format");

    private final String wireName;

    MessageType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * Looks up a type by its wire name.
     *
     * @param wireName value of the envelope's {@code type} field
     * @return the matching type, or empty for unknown names
     */
    public static Optional<MessageType> fromWireName(String wireName) {
        return Arrays.stream(values())
                .filter(t -> t.wireName.equals(wireName))
                .findFirst();
    }
}
