package com.phillippitts.sendspin.exception;

/**
 * Thrown when a protocol message is structurally valid JSON but misses required fields
 * or carries values of the wrong type.
 *
 * <p>Never escapes the codec: public decode methods translate it into an empty result.
 */
public class ProtocolException extends SendspinException {

    private final String messageType;

    public ProtocolException(String messageType, String message) {
        super("Malformed " + messageType + ": " + message);
        this.messageType = messageType;
    }

    public ProtocolException(String messageType, String message, Throwable cause) {
        super("Malformed " + messageType + ": " + message, cause);
        this.messageType = messageType;
    }

    public String getMessageType() {
        return messageType;
    }
}
