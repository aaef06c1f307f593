package com.phillippitts.sendspin.exception;

/**
 * Base exception for all Sendspin player errors.
 * All domain exceptions extend this class so callers can handle them in one place.
 */
public class SendspinException extends RuntimeException {

    public SendspinException(String message) {
        super(message);
    }

    public SendspinException(String message, Throwable cause) {
        super(message, cause);
    }

    public SendspinException(Throwable cause) {
        super(cause);
    }
}
