package com.phillippitts.sendspin.exception;

import java.nio.file.Path;

/**
 * Thrown when the persisted client id file cannot be read or written.
 *
 * <p>An unreadable existing file is fatal; a failed write only costs persistence.
 */
public class ClientIdentityException extends SendspinException {

    private final Path idFile;

    public ClientIdentityException(String message, Path idFile, Throwable cause) {
        super(message + ": " + idFile, cause);
        this.idFile = idFile;
    }

    public Path getIdFile() {
        return idFile;
    }
}
