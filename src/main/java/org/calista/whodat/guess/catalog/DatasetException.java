package org.calista.whodat.guess.catalog;

import java.io.IOException;

/**
 * Malformed or inconsistent catalog. Fatal at startup: the kernel refuses to build.
 */
public final class DatasetException extends IOException {

    public DatasetException(String message) {
        super(message);
    }

    public DatasetException(String message, Throwable cause) {
        super(message, cause);
    }
}
