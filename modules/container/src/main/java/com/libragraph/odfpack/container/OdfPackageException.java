package com.libragraph.odfpack.container;

/**
 * Base of all package errors. Also wraps checked I/O exceptions from backends and writers.
 */
public class OdfPackageException extends RuntimeException {

    public OdfPackageException(String message, Throwable cause) {
        super(message, cause);
    }

    public OdfPackageException(String message) {
        super(message);
    }
}
