package com.libragraph.odfpack.container;

/**
 * Thrown when a save target cannot hold the requested packaging,
 * e.g. folder packaging onto a stream.
 */
public class UnsupportedTargetException extends OdfPackageException {

    public UnsupportedTargetException(String message) {
        super(message);
    }
}
