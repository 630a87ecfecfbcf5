package com.libragraph.odfpack.container;

/**
 * Thrown when a ZIP package is saved without a {@code mimetype} part.
 */
public class MissingMimeTypeException extends OdfPackageException {

    public MissingMimeTypeException() {
        super("Mimetype is not defined");
    }
}
