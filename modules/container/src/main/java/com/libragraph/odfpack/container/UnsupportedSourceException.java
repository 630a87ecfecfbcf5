package com.libragraph.odfpack.container;

/**
 * Thrown when an open source is neither a ZIP archive nor a directory.
 */
public class UnsupportedSourceException extends OdfPackageException {

    public UnsupportedSourceException(String source) {
        super("Document format not managed: " + source);
    }
}
