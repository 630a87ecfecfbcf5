package com.libragraph.odfpack.container;

/**
 * Thrown when a package's {@code mimetype} part is not one of the ODF media types.
 */
public class UnknownMimeTypeException extends OdfPackageException {

    private final String mimeType;

    public UnknownMimeTypeException(String mimeType) {
        super("Document of unknown type \"" + mimeType + "\"");
        this.mimeType = mimeType;
    }

    public String mimeType() {
        return mimeType;
    }
}
