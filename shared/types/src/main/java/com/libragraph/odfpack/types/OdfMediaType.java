package com.libragraph.odfpack.types;

import java.util.Optional;

/**
 * The ODF media types accepted in a package's {@code mimetype} part.
 */
public enum OdfMediaType {
    TEXT("odt", "application/vnd.oasis.opendocument.text"),
    TEXT_TEMPLATE("ott", "application/vnd.oasis.opendocument.text-template"),
    SPREADSHEET("ods", "application/vnd.oasis.opendocument.spreadsheet"),
    SPREADSHEET_TEMPLATE("ots", "application/vnd.oasis.opendocument.spreadsheet-template"),
    PRESENTATION("odp", "application/vnd.oasis.opendocument.presentation"),
    PRESENTATION_TEMPLATE("otp", "application/vnd.oasis.opendocument.presentation-template"),
    DRAWING("odg", "application/vnd.oasis.opendocument.graphics"),
    DRAWING_TEMPLATE("otg", "application/vnd.oasis.opendocument.graphics-template"),
    CHART("odc", "application/vnd.oasis.opendocument.chart"),
    CHART_TEMPLATE("otc", "application/vnd.oasis.opendocument.chart-template"),
    FORMULA("odf", "application/vnd.oasis.opendocument.formula"),
    FORMULA_TEMPLATE("otf", "application/vnd.oasis.opendocument.formula-template"),
    IMAGE("odi", "application/vnd.oasis.opendocument.image"),
    IMAGE_TEMPLATE("oti", "application/vnd.oasis.opendocument.image-template"),
    TEXT_MASTER("odm", "application/vnd.oasis.opendocument.text-master"),
    TEXT_WEB("oth", "application/vnd.oasis.opendocument.text-web"),
    DATABASE("odb", "application/vnd.oasis.opendocument.base");

    private final String extension;
    private final String mimeType;

    OdfMediaType(String extension, String mimeType) {
        this.extension = extension;
        this.mimeType = mimeType;
    }

    public String extension() {
        return extension;
    }

    public String mimeType() {
        return mimeType;
    }

    public static Optional<OdfMediaType> fromMimeType(String mimeType) {
        for (OdfMediaType t : values()) {
            if (t.mimeType.equals(mimeType)) return Optional.of(t);
        }
        return Optional.empty();
    }

    /**
     * Looks up a media type by file extension, with or without the leading dot.
     *
     * @throws IllegalArgumentException for an extension that is not an ODF one
     */
    public static OdfMediaType fromExtension(String extension) {
        String ext = extension.startsWith(".") ? extension.substring(1) : extension;
        for (OdfMediaType t : values()) {
            if (t.extension.equalsIgnoreCase(ext)) return t;
        }
        throw new IllegalArgumentException("Unknown ODF extension: " + extension);
    }

    public static boolean isKnown(String mimeType) {
        return fromMimeType(mimeType).isPresent();
    }
}
