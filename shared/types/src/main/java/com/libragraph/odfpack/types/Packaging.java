package com.libragraph.odfpack.types;

import java.util.Locale;

/**
 * How an ODF package is laid out on storage.
 */
public enum Packaging {
    ZIP("zip"),
    FOLDER("folder");

    private final String label;

    Packaging(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /**
     * Parses a packaging label, ignoring case and surrounding blanks.
     *
     * @throws IllegalArgumentException if the label names no supported packaging
     */
    public static Packaging fromLabel(String label) {
        if (label != null) {
            String cleaned = label.strip().toLowerCase(Locale.ROOT);
            for (Packaging p : values()) {
                if (p.label.equals(cleaned)) return p;
            }
        }
        throw new IllegalArgumentException("Packaging of type \"" + label + "\" is not supported");
    }

    @Override
    public String toString() {
        return label;
    }
}
