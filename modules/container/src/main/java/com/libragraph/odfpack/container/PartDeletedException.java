package com.libragraph.odfpack.container;

/**
 * Thrown when reading a part that was explicitly deleted. The container stays usable.
 */
public class PartDeletedException extends OdfPackageException {

    private final String part;

    public PartDeletedException(String part) {
        super("Part \"" + part + "\" is deleted");
        this.part = part;
    }

    public String part() {
        return part;
    }
}
