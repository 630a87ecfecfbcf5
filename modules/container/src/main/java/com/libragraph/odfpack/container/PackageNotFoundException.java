package com.libragraph.odfpack.container;

import java.nio.file.Path;

/**
 * Thrown when an open targets a path that does not exist.
 */
public class PackageNotFoundException extends OdfPackageException {

    private final Path path;

    public PackageNotFoundException(Path path) {
        super("Package not found: " + path);
        this.path = path;
    }

    public Path path() {
        return path;
    }
}
