package com.libragraph.odfpack.container.backend;

import com.libragraph.odfpack.container.OdfPackageException;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Reads parts lazily from a ZIP package on disk.
 *
 * <p>No file handle is kept: each call reopens the archive. A ZIP package is
 * treated as immutable once opened, so fetched parts never need revalidation.
 */
public final class ZipPartBackend implements PartBackend {

    private static final Logger log = Logger.getLogger(ZipPartBackend.class);

    private final Path archive;

    public ZipPartBackend(Path archive) {
        this.archive = archive;
    }

    @Override
    public Optional<Path> location() {
        return Optional.of(archive);
    }

    @Override
    public List<String> listParts() {
        try {
            return ZipArchives.listNames(archive);
        } catch (IOException e) {
            throw new OdfPackageException("Failed to list parts of " + archive, e);
        }
    }

    /**
     * Reads one member. A corrupt archive is a soft failure: the part reads as not found.
     */
    @Override
    public Optional<FetchedPart> fetch(String path) {
        try {
            return ZipArchives.readMember(archive, path)
                    .map(data -> new FetchedPart(data, -1));
        } catch (IOException e) {
            log.debugf(e, "Cannot read part %s from %s", path, archive);
            return Optional.empty();
        }
    }

    @Override
    public String toString() {
        return "zip:" + archive;
    }
}
