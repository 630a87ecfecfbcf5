package com.libragraph.odfpack.container.backend;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Where a container's parts come from when they are not in memory yet.
 *
 * <p>Backends only read. All writes happen in the part store and reach
 * storage through the package writers on save.
 */
public interface PartBackend {

    /**
     * The filesystem location the parts are read from, if any.
     */
    Optional<Path> location();

    /**
     * Lists the parts currently present in storage, as normalized part paths.
     * Re-reads storage on every call.
     */
    List<String> listParts();

    /**
     * Reads one part, or returns empty when storage does not hold it.
     */
    Optional<FetchedPart> fetch(String path);

    /**
     * Whether cached bytes can go stale and must be checked with {@link #timestamp(String)}.
     */
    default boolean isLive() {
        return false;
    }

    /**
     * Current modification time of a part in whole seconds, or {@code -1} if unknown.
     */
    default long timestamp(String path) {
        return -1;
    }
}
