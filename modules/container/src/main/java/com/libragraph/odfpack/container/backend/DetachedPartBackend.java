package com.libragraph.odfpack.container.backend;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Backend of containers with no storage behind them: built from scratch,
 * read from a stream, or copied. Everything they hold is in the part store.
 */
public final class DetachedPartBackend implements PartBackend {

    public static final DetachedPartBackend INSTANCE = new DetachedPartBackend();

    private DetachedPartBackend() {
    }

    @Override
    public Optional<Path> location() {
        return Optional.empty();
    }

    @Override
    public List<String> listParts() {
        return List.of();
    }

    @Override
    public Optional<FetchedPart> fetch(String path) {
        return Optional.empty();
    }

    @Override
    public String toString() {
        return "detached";
    }
}
