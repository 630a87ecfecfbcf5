package com.libragraph.odfpack.container.backend;

import com.libragraph.odfpack.container.OdfPackageException;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Reads parts from an expanded package directory, one file per part.
 *
 * <p>The directory is a live view: cached parts are checked against the file's
 * modification time, truncated to whole seconds.
 */
public final class FolderPartBackend implements PartBackend {

    private final Path root;

    public FolderPartBackend(Path root) {
        this.root = root;
    }

    @Override
    public Optional<Path> location() {
        return Optional.of(root);
    }

    /**
     * Walks the tree. Dot-entries are skipped; a directory is listed, with a
     * trailing slash, only when nothing below it is listed.
     */
    @Override
    public List<String> listParts() {
        List<String> parts = new ArrayList<>();
        try {
            collect(root, parts);
        } catch (IOException e) {
            throw new OdfPackageException("Failed to list parts of " + root, e);
        }
        return parts;
    }

    private void collect(Path dir, List<String> parts) throws IOException {
        List<Path> children = new ArrayList<>();
        try (DirectoryStream<Path> entries = Files.newDirectoryStream(dir)) {
            for (Path child : entries) {
                if (!child.getFileName().toString().startsWith(".")) {
                    children.add(child);
                }
            }
        }
        children.sort(null);

        for (Path child : children) {
            if (Files.isDirectory(child)) {
                int before = parts.size();
                collect(child, parts);
                if (parts.size() == before) {
                    parts.add(relativize(child) + "/");
                }
            } else if (Files.isRegularFile(child)) {
                parts.add(relativize(child));
            }
        }
    }

    @Override
    public Optional<FetchedPart> fetch(String path) {
        Path file = resolve(path);
        try {
            long timestamp = seconds(file);
            byte[] data = Files.isDirectory(file) ? new byte[0] : Files.readAllBytes(file);
            return Optional.of(new FetchedPart(data, timestamp));
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            throw new OdfPackageException("Failed to read part " + path + " from " + root, e);
        }
    }

    @Override
    public boolean isLive() {
        return true;
    }

    @Override
    public long timestamp(String path) {
        try {
            return seconds(resolve(path));
        } catch (IOException e) {
            return -1;
        }
    }

    private Path resolve(String path) {
        String relative = path.endsWith("/") ? path.substring(0, path.length() - 1) : path;
        Path file = root.resolve(relative).normalize();
        if (!file.startsWith(root)) {
            throw new OdfPackageException("Part path escapes the package folder: " + path);
        }
        return file;
    }

    private String relativize(Path child) {
        return root.relativize(child).toString().replace('\\', '/');
    }

    private static long seconds(Path file) throws IOException {
        return Files.getLastModifiedTime(file).to(TimeUnit.SECONDS);
    }

    @Override
    public String toString() {
        return "folder:" + root;
    }
}
