package com.libragraph.odfpack.container.writer;

import com.libragraph.odfpack.container.OdfPackageException;
import com.libragraph.odfpack.container.config.PackageConfig;
import com.libragraph.odfpack.container.store.PartEntry;
import com.libragraph.odfpack.container.store.PartStore;
import com.libragraph.odfpack.util.PartPaths;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFileAttributeView;
import java.util.Map;

/**
 * Writes every non-deleted part of a store as a file under a package folder.
 */
public final class FolderPackageWriter {

    private static final Logger log = Logger.getLogger(FolderPackageWriter.class);

    private final PackageConfig config;

    public FolderPackageWriter(PackageConfig config) {
        this.config = config;
    }

    public void write(PartStore store, Path folder) {
        Path root = folder.toAbsolutePath().normalize();
        try {
            Files.createDirectories(root);
            for (Map.Entry<String, PartEntry> e : store.entries().entrySet()) {
                if (e.getValue().isDeleted()) {
                    continue;
                }
                writePart(root, e.getKey(), e.getValue().data());
            }
        } catch (IOException e) {
            throw new OdfPackageException("Failed to write package folder " + root, e);
        }
        log.debugf("Wrote package folder %s (%d parts)", root, store.size());
    }

    private void writePart(Path root, String path, byte[] data) throws IOException {
        Path file = root.resolve(path).normalize();
        if (!file.startsWith(root) || file.equals(root)) {
            throw new OdfPackageException("Part path escapes the package folder: " + path);
        }
        if (PartPaths.isDirectory(path)) {
            Files.createDirectories(file);
            return;
        }
        Files.createDirectories(file.getParent());
        Files.write(file, data);
        applyPermissions(file);
    }

    private void applyPermissions(Path file) throws IOException {
        PosixFileAttributeView view = Files.getFileAttributeView(file, PosixFileAttributeView.class);
        if (view != null) {
            view.setPermissions(config.filePermissions());
        }
    }
}
