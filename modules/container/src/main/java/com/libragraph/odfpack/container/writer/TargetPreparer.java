package com.libragraph.odfpack.container.writer;

import org.jboss.logging.Logger;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.BasicFileAttributes;

/**
 * Gets a save target out of the way: renamed aside as a backup, or removed.
 *
 * <p>Failures here never abort a save; they are logged as warnings.
 */
public final class TargetPreparer {

    private static final Logger log = Logger.getLogger(TargetPreparer.class);

    private TargetPreparer() {
    }

    /**
     * Name of the backup of {@code target}: {@code <stem>.backup<suffix>}, next to it.
     * The suffix is the last extension, dot included, or empty.
     */
    public static Path backupPath(Path target) {
        String name = target.getFileName().toString();
        int dot = name.lastIndexOf('.');
        String stem = dot > 0 ? name.substring(0, dot) : name;
        String suffix = dot > 0 ? name.substring(dot) : "";
        return target.resolveSibling(stem + ".backup" + suffix);
    }

    /**
     * Renames an existing target to its backup name, replacing an older backup.
     * Does nothing if the target does not exist.
     */
    public static void backup(Path target) {
        if (!Files.exists(target, LinkOption.NOFOLLOW_LINKS)) {
            return;
        }
        Path backup = backupPath(target);
        if (Files.isDirectory(backup, LinkOption.NOFOLLOW_LINKS)) {
            try {
                deleteRecursively(backup);
            } catch (IOException e) {
                log.warnf(e, "Failed to remove old backup %s", backup);
            }
        }
        try {
            Files.move(target, backup, StandardCopyOption.REPLACE_EXISTING);
            log.debugf("Backed up %s to %s", target, backup);
        } catch (IOException e) {
            log.warnf(e, "Failed to back up %s to %s", target, backup);
        }
    }

    /**
     * Removes an existing target, recursively for directories.
     */
    public static void clear(Path target) {
        if (!Files.exists(target, LinkOption.NOFOLLOW_LINKS)) {
            return;
        }
        try {
            deleteRecursively(target);
        } catch (IOException e) {
            log.warnf(e, "Failed to remove %s", target);
        }
    }

    static void deleteRecursively(Path path) throws IOException {
        if (!Files.isDirectory(path, LinkOption.NOFOLLOW_LINKS)) {
            Files.delete(path);
            return;
        }
        Files.walkFileTree(path, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs)
                    throws IOException {
                Files.delete(file);
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult postVisitDirectory(Path dir, IOException exc)
                    throws IOException {
                if (exc != null) {
                    throw exc;
                }
                Files.delete(dir);
                return FileVisitResult.CONTINUE;
            }
        });
    }
}
