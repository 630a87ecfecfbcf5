package com.libragraph.odfpack.container.backend;

import com.libragraph.odfpack.util.PartPaths;
import com.libragraph.odfpack.util.buffer.BinaryData;
import org.apache.commons.compress.archivers.zip.ZipArchiveEntry;
import org.apache.commons.compress.archivers.zip.ZipFile;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.nio.channels.SeekableByteChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Enumeration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * ZIP reading helpers shared by the container and {@link ZipPartBackend}.
 *
 * <p>Every method opens the archive, does its work and closes it again.
 */
public final class ZipArchives {

    private static final Logger log = Logger.getLogger(ZipArchives.class);

    private static final byte[] ZIP_MAGIC = new byte[]{0x50, 0x4B, 0x03, 0x04}; // "PK\u0003\u0004"

    private ZipArchives() {
    }

    /**
     * Checks for the ZIP local-file-header magic at the start of a regular file.
     */
    public static boolean hasZipMagic(Path path) {
        if (!Files.isRegularFile(path)) {
            return false;
        }
        try (InputStream in = Files.newInputStream(path)) {
            return Arrays.equals(in.readNBytes(ZIP_MAGIC.length), ZIP_MAGIC);
        } catch (IOException e) {
            log.debugf(e, "Cannot check %s for ZIP magic", path);
            return false;
        }
    }

    /**
     * Checks for the ZIP magic without moving the data's position.
     */
    public static boolean hasZipMagic(BinaryData data) {
        return Arrays.equals(data.readHeader(ZIP_MAGIC.length), ZIP_MAGIC);
    }

    /**
     * Lists the members of an archive as normalized part paths, in central directory order.
     */
    public static List<String> listNames(Path archive) throws IOException {
        List<String> names = new ArrayList<>();
        try (ZipFile zip = ZipFile.builder().setPath(archive).get()) {
            Enumeration<ZipArchiveEntry> entries = zip.getEntries();
            while (entries.hasMoreElements()) {
                names.add(PartPaths.normalize(entries.nextElement().getName()));
            }
        }
        return names;
    }

    /**
     * Reads a single member. Empty if the archive has no such member.
     *
     * @throws IOException if the archive cannot be read
     */
    public static Optional<byte[]> readMember(Path archive, String path) throws IOException {
        try (ZipFile zip = ZipFile.builder().setPath(archive).get()) {
            ZipArchiveEntry entry = findEntry(zip, path);
            if (entry == null) {
                return Optional.empty();
            }
            return Optional.of(readEntry(zip, entry));
        }
    }

    /**
     * Reads every member of an archive held in a channel, keyed by normalized part path.
     * The channel is left open; its position is undefined afterwards.
     *
     * @throws IOException if the archive is corrupt
     */
    public static Map<String, byte[]> readAll(SeekableByteChannel channel) throws IOException {
        Map<String, byte[]> parts = new LinkedHashMap<>();
        try (ZipFile zip = ZipFile.builder().setSeekableByteChannel(BinaryData.unclosable(channel)).get()) {
            Enumeration<ZipArchiveEntry> entries = zip.getEntries();
            while (entries.hasMoreElements()) {
                ZipArchiveEntry entry = entries.nextElement();
                parts.put(PartPaths.normalize(entry.getName()), readEntry(zip, entry));
            }
        }
        return parts;
    }

    private static ZipArchiveEntry findEntry(ZipFile zip, String path) {
        ZipArchiveEntry entry = zip.getEntry(path);
        if (entry != null) {
            return entry;
        }
        // Member names written with other separators
        Enumeration<ZipArchiveEntry> entries = zip.getEntries();
        while (entries.hasMoreElements()) {
            ZipArchiveEntry candidate = entries.nextElement();
            if (PartPaths.normalize(candidate.getName()).equals(path)) {
                return candidate;
            }
        }
        return null;
    }

    private static byte[] readEntry(ZipFile zip, ZipArchiveEntry entry) throws IOException {
        if (entry.isDirectory()) {
            return new byte[0];
        }
        try (InputStream in = zip.getInputStream(entry)) {
            return in.readAllBytes();
        }
    }
}
