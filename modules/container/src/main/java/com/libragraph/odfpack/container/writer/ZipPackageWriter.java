package com.libragraph.odfpack.container.writer;

import com.libragraph.odfpack.container.MissingMimeTypeException;
import com.libragraph.odfpack.container.OdfPackageException;
import com.libragraph.odfpack.container.config.PackageConfig;
import com.libragraph.odfpack.container.store.PartEntry;
import com.libragraph.odfpack.container.store.PartStore;
import com.libragraph.odfpack.util.PartPaths;
import org.apache.commons.compress.archivers.zip.ZipArchiveEntry;
import org.apache.commons.compress.archivers.zip.ZipArchiveOutputStream;
import org.jboss.logging.Logger;

import java.io.FilterOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import java.util.zip.CRC32;

/**
 * Serializes a part store as an ODF ZIP package.
 *
 * <p>Member order is fixed: {@code mimetype} (STORED), then content, meta,
 * settings and styles, then every other part in store order, then
 * {@code META-INF/manifest.xml}. Deleted parts are not written.
 */
public final class ZipPackageWriter {

    private static final Logger log = Logger.getLogger(ZipPackageWriter.class);

    private final PackageConfig config;

    public ZipPackageWriter(PackageConfig config) {
        this.config = config;
    }

    /**
     * Writes the package to a file, replacing it.
     */
    public void write(PartStore store, Path target) {
        byte[] mimetype = requireMimetype(store);
        try (ZipArchiveOutputStream zip = new ZipArchiveOutputStream(target)) {
            writeEntries(zip, store, mimetype);
        } catch (IOException e) {
            throw new OdfPackageException("Failed to write ZIP package " + target, e);
        }
        log.debugf("Wrote ZIP package %s (%d parts)", target, store.size());
    }

    /**
     * Writes the package to a caller-owned stream. The stream is not closed.
     */
    public void write(PartStore store, OutputStream target) {
        byte[] mimetype = requireMimetype(store);
        try (ZipArchiveOutputStream zip = new ZipArchiveOutputStream(new NonClosingOutputStream(target))) {
            writeEntries(zip, store, mimetype);
        } catch (IOException e) {
            throw new OdfPackageException("Failed to write ZIP package to stream", e);
        }
    }

    private void writeEntries(ZipArchiveOutputStream zip, PartStore store, byte[] mimetype) throws IOException {
        zip.setEncoding(StandardCharsets.UTF_8.name());
        zip.setLevel(config.compressionLevel());
        long now = System.currentTimeMillis();

        writeMimetype(zip, mimetype, now);

        for (String path : PartPaths.CANONICAL_XML_PARTS) {
            Optional<byte[]> data = liveBytes(store, path);
            if (data.isPresent()) {
                writeDeflated(zip, path, data.get(), now);
            } else {
                log.warnf("Missing '%s'", path);
            }
        }

        for (Map.Entry<String, PartEntry> e : store.entries().entrySet()) {
            String path = e.getKey();
            if (isPlacedExplicitly(path) || e.getValue().isDeleted()) {
                continue;
            }
            if (PartPaths.isDirectory(path)) {
                writeDirectory(zip, path, now);
            } else {
                writeDeflated(zip, path, e.getValue().data(), now);
            }
        }

        Optional<byte[]> manifest = liveBytes(store, PartPaths.MANIFEST);
        if (manifest.isPresent()) {
            writeDeflated(zip, PartPaths.MANIFEST, manifest.get(), now);
        } else {
            log.warnf("Missing '%s'", PartPaths.MANIFEST);
        }
    }

    private static boolean isPlacedExplicitly(String path) {
        return path.equals(PartPaths.MIMETYPE)
                || path.equals(PartPaths.MANIFEST)
                || PartPaths.CANONICAL_XML_PARTS.contains(path);
    }

    /**
     * Returns the mimetype bytes a ZIP save would write first.
     *
     * @throws MissingMimeTypeException if the store has no mimetype or it is deleted
     */
    public static byte[] requireMimetype(PartStore store) {
        return liveBytes(store, PartPaths.MIMETYPE).orElseThrow(MissingMimeTypeException::new);
    }

    private static Optional<byte[]> liveBytes(PartStore store, String path) {
        return store.get(path)
                .filter(entry -> !entry.isDeleted())
                .map(PartEntry::data);
    }

    // STORED entries need size and CRC before the data is written
    private static void writeMimetype(ZipArchiveOutputStream zip, byte[] data, long time) throws IOException {
        CRC32 crc = new CRC32();
        crc.update(data);

        ZipArchiveEntry entry = new ZipArchiveEntry(PartPaths.MIMETYPE);
        entry.setMethod(ZipArchiveEntry.STORED);
        entry.setSize(data.length);
        entry.setCompressedSize(data.length);
        entry.setCrc(crc.getValue());
        entry.setTime(time);

        zip.putArchiveEntry(entry);
        zip.write(data);
        zip.closeArchiveEntry();
    }

    private static void writeDeflated(ZipArchiveOutputStream zip, String path, byte[] data, long time) throws IOException {
        ZipArchiveEntry entry = new ZipArchiveEntry(path);
        entry.setMethod(ZipArchiveEntry.DEFLATED);
        entry.setTime(time);
        zip.putArchiveEntry(entry);
        zip.write(data);
        zip.closeArchiveEntry();
    }

    private static void writeDirectory(ZipArchiveOutputStream zip, String path, long time) throws IOException {
        ZipArchiveEntry entry = new ZipArchiveEntry(path);
        entry.setTime(time);
        zip.putArchiveEntry(entry);
        zip.closeArchiveEntry();
    }

    // Closing the archive ends its Deflater; the caller's stream stays open, flushed
    private static final class NonClosingOutputStream extends FilterOutputStream {

        NonClosingOutputStream(OutputStream out) {
            super(out);
        }

        @Override
        public void write(byte[] b, int off, int len) throws IOException {
            out.write(b, off, len);
        }

        @Override
        public void close() throws IOException {
            flush();
        }
    }
}
