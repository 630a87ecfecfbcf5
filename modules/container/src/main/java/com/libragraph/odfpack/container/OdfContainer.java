package com.libragraph.odfpack.container;

import com.libragraph.odfpack.container.backend.DetachedPartBackend;
import com.libragraph.odfpack.container.backend.FetchedPart;
import com.libragraph.odfpack.container.backend.FolderPartBackend;
import com.libragraph.odfpack.container.backend.PartBackend;
import com.libragraph.odfpack.container.backend.ZipArchives;
import com.libragraph.odfpack.container.backend.ZipPartBackend;
import com.libragraph.odfpack.container.config.PackageConfig;
import com.libragraph.odfpack.container.store.PartEntry;
import com.libragraph.odfpack.container.store.PartStore;
import com.libragraph.odfpack.container.writer.FolderPackageWriter;
import com.libragraph.odfpack.container.writer.TargetPreparer;
import com.libragraph.odfpack.container.writer.ZipPackageWriter;
import com.libragraph.odfpack.types.OdfMediaType;
import com.libragraph.odfpack.types.Packaging;
import com.libragraph.odfpack.types.PartState;
import com.libragraph.odfpack.util.PartPaths;
import com.libragraph.odfpack.util.buffer.BinaryData;
import com.libragraph.odfpack.util.buffer.Buffer;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * An ODF package: a mutable set of named parts, read lazily from a ZIP
 * archive or an expanded folder and written back as either.
 *
 * <p>Reads go through an in-memory {@link PartStore} in front of the
 * backend the container was opened from. Writes ({@link #setPart},
 * {@link #deletePart}) only touch the store; storage is written on
 * {@link #save}.
 *
 * <p>Caching depends on the packaging. Parts read from a ZIP archive are
 * kept for the life of the container. Parts read from a folder are checked
 * against the file's modification time on every access and re-read when it
 * changed. Parts set in memory are always returned as set.
 *
 * <p>Not thread-safe. Use one container per thread.
 */
public final class OdfContainer {

    private static final Logger log = Logger.getLogger(OdfContainer.class);

    private static final String OFFICE_VERSION = "1.2";

    private final PackageConfig config;
    private final PartStore store;
    private final PartBackend backend;
    private final Packaging packaging;

    /**
     * Creates an empty container with ZIP packaging and no location.
     */
    public OdfContainer() {
        this(PackageConfig.load());
    }

    public OdfContainer(PackageConfig config) {
        this(config, new PartStore(), DetachedPartBackend.INSTANCE, Packaging.ZIP);
    }

    private OdfContainer(PackageConfig config, PartStore store, PartBackend backend, Packaging packaging) {
        this.config = Objects.requireNonNull(config, "Config cannot be null");
        this.store = store;
        this.backend = backend;
        this.packaging = packaging;
    }

    // -- open --

    public static OdfContainer open(String path) {
        return open(Path.of(path));
    }

    public static OdfContainer open(Path path) {
        return open(path, PackageConfig.load());
    }

    /**
     * Opens a ZIP package file or a package folder.
     *
     * <p>A ZIP file stays on disk and its parts are read on demand; only its
     * {@code mimetype} is read now, to validate it.
     *
     * @throws PackageNotFoundException  if nothing exists at {@code path}
     * @throws UnknownMimeTypeException  if a ZIP package has no known ODF mimetype
     * @throws UnsupportedSourceException if {@code path} is neither a ZIP file nor a directory
     */
    public static OdfContainer open(Path path, PackageConfig config) {
        Objects.requireNonNull(path, "Path cannot be null");
        Path source = expandHome(path).toAbsolutePath().normalize();
        if (!Files.exists(source)) {
            throw new PackageNotFoundException(source);
        }
        if (ZipArchives.hasZipMagic(source)) {
            return bindZip(source, config);
        }
        if (Files.isDirectory(source)) {
            return bindFolder(source, config);
        }
        throw new UnsupportedSourceException(source.toString());
    }

    public static OdfContainer open(byte[] data) {
        return open(BinaryData.wrap(data));
    }

    /**
     * Reads a whole ZIP package from a stream. The stream is read to its end but not closed.
     */
    public static OdfContainer open(InputStream in) {
        try (Buffer buffer = Buffer.copyOf(in, -1)) {
            return open(buffer);
        } catch (IOException e) {
            throw new OdfPackageException("Failed to read package stream", e);
        }
    }

    public static OdfContainer open(BinaryData data) {
        return open(data, PackageConfig.load());
    }

    /**
     * Loads every part of an in-memory ZIP package. The returned container
     * keeps no reference to {@code data}, whose position is reset to 0.
     *
     * @throws UnsupportedSourceException if the data is not a ZIP archive
     * @throws UnknownMimeTypeException   if the package has no known ODF mimetype
     */
    public static OdfContainer open(BinaryData data, PackageConfig config) {
        Objects.requireNonNull(data, "Data cannot be null");
        if (!ZipArchives.hasZipMagic(data)) {
            throw new UnsupportedSourceException(data.getClass().getSimpleName());
        }

        Map<String, byte[]> parts;
        try {
            parts = ZipArchives.readAll(data);
        } catch (IOException e) {
            throw new OdfPackageException("Cannot read ZIP archive from " + data.getClass().getSimpleName(), e);
        } finally {
            rewind(data);
        }

        byte[] mimetype = parts.get(PartPaths.MIMETYPE);
        requireKnownMimetype(mimetype);

        PartStore store = new PartStore();
        parts.forEach((path, bytes) -> store.put(path, PartEntry.loaded(bytes, PartEntry.NO_TIMESTAMP)));
        log.debugf("Loaded %d parts from in-memory package", store.size());
        return new OdfContainer(config, store, DetachedPartBackend.INSTANCE, Packaging.ZIP);
    }

    private static OdfContainer bindZip(Path archive, PackageConfig config) {
        byte[] mimetype;
        try {
            mimetype = ZipArchives.readMember(archive, PartPaths.MIMETYPE).orElse(null);
        } catch (IOException e) {
            throw new OdfPackageException("Cannot read ZIP archive " + archive, e);
        }
        requireKnownMimetype(mimetype);

        PartStore store = new PartStore();
        store.put(PartPaths.MIMETYPE, PartEntry.loaded(mimetype, PartEntry.NO_TIMESTAMP));
        log.debugf("Opened ZIP package %s", archive);
        return new OdfContainer(config, store, new ZipPartBackend(archive), Packaging.ZIP);
    }

    private static OdfContainer bindFolder(Path root, PackageConfig config) {
        FolderPartBackend backend = new FolderPartBackend(root);
        PartStore store = new PartStore();
        byte[] fallback = config.fallbackMediaType().mimeType().getBytes(StandardCharsets.US_ASCII);

        Optional<FetchedPart> mimetype;
        try {
            mimetype = backend.fetch(PartPaths.MIMETYPE);
        } catch (OdfPackageException e) {
            log.warnf(e, "Cannot read mimetype of %s", root);
            mimetype = Optional.empty();
        }

        if (mimetype.isEmpty()) {
            log.warnf("Corrupted or not an OpenDocument folder (missing mimetype): %s", root);
            store.put(PartPaths.MIMETYPE, PartEntry.synthesized(fallback, System.currentTimeMillis() / 1000));
        } else {
            FetchedPart part = mimetype.get();
            String value = decode(part.data());
            if (OdfMediaType.isKnown(value)) {
                store.put(PartPaths.MIMETYPE, PartEntry.loaded(part.data(), part.timestamp()));
            } else {
                log.warnf("Document of unknown type \"%s\" in %s, using %s",
                        value, root, config.fallbackMediaType().mimeType());
                store.put(PartPaths.MIMETYPE, PartEntry.synthesized(fallback, part.timestamp()));
            }
        }
        log.debugf("Opened package folder %s", root);
        return new OdfContainer(config, store, backend, Packaging.FOLDER);
    }

    private static void requireKnownMimetype(byte[] mimetype) {
        String value = mimetype == null ? "" : decode(mimetype);
        if (!OdfMediaType.isKnown(value)) {
            throw new UnknownMimeTypeException(value);
        }
    }

    private static Path expandHome(Path path) {
        if (path.isAbsolute() || path.getNameCount() == 0 || !path.getName(0).toString().equals("~")) {
            return path;
        }
        Path home = Path.of(System.getProperty("user.home"));
        return path.getNameCount() == 1 ? home : home.resolve(path.subpath(1, path.getNameCount()));
    }

    private static void rewind(BinaryData data) {
        try {
            data.position(0);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to rewind package data", e);
        }
    }

    private static String decode(byte[] data) {
        return new String(data, StandardCharsets.UTF_8);
    }

    // -- parts --

    /**
     * Returns the bytes of a part, or {@code null} if the package has no such part.
     *
     * @throws PartDeletedException if the part was deleted with {@link #deletePart}
     */
    public byte[] getPart(String path) {
        String part = PartPaths.normalize(path);
        Optional<PartEntry> cached = store.get(part);
        if (cached.isPresent()) {
            PartEntry entry = cached.get();
            if (entry.isDeleted()) {
                throw new PartDeletedException(part);
            }
            if (entry.state() == PartState.LOADED && backend.isLive()) {
                return revalidate(part, entry);
            }
            return entry.data();
        }
        return load(part);
    }

    private byte[] load(String part) {
        Optional<FetchedPart> fetched = backend.fetch(part);
        if (fetched.isEmpty()) {
            return null;
        }
        FetchedPart found = fetched.get();
        store.put(part, PartEntry.loaded(found.data(), found.timestamp()));
        log.debugf("Loaded part %s from %s", part, backend);
        return found.data();
    }

    private byte[] revalidate(String part, PartEntry entry) {
        if (entry.hasTimestamp() && backend.timestamp(part) == entry.timestamp()) {
            return entry.data();
        }
        log.debugf("Part %s changed in %s, reloading", part, backend);
        byte[] data = load(part);
        if (data == null) {
            store.forget(part);
        }
        return data;
    }

    /**
     * Sets the bytes of a part in memory. They win over storage until saved.
     */
    public void setPart(String path, byte[] data) {
        Objects.requireNonNull(data, "Part data cannot be null, use deletePart()");
        store.put(PartPaths.normalize(path), PartEntry.assigned(data));
    }

    /**
     * Marks a part as deleted. Reading it fails from now on and saves leave it out.
     */
    public void deletePart(String path) {
        store.markDeleted(PartPaths.normalize(path));
    }

    /**
     * Lists the parts of the package.
     *
     * <p>For a container bound to a file or folder this re-reads storage, so it
     * does not include parts only set in memory. Otherwise it lists the
     * in-memory parts, deleted ones included.
     */
    public List<String> getParts() {
        if (backend.location().isPresent()) {
            return backend.listParts();
        }
        return new ArrayList<>(store.paths());
    }

    public List<String> parts() {
        return getParts();
    }

    // -- mimetype --

    /**
     * The package mimetype, or {@code ""} if the package has none.
     *
     * @throws PartDeletedException if the mimetype part was deleted
     */
    public String getMimetype() {
        byte[] data = getPart(PartPaths.MIMETYPE);
        return data == null ? "" : decode(data);
    }

    public void setMimetype(String mimetype) {
        Objects.requireNonNull(mimetype, "Mimetype cannot be null");
        setPart(PartPaths.MIMETYPE, mimetype.getBytes(StandardCharsets.UTF_8));
    }

    public void setMimetype(byte[] mimetype) {
        Objects.requireNonNull(mimetype, "Mimetype cannot be null");
        setPart(PartPaths.MIMETYPE, mimetype);
    }

    // -- save --

    /**
     * Saves over the location the container was opened from, in its own packaging.
     */
    public void save() {
        save((Path) null, null, false);
    }

    public void save(Path target) {
        save(target, null, false);
    }

    public void save(Path target, Packaging packaging) {
        save(target, packaging, false);
    }

    /**
     * Saves with packaging given by its label ({@code "zip"} or {@code "folder"}).
     * Trailing separators of {@code target} are ignored.
     *
     * @throws IllegalArgumentException if the packaging label is not supported
     */
    public void save(String target, String packaging, boolean backup) {
        Packaging resolved = packaging == null ? null : Packaging.fromLabel(packaging);
        save(target == null ? null : Path.of(stripSeparators(target)), resolved, backup);
    }

    /**
     * Saves the package.
     *
     * <p>A folder save writes to {@code <target>.folder}, replacing what was
     * there; a trailing {@code .folder} on {@code target} is ignored. With
     * {@code backup}, an existing target is first renamed to
     * {@code <stem>.backup<suffix>}.
     *
     * @param target    destination, or {@code null} for the location the container was opened from
     * @param packaging packaging to write, or {@code null} to keep the container's
     * @throws UnsupportedTargetException if no target is given and the container has no location
     * @throws MissingMimeTypeException   on a ZIP save without a mimetype part
     */
    public void save(Path target, Packaging packaging, boolean backup) {
        Packaging effective = packaging == null ? this.packaging : packaging;
        materialize();
        Path destination = normalizeTarget(target);

        if (effective == Packaging.FOLDER) {
            Path folder = destination.resolveSibling(destination.getFileName() + ".folder");
            if (backup) {
                TargetPreparer.backup(folder);
            } else {
                TargetPreparer.clear(folder);
            }
            new FolderPackageWriter(config).write(store, folder);
        } else {
            ZipPackageWriter.requireMimetype(store);
            if (backup) {
                TargetPreparer.backup(destination);
            }
            new ZipPackageWriter(config).write(store, destination);
        }
    }

    public void save(OutputStream target) {
        save(target, null);
    }

    /**
     * Writes the package as ZIP to a caller-owned stream, which is left open.
     *
     * @throws UnsupportedTargetException if {@code packaging} is folder
     */
    public void save(OutputStream target, Packaging packaging) {
        Objects.requireNonNull(target, "Target stream cannot be null");
        Packaging effective = packaging == null ? this.packaging : packaging;
        if (effective == Packaging.FOLDER) {
            throw new UnsupportedTargetException("Folder packaging cannot be written to a stream");
        }
        materialize();
        new ZipPackageWriter(config).write(store, target);
    }

    // Loads every stored part not in memory yet, so that writers see the whole package
    private void materialize() {
        if (backend.location().isEmpty()) {
            return;
        }
        for (String part : backend.listParts()) {
            if (store.state(part) == PartState.ABSENT) {
                getPart(part);
            }
        }
    }

    private Path normalizeTarget(Path target) {
        Path destination = target != null
                ? expandHome(target).toAbsolutePath().normalize()
                : path().orElseThrow(() -> new UnsupportedTargetException("No save target and no package location"));
        String name = destination.getFileName().toString();
        if (name.endsWith(".folder") && name.length() > ".folder".length()) {
            destination = destination.resolveSibling(name.substring(0, name.length() - ".folder".length()));
        }
        return destination;
    }

    private static String stripSeparators(String target) {
        int end = target.length();
        while (end > 1 && (target.charAt(end - 1) == '/' || target.charAt(end - 1) == '\\')) {
            end--;
        }
        return target.substring(0, end);
    }

    // -- misc --

    /**
     * Returns an independent deep copy with no location. Parts still in
     * storage are read first, so the copy holds the whole package.
     */
    public OdfContainer copy() {
        materialize();
        return new OdfContainer(config, store.copy(), DetachedPartBackend.INSTANCE, packaging);
    }

    /**
     * The file or folder the container was opened from.
     */
    public Optional<Path> path() {
        return backend.location();
    }

    public Packaging packaging() {
        return packaging;
    }

    /**
     * Default {@code manifest.rdf} content: styles.xml and content.xml
     * declared as parts of the document.
     */
    public static String defaultManifestRdf() {
        String odf = "http://docs.oasis-open.org/ns/office/" + OFFICE_VERSION + "/meta/odf#";
        String pkg = "http://docs.oasis-open.org/ns/office/" + OFFICE_VERSION + "/meta/pkg#";
        return "<?xml version=\"1.0\" encoding=\"utf-8\"?>\n"
                + "<rdf:RDF xmlns:rdf=\"http://www.w3.org/1999/02/22-rdf-syntax-ns#\">\n"
                + "  <rdf:Description rdf:about=\"styles.xml\">\n"
                + "    <rdf:type rdf:resource=\"" + odf + "StylesFile\"/>\n"
                + "  </rdf:Description>\n"
                + "  <rdf:Description rdf:about=\"\">\n"
                + "    <ns0:hasPart xmlns:ns0=\"" + pkg + "\" rdf:resource=\"styles.xml\"/>\n"
                + "  </rdf:Description>\n"
                + "  <rdf:Description rdf:about=\"content.xml\">\n"
                + "    <rdf:type rdf:resource=\"" + odf + "ContentFile\"/>\n"
                + "  </rdf:Description>\n"
                + "  <rdf:Description rdf:about=\"\">\n"
                + "    <ns0:hasPart xmlns:ns0=\"" + pkg + "\" rdf:resource=\"content.xml\"/>\n"
                + "  </rdf:Description>\n"
                + "  <rdf:Description rdf:about=\"\">\n"
                + "    <rdf:type rdf:resource=\"" + pkg + "Document\"/>\n"
                + "  </rdf:Description>\n"
                + "</rdf:RDF>\n";
    }

    @Override
    public String toString() {
        String type = store.state(PartPaths.MIMETYPE) == PartState.DELETED ? "<deleted>" : getMimetype();
        return "OdfContainer[type=" + type + ", path=" + path().map(Path::toString).orElse("null") + "]";
    }
}
