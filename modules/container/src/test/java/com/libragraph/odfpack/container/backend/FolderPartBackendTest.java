package com.libragraph.odfpack.container.backend;

import com.libragraph.odfpack.container.OdfPackageException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;

class FolderPartBackendTest {

    @TempDir
    Path root;

    @Test
    void shouldListFilesAndLeafDirectoriesOnly() throws Exception {
        Files.writeString(root.resolve("mimetype"), "application/vnd.oasis.opendocument.text");
        Files.createDirectories(root.resolve("META-INF"));
        Files.writeString(root.resolve("META-INF/manifest.xml"), "<m/>");
        Files.createDirectories(root.resolve("Configurations2/toolbar"));
        Files.createDirectories(root.resolve("Thumbnails"));

        FolderPartBackend backend = new FolderPartBackend(root);

        assertThat(backend.listParts()).containsExactly(
                "Configurations2/toolbar/", "META-INF/manifest.xml", "Thumbnails/", "mimetype");
    }

    @Test
    void shouldSkipDotEntries() throws Exception {
        Files.writeString(root.resolve("content.xml"), "<c/>");
        Files.writeString(root.resolve(".DS_Store"), "junk");
        Files.createDirectories(root.resolve(".git/objects"));
        Files.createDirectories(root.resolve("Pictures"));
        Files.writeString(root.resolve("Pictures/.hidden"), "x");

        FolderPartBackend backend = new FolderPartBackend(root);

        assertThat(backend.listParts()).containsExactly("Pictures/", "content.xml");
    }

    @Test
    void shouldFetchBytesWithTimestampInSeconds() throws Exception {
        Path content = Files.writeString(root.resolve("content.xml"), "<c/>");
        Files.setLastModifiedTime(content, FileTime.fromMillis(1_700_000_000_999L));

        FetchedPart part = new FolderPartBackend(root).fetch("content.xml").orElseThrow();

        assertThat(part.data()).isEqualTo("<c/>".getBytes());
        assertThat(part.timestamp()).isEqualTo(1_700_000_000L);
    }

    @Test
    void shouldFetchDirectoryAsEmptyBytes() throws Exception {
        Files.createDirectories(root.resolve("Thumbnails"));

        FetchedPart part = new FolderPartBackend(root).fetch("Thumbnails/").orElseThrow();

        assertThat(part.data()).isEmpty();
    }

    @Test
    void shouldReturnEmptyForMissingPart() {
        FolderPartBackend backend = new FolderPartBackend(root);

        assertThat(backend.fetch("styles.xml")).isEmpty();
        assertThat(backend.timestamp("styles.xml")).isEqualTo(-1);
    }

    @Test
    void shouldReportCurrentTimestamp() throws Exception {
        Path meta = Files.writeString(root.resolve("meta.xml"), "<m/>");
        FolderPartBackend backend = new FolderPartBackend(root);

        Files.setLastModifiedTime(meta, FileTime.from(1_600_000_000L, TimeUnit.SECONDS));

        assertThat(backend.isLive()).isTrue();
        assertThat(backend.timestamp("meta.xml")).isEqualTo(1_600_000_000L);
    }

    @Test
    void shouldRejectPathsOutsideRoot() {
        FolderPartBackend backend = new FolderPartBackend(root);

        assertThatThrownBy(() -> backend.fetch("../outside.xml"))
                .isInstanceOf(OdfPackageException.class)
                .hasMessageContaining("outside.xml");
    }
}
