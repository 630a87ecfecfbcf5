package com.libragraph.odfpack.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class PartPathsTest {

    @Test
    void shouldKeepPlainNames() {
        assertThat(PartPaths.normalize("content.xml")).isEqualTo("content.xml");
        assertThat(PartPaths.normalize("META-INF/manifest.xml")).isEqualTo(PartPaths.MANIFEST);
    }

    @Test
    void shouldUnifySeparators() {
        assertThat(PartPaths.normalize("Pictures\\a.jpg")).isEqualTo("Pictures/a.jpg");
        assertThat(PartPaths.normalize("Pictures//a.jpg")).isEqualTo("Pictures/a.jpg");
        assertThat(PartPaths.normalize("./Pictures/./a.jpg")).isEqualTo("Pictures/a.jpg");
    }

    @Test
    void shouldKeepTrailingSlashForDirectories() {
        assertThat(PartPaths.normalize("Configurations2/toolbar/")).isEqualTo("Configurations2/toolbar/");
        assertThat(PartPaths.normalize("Thumbnails\\")).isEqualTo("Thumbnails/");
        assertThat(PartPaths.isDirectory("Thumbnails/")).isTrue();
        assertThat(PartPaths.isDirectory("Thumbnails")).isFalse();
    }

    @Test
    void shouldRejectNull() {
        assertThatNullPointerException().isThrownBy(() -> PartPaths.normalize(null));
    }

    @Test
    void canonicalPartsShouldFollowArchiveOrder() {
        assertThat(PartPaths.CANONICAL_XML_PARTS)
                .containsExactly("content.xml", "meta.xml", "settings.xml", "styles.xml");
    }
}
