package com.libragraph.odfpack.types;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class OdfMediaTypeTest {

    @Test
    void shouldRecognizeOdfMimeTypes() {
        assertThat(OdfMediaType.isKnown("application/vnd.oasis.opendocument.text")).isTrue();
        assertThat(OdfMediaType.isKnown("application/vnd.oasis.opendocument.spreadsheet-template")).isTrue();
        assertThat(OdfMediaType.fromMimeType("application/vnd.oasis.opendocument.presentation"))
                .contains(OdfMediaType.PRESENTATION);
    }

    @Test
    void shouldRejectForeignMimeTypes() {
        assertThat(OdfMediaType.isKnown("application/zip")).isFalse();
        assertThat(OdfMediaType.isKnown("")).isFalse();
        assertThat(OdfMediaType.isKnown(null)).isFalse();
        assertThat(OdfMediaType.fromMimeType("text/plain")).isEmpty();
    }

    @Test
    void shouldLookUpByExtension() {
        assertThat(OdfMediaType.fromExtension("odt").mimeType())
                .isEqualTo("application/vnd.oasis.opendocument.text");
        assertThat(OdfMediaType.fromExtension(".ODS")).isEqualTo(OdfMediaType.SPREADSHEET);
        assertThatIllegalArgumentException()
                .isThrownBy(() -> OdfMediaType.fromExtension("docx"))
                .withMessageContaining("docx");
    }
}
