package com.libragraph.odfpack.container.config;

import com.libragraph.odfpack.types.OdfMediaType;
import io.smallrye.config.SmallRyeConfig;
import io.smallrye.config.SmallRyeConfigBuilder;
import org.junit.jupiter.api.Test;

import java.nio.file.attribute.PosixFilePermissions;

import static org.assertj.core.api.Assertions.*;

class PackageConfigTest {

    @Test
    void shouldProvideDefaults() {
        PackageConfig config = PackageConfig.defaults();

        assertThat(PosixFilePermissions.toString(config.filePermissions())).isEqualTo("rw-rw-rw-");
        assertThat(config.fallbackMediaType()).isEqualTo(OdfMediaType.TEXT);
        assertThat(config.compressionLevel()).isEqualTo(-1);
    }

    @Test
    void shouldLoadFromClasspathProperties() {
        PackageConfig config = PackageConfig.load();

        assertThat(config.compressionLevel()).isEqualTo(9);
        assertThat(config.fallbackMediaType()).isEqualTo(OdfMediaType.TEXT);
    }

    @Test
    void shouldReadOverriddenValues() {
        SmallRyeConfig source = new SmallRyeConfigBuilder()
                .withDefaultValue(PackageConfig.FILE_PERMISSIONS, "rw-r-----")
                .withDefaultValue(PackageConfig.FALLBACK_EXTENSION, ".ods")
                .withDefaultValue(PackageConfig.COMPRESSION_LEVEL, "0")
                .build();

        PackageConfig config = PackageConfig.from(source);

        assertThat(PosixFilePermissions.toString(config.filePermissions())).isEqualTo("rw-r-----");
        assertThat(config.fallbackMediaType()).isEqualTo(OdfMediaType.SPREADSHEET);
        assertThat(config.compressionLevel()).isZero();
    }

    @Test
    void shouldRejectInvalidValues() {
        SmallRyeConfig badExtension = new SmallRyeConfigBuilder()
                .withDefaultValue(PackageConfig.FALLBACK_EXTENSION, "docx")
                .build();

        assertThatThrownBy(() -> PackageConfig.from(badExtension))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("docx");
        assertThatThrownBy(() -> new PackageConfig(PackageConfig.defaults().filePermissions(), OdfMediaType.TEXT, 10))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
