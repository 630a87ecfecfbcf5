package com.libragraph.odfpack.container.config;

import com.libragraph.odfpack.types.OdfMediaType;
import org.eclipse.microprofile.config.Config;
import org.eclipse.microprofile.config.ConfigProvider;

import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.Objects;
import java.util.Set;

/**
 * Tunables of the package core, read from {@code odfpack.*} properties.
 *
 * <p>Sources are the usual MicroProfile ones: system properties, environment,
 * and {@code META-INF/microprofile-config.properties} on the classpath.
 *
 * @param filePermissions  POSIX mode of files written by folder saves
 * @param fallbackMediaType media type synthesized for folders without a valid mimetype
 * @param compressionLevel Deflater level for compressed ZIP entries (-1 = default, 0-9)
 */
public record PackageConfig(
        Set<PosixFilePermission> filePermissions,
        OdfMediaType fallbackMediaType,
        int compressionLevel
) {
    public static final String FILE_PERMISSIONS = "odfpack.folder.file-permissions";
    public static final String FALLBACK_EXTENSION = "odfpack.folder.fallback-extension";
    public static final String COMPRESSION_LEVEL = "odfpack.zip.compression-level";

    static final String DEFAULT_FILE_PERMISSIONS = "rw-rw-rw-";
    static final String DEFAULT_FALLBACK_EXTENSION = "odt";
    static final int DEFAULT_COMPRESSION_LEVEL = -1;

    public PackageConfig {
        Objects.requireNonNull(fallbackMediaType, "Fallback media type cannot be null");
        filePermissions = Set.copyOf(filePermissions);
        if (compressionLevel < -1 || compressionLevel > 9) {
            throw new IllegalArgumentException("Compression level must be -1..9, got: " + compressionLevel);
        }
    }

    /**
     * Built-in defaults, ignoring any configuration source.
     */
    public static PackageConfig defaults() {
        return new PackageConfig(
                PosixFilePermissions.fromString(DEFAULT_FILE_PERMISSIONS),
                OdfMediaType.fromExtension(DEFAULT_FALLBACK_EXTENSION),
                DEFAULT_COMPRESSION_LEVEL
        );
    }

    /**
     * Reads the configuration from the current MicroProfile Config.
     */
    public static PackageConfig load() {
        return from(ConfigProvider.getConfig());
    }

    public static PackageConfig from(Config config) {
        String permissions = config.getOptionalValue(FILE_PERMISSIONS, String.class)
                .orElse(DEFAULT_FILE_PERMISSIONS);
        String extension = config.getOptionalValue(FALLBACK_EXTENSION, String.class)
                .orElse(DEFAULT_FALLBACK_EXTENSION);
        int level = config.getOptionalValue(COMPRESSION_LEVEL, Integer.class)
                .orElse(DEFAULT_COMPRESSION_LEVEL);

        return new PackageConfig(
                PosixFilePermissions.fromString(permissions),
                OdfMediaType.fromExtension(extension),
                level
        );
    }
}
