package com.libragraph.odfpack.util;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Names of the well-known parts of an ODF package and normalization of part paths.
 *
 * <p>Part paths always use {@code /} as separator. A path ending in {@code /}
 * names a directory placeholder.
 */
public final class PartPaths {

    public static final String MIMETYPE = "mimetype";
    public static final String CONTENT = "content.xml";
    public static final String META = "meta.xml";
    public static final String SETTINGS = "settings.xml";
    public static final String STYLES = "styles.xml";
    public static final String MANIFEST = "META-INF/manifest.xml";

    /** The XML parts written right after {@code mimetype}, in archive order. */
    public static final List<String> CANONICAL_XML_PARTS = List.of(CONTENT, META, SETTINGS, STYLES);

    private PartPaths() {
    }

    /**
     * Normalizes a part path: back-slashes become forward slashes, empty and
     * {@code .} segments are dropped, a trailing slash is kept.
     */
    public static String normalize(String path) {
        Objects.requireNonNull(path, "Part path cannot be null");
        String unified = path.replace('\\', '/');
        boolean directory = unified.endsWith("/");
        boolean absolute = unified.startsWith("/");

        List<String> segments = new ArrayList<>();
        for (String segment : unified.split("/")) {
            if (segment.isEmpty() || segment.equals(".")) continue;
            segments.add(segment);
        }

        StringBuilder sb = new StringBuilder();
        if (absolute) sb.append('/');
        sb.append(String.join("/", segments));
        if (directory && !segments.isEmpty()) sb.append('/');
        return sb.toString();
    }

    public static boolean isDirectory(String path) {
        return path.endsWith("/");
    }
}
