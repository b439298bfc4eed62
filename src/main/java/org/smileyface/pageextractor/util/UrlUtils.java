package org.smileyface.pageextractor.util;

import java.net.URI;
import java.util.Locale;

public class UrlUtils {

    private UrlUtils() {
        // No instanciation
    }

    /**
     * Drops the query string and fragment: {@code "a.pdf?x=1#p2"} -> {@code "a.pdf"}.
     */
    public static String stripQueryAndFragment(String url) {
        if (url == null) {
            return null;
        }
        int q = url.indexOf('?');
        String out = q >= 0 ? url.substring(0, q) : url;
        int h = out.indexOf('#');
        return h >= 0 ? out.substring(0, h) : out;
    }

    /**
     * True when the URL, without query and fragment, ends with {@code .pdf} (case-insensitive).
     */
    public static boolean hasPdfSuffix(String url) {
        if (url == null || url.isBlank()) return false;
        return stripQueryAndFragment(url.trim()).toLowerCase(Locale.ROOT).endsWith(".pdf");
    }

    /**
     * Last path segment of a URL or file path: everything after the final '/'.
     * {@code "https://example.com/docs/a.pdf"} -> {@code "a.pdf"}; a trailing slash yields "".
     */
    public static String baseName(String source) {
        if (source == null) return "";
        int slash = source.lastIndexOf('/');
        return slash >= 0 ? source.substring(slash + 1) : source;
    }

    /**
     * Lower-case scheme of an absolute URI, or null for plain paths and unparseable input.
     * Single-letter schemes are treated as Windows drive letters, not schemes.
     */
    public static String schemeOf(String source) {
        if (source == null || source.isBlank()) return null;
        try {
            String scheme = URI.create(source.trim()).getScheme();
            if (scheme == null || scheme.length() < 2) return null;
            return scheme.toLowerCase(Locale.ROOT);
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    public static boolean isHttp(String source) {
        String scheme = schemeOf(source);
        return "http".equals(scheme) || "https".equals(scheme);
    }
}
