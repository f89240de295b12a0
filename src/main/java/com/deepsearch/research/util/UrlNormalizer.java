package com.deepsearch.research.util;

import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Optional;

/**
 * URL identity used for de-duplicating search hits.
 *
 * Two hits are the same source when their normalized forms are equal: redirect
 * wrapper removed, scheme and host lower-cased, default port and fragment dropped.
 * Path and query are kept as-is.
 */
public final class UrlNormalizer {

    private static final String REDIRECT_PARAM = "uddg=";

    private UrlNormalizer() {
    }

    /**
     * Normalized absolute http(s) URL, or empty when the input cannot be used as a source.
     */
    public static Optional<String> normalize(String rawUrl) {
        if (rawUrl == null || rawUrl.isBlank()) {
            return Optional.empty();
        }

        String url = unwrapRedirect(rawUrl.trim());
        if (url.startsWith("//")) {
            url = "https:" + url;
        }

        try {
            URI uri = new URI(url);
            String scheme = uri.getScheme();
            String host = uri.getHost();
            if (scheme == null || host == null) {
                return Optional.empty();
            }

            scheme = scheme.toLowerCase(Locale.ROOT);
            if (!scheme.equals("http") && !scheme.equals("https")) {
                return Optional.empty();
            }

            int port = uri.getPort();
            if ((scheme.equals("http") && port == 80) || (scheme.equals("https") && port == 443)) {
                port = -1;
            }

            StringBuilder sb = new StringBuilder()
                    .append(scheme).append("://")
                    .append(host.toLowerCase(Locale.ROOT));
            if (port != -1) {
                sb.append(':').append(port);
            }
            String path = uri.getRawPath();
            sb.append(path == null || path.isEmpty() ? "/" : path);
            if (uri.getRawQuery() != null) {
                sb.append('?').append(uri.getRawQuery());
            }
            return Optional.of(sb.toString());
        } catch (Exception e) {
            return Optional.empty();
        }
    }

    /**
     * Lower-cased host of the URL, or null when it has none
     */
    public static String extractDomain(String url) {
        if (url == null) return null;
        try {
            String host = URI.create(url).getHost();
            return host != null ? host.toLowerCase(Locale.ROOT) : null;
        } catch (Exception e) {
            return null;
        }
    }

    /**
     * Search provider result links point at {@code /l/?uddg=<encoded target>}; return the target.
     */
    static String unwrapRedirect(String url) {
        if (!url.contains("/l/?") || !url.contains(REDIRECT_PARAM)) {
            return url;
        }
        int start = url.indexOf(REDIRECT_PARAM) + REDIRECT_PARAM.length();
        int end = url.indexOf('&', start);
        String encoded = end == -1 ? url.substring(start) : url.substring(start, end);
        return URLDecoder.decode(encoded, StandardCharsets.UTF_8);
    }
}
