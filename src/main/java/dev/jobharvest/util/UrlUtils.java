package dev.jobharvest.util;

import java.net.MalformedURLException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.URL;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

public final class UrlUtils {

    private UrlUtils() {
    }

    /**
     * Resolves each href against {@code baseUrl}, keeping only http(s) results, in first-seen order
     * without duplicates. Blank and fragment-only hrefs are skipped before resolution.
     */
    public static List<String> absolutizeAndDedupe(Collection<String> hrefs, String baseUrl) {
        Set<String> seen = new LinkedHashSet<>();
        for (String href : hrefs) {
            if (href == null || href.isBlank() || href.strip().startsWith("#")) {
                continue;
            }
            String absolute = resolve(baseUrl, href.strip());
            if (absolute != null && isHttpUrl(absolute)) {
                seen.add(absolute);
            }
        }
        return new ArrayList<>(seen);
    }

    /**
     * Resolves {@code href} against {@code baseUrl}; returns null when either cannot be parsed.
     */
    public static String resolve(String baseUrl, String href) {
        try {
            URL base = baseUrl == null || baseUrl.isBlank() ? null : new URL(baseUrl);
            return new URL(base, href).toExternalForm();
        } catch (MalformedURLException e) {
            return null;
        }
    }

    public static boolean isHttpUrl(String url) {
        String scheme = schemeOf(url);
        return "http".equals(scheme) || "https".equals(scheme);
    }

    /**
     * Lower-cased scheme of {@code url}, or null when the value has none.
     */
    public static String schemeOf(String url) {
        if (url == null) {
            return null;
        }
        int colon = url.indexOf(':');
        if (colon <= 0) {
            return null;
        }
        String scheme = url.substring(0, colon);
        if (!scheme.matches("[A-Za-z][A-Za-z0-9+.-]*")) {
            return null;
        }
        return scheme.toLowerCase(Locale.ROOT);
    }

    public static String hostOf(String url) {
        URI uri = safeUri(url);
        if (uri != null && uri.getHost() != null) {
            return uri.getHost().toLowerCase(Locale.ROOT);
        }
        try {
            String host = new URL(url).getHost();
            return host == null || host.isEmpty() ? null : host.toLowerCase(Locale.ROOT);
        } catch (MalformedURLException e) {
            return null;
        }
    }

    public static URI safeUri(String url) {
        if (url == null) {
            return null;
        }
        try {
            return new URI(url);
        } catch (URISyntaxException ignored) {
            return null;
        }
    }
}
