package com.npssenti.crawler.service;

import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.URISyntaxException;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Canonical form of a URL used for document ids and index fingerprints.
 *
 * Rules:
 *  - scheme and host lower-cased, default ports dropped, fragment dropped
 *  - empty path becomes "/"
 *  - tracking parameters (utm_*, fbclid, gclid, ...) removed
 *  - forum hosts keep only the parameters that identify a thread
 *  - remaining parameters sorted by name, then value
 */
@Component
public class UrlNormalizer {

    private static final Set<String> TRACKING_PARAMS = Set.of(
            "fbclid", "gclid", "igshid", "mibextid", "ref", "ref_src", "spm");

    /** Host suffix → parameters that identify a page on that host */
    private static final Map<String, Set<String>> QUERY_ALLOWLIST = Map.of(
            "dcinside.com", Set.of("id", "no"),
            "bobaedream.co.kr", Set.of("code", "no"),
            "mlbpark.donga.com", Set.of("b", "id", "idx"),
            "ppomppu.co.kr", Set.of("id", "no"),
            "news.naver.com", Set.of("oid", "aid"));

    /**
     * @return the canonical URL, or the trimmed input when it cannot be parsed as an absolute URL
     */
    public String normalize(String url) {
        if (url == null) {
            return null;
        }
        String trimmed = url.trim();
        URI uri;
        try {
            uri = new URI(trimmed);
        } catch (URISyntaxException e) {
            return trimmed;
        }
        if (uri.getScheme() == null || uri.getHost() == null) {
            return trimmed;
        }

        String scheme = uri.getScheme().toLowerCase(Locale.ROOT);
        String host = uri.getHost().toLowerCase(Locale.ROOT);
        int port = uri.getPort();
        if ((port == 80 && scheme.equals("http")) || (port == 443 && scheme.equals("https"))) {
            port = -1;
        }
        String path = uri.getRawPath() == null || uri.getRawPath().isEmpty() ? "/" : uri.getRawPath();

        StringBuilder sb = new StringBuilder(scheme).append("://").append(host);
        if (port != -1) {
            sb.append(':').append(port);
        }
        sb.append(path);

        String query = canonicalQuery(host, uri.getRawQuery());
        if (!query.isEmpty()) {
            sb.append('?').append(query);
        }
        return sb.toString();
    }

    /** Host of an absolute http(s) URL, lower-cased, or null. */
    public static String hostOf(String url) {
        if (url == null) {
            return null;
        }
        try {
            URI uri = new URI(url.trim());
            return uri.getHost() == null ? null : uri.getHost().toLowerCase(Locale.ROOT);
        } catch (URISyntaxException e) {
            return null;
        }
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private String canonicalQuery(String host, String rawQuery) {
        if (rawQuery == null || rawQuery.isEmpty()) {
            return "";
        }
        Set<String> allowed = allowlistFor(host);
        List<String[]> params = new ArrayList<>();
        for (String pair : rawQuery.split("&")) {
            if (pair.isEmpty()) {
                continue;
            }
            int eq = pair.indexOf('=');
            String rawName = eq < 0 ? pair : pair.substring(0, eq);
            String value = eq < 0 ? "" : pair.substring(eq + 1);
            String name = URLDecoder.decode(rawName, StandardCharsets.UTF_8).toLowerCase(Locale.ROOT);
            if (isTracking(name)) {
                continue;
            }
            if (allowed != null && !allowed.contains(name)) {
                continue;
            }
            params.add(new String[]{rawName, value});
        }
        params.sort((a, b) -> {
            int c = a[0].compareTo(b[0]);
            return c != 0 ? c : a[1].compareTo(b[1]);
        });
        StringBuilder sb = new StringBuilder();
        for (String[] p : params) {
            if (sb.length() > 0) {
                sb.append('&');
            }
            sb.append(p[0]).append('=').append(p[1]);
        }
        return sb.toString();
    }

    private static boolean isTracking(String name) {
        return name.startsWith("utm_") || TRACKING_PARAMS.contains(name);
    }

    private static Set<String> allowlistFor(String host) {
        for (Map.Entry<String, Set<String>> e : QUERY_ALLOWLIST.entrySet()) {
            if (host.equals(e.getKey()) || host.endsWith("." + e.getKey())) {
                return e.getValue();
            }
        }
        return null;
    }
}
