package com.npssenti.crawler.service.dedup;

import com.fasterxml.jackson.databind.JsonNode;
import com.npssenti.crawler.model.Document;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Exact-match dedup key.
 *
 * Priority: text (with the URL appended for short texts), then title (+ URL), then URL alone,
 * then id. Returns null when a record has none of these; callers fall back to a position key
 * ({@link #positionKey(long)}) that can never collide with a content key.
 *
 * Near-duplicate matching (similarity hashing) would plug in behind this class; it is not active.
 */
@Component
public class DedupKeyBuilder {

    /** Texts shorter than this (in code points) are disambiguated by their URL */
    public static final int SHORT_TEXT_LENGTH = 80;

    public String key(Document doc) {
        return key(doc.getText(), doc.getTitle(), doc.getUrl(), doc.getId());
    }

    public String key(JsonNode record) {
        return key(textField(record, "text"), textField(record, "title"),
                textField(record, "url"), textField(record, "id"));
    }

    public String key(String text, String title, String url, String id) {
        String urlNorm = normalizeUrl(url);

        String textNorm = normalizeText(text);
        if (textNorm != null) {
            if (urlNorm != null && textNorm.codePointCount(0, textNorm.length()) < SHORT_TEXT_LENGTH) {
                return textNorm + "|url|" + urlNorm;
            }
            return textNorm;
        }

        String titleNorm = normalizeText(title);
        if (titleNorm != null) {
            return urlNorm != null ? titleNorm + "|url|" + urlNorm : titleNorm;
        }

        if (urlNorm != null) {
            return "url|" + urlNorm;
        }
        if (id != null && !id.isBlank()) {
            return "id|" + id;
        }
        return null;
    }

    public static String positionKey(long lineNumber) {
        return "line|" + lineNumber;
    }

    static String normalizeText(String value) {
        if (value == null) {
            return null;
        }
        String norm = value.toLowerCase(Locale.ROOT).replaceAll("\\s+", " ").trim();
        return norm.isEmpty() ? null : norm;
    }

    static String normalizeUrl(String url) {
        if (url == null) {
            return null;
        }
        String norm = url.trim().toLowerCase(Locale.ROOT);
        int end = norm.length();
        while (end > 0 && norm.charAt(end - 1) == '/') {
            end--;
        }
        norm = norm.substring(0, end);
        return norm.isEmpty() ? null : norm;
    }

    private static String textField(JsonNode node, String name) {
        JsonNode value = node.get(name);
        return value == null || value.isNull() ? null : value.asText();
    }
}
