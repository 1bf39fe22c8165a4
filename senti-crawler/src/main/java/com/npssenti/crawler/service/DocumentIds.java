package com.npssenti.crawler.service;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.text.Normalizer;
import java.util.HexFormat;

/**
 * Document ids and URL fingerprints.
 *
 * id = sha1(canonical_url + "\n" + sha1(canonical_text)), where canonical_text is NFC with
 * whitespace runs collapsed. The URL fingerprint is sha1(canonical_url), prefixed "url:" in the index.
 */
@Component
@RequiredArgsConstructor
public class DocumentIds {

    private final UrlNormalizer urlNormalizer;

    public String documentId(String url, String text) {
        String canonicalUrl = canonicalUrl(url);
        return sha1(canonicalUrl + "\n" + sha1(canonicalText(text)));
    }

    public String urlFingerprint(String url) {
        return "url:" + sha1(canonicalUrl(url));
    }

    public String canonicalUrl(String url) {
        String normalized = urlNormalizer.normalize(url);
        return normalized == null ? "" : normalized;
    }

    public static String canonicalText(String text) {
        if (text == null) {
            return "";
        }
        return Normalizer.normalize(text, Normalizer.Form.NFC).replaceAll("\\s+", " ").trim();
    }

    public static String sha1(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-1");
            return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-1 not available", e);
        }
    }
}
