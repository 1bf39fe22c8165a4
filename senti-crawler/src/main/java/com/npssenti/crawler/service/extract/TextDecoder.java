package com.npssenti.crawler.service.extract;

import org.springframework.stereotype.Component;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.StandardCharsets;
import java.nio.charset.UnsupportedCharsetException;
import java.text.Normalizer;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Bytes to NFC text. Charset order: Content-Type header, then a {@code <meta>} declaration in the
 * first 4KB, then strict UTF-8, then MS949 (the EUC-KR superset older Korean boards still serve).
 */
@Component
public class TextDecoder {

    private static final Charset MS949 = Charset.forName("MS949");
    private static final Pattern HEADER_CHARSET = Pattern.compile("charset\\s*=\\s*\"?([\\w.:-]+)", Pattern.CASE_INSENSITIVE);
    private static final Pattern META_CHARSET = Pattern.compile(
            "<meta[^>]+charset\\s*=\\s*[\"']?([\\w.:-]+)", Pattern.CASE_INSENSITIVE);
    private static final int SNIFF_BYTES = 4096;

    public String decode(byte[] body, String contentType) throws ExtractException {
        if (body == null || body.length == 0) {
            return "";
        }

        Charset declared = charsetFrom(contentType, HEADER_CHARSET);
        if (declared == null) {
            String head = new String(body, 0, Math.min(body.length, SNIFF_BYTES), StandardCharsets.ISO_8859_1);
            declared = charsetFrom(head, META_CHARSET);
        }

        String text;
        if (declared != null) {
            text = lenient(body, declared);
        } else {
            text = strict(body, StandardCharsets.UTF_8);
            if (text == null) {
                text = strict(body, MS949);
            }
            if (text == null) {
                throw new ExtractException("Undecodable body: neither UTF-8 nor MS949");
            }
        }

        if (!text.isEmpty() && text.charAt(0) == '\uFEFF') {
            text = text.substring(1);
        }
        return Normalizer.normalize(text, Normalizer.Form.NFC);
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private static Charset charsetFrom(String value, Pattern pattern) {
        if (value == null) {
            return null;
        }
        Matcher m = pattern.matcher(value);
        if (!m.find()) {
            return null;
        }
        String name = m.group(1).toLowerCase(Locale.ROOT);
        // Pages labelled EUC-KR routinely contain MS949-only syllables
        if (name.equals("euc-kr") || name.equals("ks_c_5601-1987")) {
            return MS949;
        }
        try {
            return Charset.forName(name);
        } catch (IllegalCharsetNameException | UnsupportedCharsetException e) {
            return null;
        }
    }

    private static String strict(byte[] body, Charset charset) {
        try {
            return charset.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(body))
                    .toString();
        } catch (CharacterCodingException e) {
            return null;
        }
    }

    private static String lenient(byte[] body, Charset charset) {
        return new String(body, charset);
    }
}
