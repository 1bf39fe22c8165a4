package com.npssenti.crawler.service.extract;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.function.Supplier;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Publish time of a page.
 *
 * Priority: structured page metadata, then the discovery hint, then the first date-looking
 * pattern in the text, then null. Zone-less values are read as Asia/Seoul.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class PublishDateResolver {

    public static final ZoneId DEFAULT_ZONE = ZoneId.of("Asia/Seoul");

    private static final List<String> META_SELECTORS = List.of(
            "meta[property=article:published_time]",
            "meta[property=og:published_time]",
            "meta[itemprop=datePublished]",
            "meta[name=article:published_time]",
            "meta[name=date]",
            "meta[name=pubdate]",
            "meta[name=publishdate]");

    private static final List<DateTimeFormatter> LOCAL_FORMATS = List.of(
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss"),
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm"),
            DateTimeFormatter.ofPattern("yyyy.MM.dd HH:mm:ss"),
            DateTimeFormatter.ofPattern("yyyy.MM.dd HH:mm"),
            DateTimeFormatter.ofPattern("yyyy/MM/dd HH:mm:ss"),
            DateTimeFormatter.ofPattern("yyyy/MM/dd HH:mm"),
            DateTimeFormatter.ofPattern("yyyyMMddHHmmss"));

    private static final List<DateTimeFormatter> DATE_FORMATS = List.of(
            DateTimeFormatter.ISO_LOCAL_DATE,
            DateTimeFormatter.ofPattern("yyyy.MM.dd"),
            DateTimeFormatter.ofPattern("yyyy/MM/dd"),
            DateTimeFormatter.ofPattern("yyyyMMdd"));

    private static final Pattern NUMERIC_DATE = Pattern.compile(
            "(?<!\\d)(\\d{4})[-./](\\d{1,2})[-./](\\d{1,2})(?:\\.?\\s+(\\d{1,2}):(\\d{2})(?::(\\d{2}))?)?(?!\\d)");
    private static final Pattern KOREAN_DATE = Pattern.compile(
            "(\\d{4})년\\s*(\\d{1,2})월\\s*(\\d{1,2})일(?:\\s*(\\d{1,2})시(?:\\s*(\\d{1,2})분)?)?");

    private static final int MIN_YEAR = 1990;
    private static final int MAX_YEAR = 2100;

    private final ObjectMapper objectMapper;

    public Instant resolve(Document page, Instant discoveryHint, String text) {
        if (page != null) {
            Instant fromMeta = fromMetadata(page);
            if (fromMeta != null) {
                return fromMeta;
            }
        }
        if (discoveryHint != null) {
            return discoveryHint;
        }
        return fromText(text);
    }

    /** Parses one date or date-time string as found in metadata, APIs or listings. */
    public static Instant parse(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String v = value.trim();
        Instant parsed = attempt(() -> OffsetDateTime.parse(v).toInstant());
        if (parsed == null) {
            parsed = attempt(() -> ZonedDateTime.parse(v).toInstant());
        }
        if (parsed == null) {
            parsed = attempt(() -> LocalDateTime.parse(v).atZone(DEFAULT_ZONE).toInstant());
        }
        for (int i = 0; parsed == null && i < LOCAL_FORMATS.size(); i++) {
            DateTimeFormatter f = LOCAL_FORMATS.get(i);
            parsed = attempt(() -> LocalDateTime.parse(v, f).atZone(DEFAULT_ZONE).toInstant());
        }
        for (int i = 0; parsed == null && i < DATE_FORMATS.size(); i++) {
            DateTimeFormatter f = DATE_FORMATS.get(i);
            parsed = attempt(() -> LocalDate.parse(v, f).atStartOfDay(DEFAULT_ZONE).toInstant());
        }
        return parsed;
    }

    public static String toIso(Instant instant) {
        return instant == null ? null : DateTimeFormatter.ISO_INSTANT.format(instant);
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    Instant fromMetadata(Document page) {
        for (String selector : META_SELECTORS) {
            Element meta = page.selectFirst(selector);
            if (meta != null) {
                Instant parsed = parse(meta.attr("content"));
                if (parsed != null) {
                    return parsed;
                }
            }
        }
        for (Element script : page.select("script[type=application/ld+json]")) {
            Instant parsed = fromJsonLd(script.data());
            if (parsed != null) {
                return parsed;
            }
        }
        for (Element time : page.select("time[datetime]")) {
            Instant parsed = parse(time.attr("datetime"));
            if (parsed != null) {
                return parsed;
            }
        }
        return null;
    }

    private Instant fromJsonLd(String json) {
        try {
            JsonNode root = objectMapper.readTree(json);
            JsonNode value = root == null ? null : root.findValue("datePublished");
            return value == null ? null : parse(value.asText());
        } catch (JsonProcessingException e) {
            log.debug("Ignoring malformed JSON-LD block: {}", e.getOriginalMessage());
            return null;
        }
    }

    private static Instant attempt(Supplier<Instant> parser) {
        try {
            return parser.get();
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    static Instant fromText(String text) {
        if (text == null || text.isEmpty()) {
            return null;
        }
        Instant numeric = firstMatch(NUMERIC_DATE.matcher(text));
        return numeric != null ? numeric : firstMatch(KOREAN_DATE.matcher(text));
    }

    private static Instant firstMatch(Matcher m) {
        while (m.find()) {
            int year = Integer.parseInt(m.group(1));
            if (year < MIN_YEAR || year > MAX_YEAR) {
                continue;
            }
            try {
                int hour = m.group(4) == null ? 0 : Integer.parseInt(m.group(4));
                int minute = m.group(5) == null ? 0 : Integer.parseInt(m.group(5));
                LocalDateTime ldt = LocalDateTime.of(year, Integer.parseInt(m.group(2)),
                        Integer.parseInt(m.group(3)), hour, minute);
                if (m.groupCount() >= 6 && m.group(6) != null) {
                    ldt = ldt.withSecond(Integer.parseInt(m.group(6)));
                }
                return ldt.atZone(DEFAULT_ZONE).toInstant();
            } catch (DateTimeException e) {
                log.trace("Skipping impossible date {}", m.group());
            }
        }
        return null;
    }
}
