package com.npssenti.crawler.service.score;

import com.npssenti.crawler.config.CrawlerProperties;
import com.npssenti.crawler.model.Document;
import com.npssenti.crawler.model.Quality;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Weighted quality score in [0, 1].
 *
 * <pre>
 *   length   : min(1, length / target-length) * length-weight
 *   language : confidence * lang-weight, only for allowed languages
 *   keywords : keyword-weight * (0.5 + 0.5 * coverage), only when hits >= min-keyword-hits
 * </pre>
 *
 * Keywords are matched case-insensitively as substrings of title + text; coverage is the share
 * of configured keywords that occur at least once.
 */
@Component
@RequiredArgsConstructor
public class QualityScorer {

    private final CrawlerProperties properties;

    public Quality score(Document doc) {
        CrawlerProperties.Quality cfg = properties.getQuality();
        List<String> reasons = new ArrayList<>();
        double score = 0.0;

        String text = doc.getText() == null ? "" : doc.getText();
        int length = text.codePointCount(0, text.length());
        double lengthPart = Math.min(1.0, length / (double) Math.max(1, cfg.getTargetLength())) * cfg.getLengthWeight();
        score += lengthPart;
        reasons.add(String.format(Locale.ROOT, "length+%.2f", lengthPart));
        if (length < cfg.getMinLength()) {
            reasons.add("short_text(" + length + ")");
        }

        String lang = doc.getLang() == null ? "und" : doc.getLang().toLowerCase(Locale.ROOT);
        if (isAllowedLanguage(lang)) {
            double langPart = doc.getLangConfidence() * cfg.getLangWeight();
            score += langPart;
            reasons.add(String.format(Locale.ROOT, "lang:%s+%.2f", lang, langPart));
        } else {
            reasons.add("lang=" + lang);
        }

        List<String> keywords = activeKeywords();
        String haystack = ((doc.getTitle() == null ? "" : doc.getTitle()) + "\n" + text).toLowerCase(Locale.ROOT);
        int hits = 0;
        for (String kw : keywords) {
            if (haystack.contains(kw)) {
                hits++;
            }
        }
        double coverage = keywords.isEmpty() ? 0.0 : hits / (double) keywords.size();
        if (hits >= cfg.getMinKeywordHits() && hits > 0) {
            double keywordPart = cfg.getKeywordWeight() * (0.5 + 0.5 * coverage);
            score += keywordPart;
            reasons.add(String.format(Locale.ROOT, "keywords:%d/%d+%.2f", hits, keywords.size(), keywordPart));
        } else {
            reasons.add("keyword_hits=" + hits);
        }

        return Quality.builder()
                .score(round3(score))
                .reasons(reasons)
                .length(length)
                .keywordHits(hits)
                .keywordCoverage(round3(coverage))
                .langConfidence(round3(doc.getLangConfidence()))
                .build();
    }

    public boolean isAccepted(Quality quality) {
        return quality.getScore() >= properties.getQuality().getMinScore();
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private boolean isAllowedLanguage(String lang) {
        return properties.getLanguages().stream()
                .anyMatch(allowed -> allowed.equalsIgnoreCase(lang));
    }

    private List<String> activeKeywords() {
        List<String> out = new ArrayList<>();
        for (String kw : properties.getKeywords()) {
            if (kw != null && !kw.isBlank()) {
                out.add(kw.trim().toLowerCase(Locale.ROOT));
            }
        }
        return out;
    }

    private static double round3(double value) {
        return Math.round(value * 1000.0) / 1000.0;
    }
}
