package com.npssenti.crawler.service.extract;

import lombok.extern.slf4j.Slf4j;
import org.apache.tika.language.detect.LanguageDetector;
import org.apache.tika.language.detect.LanguageResult;
import org.apache.tika.langdetect.optimaize.OptimaizeLangDetector;
import org.springframework.stereotype.Component;

/**
 * Language id backed by Tika's Optimaize detector. The detector keeps per-call state,
 * so calls are serialised.
 */
@Component
@Slf4j
public class LanguageIdentifier {

    public static final String UNDETERMINED = "und";

    /** Enough text for a stable guess; longer inputs are truncated */
    private static final int MAX_CHARS = 5000;

    private final LanguageDetector detector;

    public LanguageIdentifier() {
        this.detector = new OptimaizeLangDetector().loadModels();
    }

    public synchronized Detection detect(String text) {
        if (text == null || text.isBlank()) {
            return new Detection(UNDETERMINED, 0.0);
        }
        String sample = text.length() > MAX_CHARS ? text.substring(0, MAX_CHARS) : text;
        LanguageResult result = detector.detect(sample);
        if (result == null || result.isUnknown()) {
            return new Detection(UNDETERMINED, 0.0);
        }
        return new Detection(result.getLanguage(), result.getRawScore());
    }

    public record Detection(String lang, double confidence) {}
}
