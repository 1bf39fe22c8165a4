package com.npssenti.crawler.scheduler;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.npssenti.crawler.config.CrawlerProperties;
import com.npssenti.crawler.output.AtomicFiles;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Loads and saves {@link AutoState}. Saves replace the file atomically, so a reader never sees
 * a partial write.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class AutoStateStore {

    private final CrawlerProperties properties;
    private final ObjectMapper objectMapper;

    /** Current state, or a fresh one (all counts zero, ledger never used) when no file exists. */
    public AutoState load() {
        Path path = properties.statePath();
        if (!Files.exists(path)) {
            log.info("No autocrawl state at {}, starting fresh", path);
            return initial();
        }
        try {
            AutoState state = objectMapper.readValue(path.toFile(), AutoState.class);
            if (state.getYoutube() == null) {
                state.setYoutube(new QuotaLedger());
            }
            return state;
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read autocrawl state " + path, e);
        }
    }

    public void save(AutoState state) {
        Path path = properties.statePath();
        try {
            byte[] json = objectMapper.writer(SerializationFeature.INDENT_OUTPUT).writeValueAsBytes(state);
            AtomicFiles.write(path, json);
            log.debug("Saved autocrawl state to {}", path);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot write autocrawl state " + path, e);
        }
    }

    private AutoState initial() {
        AutoState state = new AutoState();
        state.getYoutube().setDailyQuota(properties.getAutocrawl().getDailyQuota());
        state.getYoutube().setReserveQuota(properties.getAutocrawl().getReserveQuota());
        return state;
    }
}
