package com.npssenti.crawler.output;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.npssenti.crawler.service.dedup.DedupKeyBuilder;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.Set;

/**
 * Post-hoc exact dedup of a JSONL file: first occurrence of each key is kept, in file order.
 * Kept lines are copied byte-for-byte; empty and malformed lines are dropped and counted.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class JsonlDeduplicator {

    private final ObjectMapper objectMapper;
    private final DedupKeyBuilder keyBuilder;

    public DedupStats dedup(Path input, Path output) throws IOException {
        DedupStats stats = new DedupStats();
        Set<String> seen = new HashSet<>();

        Path tmp = AtomicFiles.tempFor(output);
        try {
            try (BufferedReader reader = Files.newBufferedReader(input, StandardCharsets.UTF_8);
                 BufferedWriter writer = Files.newBufferedWriter(tmp, StandardCharsets.UTF_8)) {
                String line;
                while ((line = reader.readLine()) != null) {
                    stats.total++;
                    if (line.isEmpty()) {
                        stats.emptyLines++;
                        continue;
                    }

                    JsonNode record;
                    try {
                        record = objectMapper.readTree(line);
                    } catch (IOException e) {
                        stats.parseErrors++;
                        log.warn("Skipping malformed JSON (line {}): {}", stats.total, e.getMessage());
                        continue;
                    }
                    if (record == null || !record.isObject()) {
                        stats.parseErrors++;
                        log.warn("Skipping non-object JSON (line {})", stats.total);
                        continue;
                    }
                    stats.parsed++;

                    String key = keyBuilder.key(record);
                    if (key == null) {
                        key = DedupKeyBuilder.positionKey(stats.total);
                    }
                    if (!seen.add(key)) {
                        stats.duplicates++;
                        continue;
                    }
                    writer.write(line);
                    writer.write('\n');
                    stats.written++;
                }
            }
            AtomicFiles.move(tmp, output);
        } finally {
            Files.deleteIfExists(tmp);
        }

        log.info("[dedup] {} -> {}: total={} parsed={} written={} duplicates={} parseErrors={} emptyLines={}",
                input, output, stats.total, stats.parsed, stats.written, stats.duplicates,
                stats.parseErrors, stats.emptyLines);
        return stats;
    }

    @Data
    public static class DedupStats {
        private long total;
        private long parsed;
        private long written;
        private long duplicates;
        private long parseErrors;
        private long emptyLines;
    }
}
