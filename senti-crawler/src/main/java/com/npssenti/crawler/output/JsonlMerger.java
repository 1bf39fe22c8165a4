package com.npssenti.crawler.output;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.npssenti.crawler.service.extract.PublishDateResolver;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Merges a new batch into an existing JSONL output, ordered by (published_at, id).
 *
 * Records without a parseable published_at sort first. The sort is stable, so records with equal
 * keys keep their input order (existing before batch). A later record repeating an earlier id is
 * dropped. The result replaces {@code output} atomically.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class JsonlMerger {

    private static final Comparator<Entry> ORDER = Comparator
            .comparing(Entry::publishedAt, Comparator.nullsFirst(Comparator.naturalOrder()))
            .thenComparing(Entry::id, Comparator.nullsFirst(Comparator.naturalOrder()));

    private final ObjectMapper objectMapper;

    public MergeStats merge(Path existing, Path batch, Path output) throws IOException {
        List<Entry> entries = new ArrayList<>();
        Set<String> ids = new HashSet<>();
        int[] counters = new int[3]; // read, duplicates, parseErrors

        if (existing != null && Files.exists(existing)) {
            read(existing, entries, ids, counters);
        }
        read(batch, entries, ids, counters);

        entries.sort(ORDER);

        StringBuilder sb = new StringBuilder();
        for (Entry e : entries) {
            sb.append(e.line()).append('\n');
        }
        AtomicFiles.writeString(output, sb.toString());

        MergeStats stats = new MergeStats(counters[0], entries.size(), counters[1], counters[2]);
        log.info("[merge] {} + {} -> {}: {}", existing, batch, output, stats);
        return stats;
    }

    public record MergeStats(int read, int written, int duplicates, int parseErrors) {}

    // ── Internal ─────────────────────────────────────────────────────────────

    private record Entry(Instant publishedAt, String id, String line) {}

    private void read(Path file, List<Entry> out, Set<String> ids, int[] counters) throws IOException {
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (line.isBlank()) {
                    continue;
                }
                counters[0]++;
                JsonNode record;
                try {
                    record = objectMapper.readTree(line);
                } catch (IOException e) {
                    counters[2]++;
                    log.warn("Skipping malformed JSON in {}: {}", file, e.getMessage());
                    continue;
                }
                String id = record.hasNonNull("id") ? record.get("id").asText() : null;
                if (id != null && !ids.add(id)) {
                    counters[1]++;
                    continue;
                }
                Instant published = record.hasNonNull("published_at")
                        ? PublishDateResolver.parse(record.get("published_at").asText())
                        : null;
                out.add(new Entry(published, id, line));
            }
        }
    }
}
