package com.npssenti.crawler.output;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.npssenti.crawler.config.CrawlerProperties;
import com.npssenti.crawler.service.DocumentIds;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Set;
import java.util.TreeSet;

/**
 * Cross-run duplicate guard persisted as {@code _index.json}:
 * <pre>{"ids": [...], "urls": ["url:&lt;sha1&gt;", ...]}</pre>
 *
 * Grows monotonically. Loaded fully at run start and reconciled with the {@code id} and
 * {@code url} fields of existing JSONL outputs, so lines written after the last flush (a killed
 * run) are still known. Only the output router adds entries; everyone else only reads.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class IndexStore {

    private final CrawlerProperties properties;
    private final ObjectMapper objectMapper;
    private final DocumentIds documentIds;

    private final Set<String> ids = new TreeSet<>();
    private final Set<String> urls = new TreeSet<>();
    private boolean dirty;

    public synchronized void load() {
        ids.clear();
        urls.clear();
        Path path = properties.indexPath();
        try {
            if (Files.exists(path)) {
                JsonNode root = objectMapper.readTree(path.toFile());
                if (root != null && root.isObject()) {
                    root.path("ids").forEach(n -> ids.add(n.asText()));
                    root.path("urls").forEach(n -> urls.add(n.asText()));
                }
                log.info("Loaded index {}: {} ids, {} urls", path, ids.size(), urls.size());
            }
            dirty = false;
            reconcile();
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read index " + path, e);
        }
    }

    public synchronized boolean containsId(String id) {
        return ids.contains(id);
    }

    /** @param fingerprint value from {@link DocumentIds#urlFingerprint(String)} */
    public synchronized boolean containsUrl(String fingerprint) {
        return urls.contains(fingerprint);
    }

    public synchronized void add(String id, String urlFingerprint) {
        dirty |= ids.add(id);
        if (urlFingerprint != null) {
            dirty |= urls.add(urlFingerprint);
        }
    }

    public synchronized int size() {
        return ids.size();
    }

    /** Rewrites the index file atomically if anything was added since the last flush. */
    public synchronized void flush() {
        if (!dirty) {
            return;
        }
        Path path = properties.indexPath();
        ObjectNode root = objectMapper.createObjectNode();
        ids.forEach(root.putArray("ids")::add);
        urls.forEach(root.putArray("urls")::add);
        try {
            AtomicFiles.write(path, objectMapper.writeValueAsBytes(root));
            dirty = false;
            log.debug("Flushed index {} ({} ids)", path, ids.size());
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot write index " + path, e);
        }
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    /** Adds ids and urls found in JSONL outputs but missing from the index. */
    private void reconcile() throws IOException {
        Path dir = properties.dataDir();
        if (!Files.isDirectory(dir)) {
            return;
        }
        int before = ids.size();
        int files = 0;
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir, "*.jsonl")) {
            for (Path file : stream) {
                files++;
                readOutputFile(file);
            }
        }
        if (ids.size() > before) {
            dirty = true;
            log.info("Recovered {} id(s) from {} JSONL file(s) missing from the index",
                    ids.size() - before, files);
        }
    }

    private void readOutputFile(Path file) throws IOException {
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (line.isBlank()) {
                    continue;
                }
                JsonNode record;
                try {
                    record = objectMapper.readTree(line);
                } catch (IOException e) {
                    log.debug("Skipping unparseable line in {}", file);
                    continue;
                }
                String id = record.path("id").asText("");
                if (!id.isEmpty()) {
                    ids.add(id);
                }
                String url = record.path("url").asText("");
                if (!url.isEmpty() && urls.add(documentIds.urlFingerprint(url))) {
                    dirty = true;
                }
            }
        }
    }
}
