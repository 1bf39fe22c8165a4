package com.npssenti.crawler.output;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.npssenti.crawler.model.Document;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.HashMap;
import java.util.Map;

/**
 * Appends documents to JSONL files, one compact JSON object per line.
 *
 * Files are only ever appended to. Each line is flushed as soon as it is written, so a killed
 * process leaves at most the line in flight incomplete.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class JsonlWriter {

    private final ObjectMapper objectMapper;
    private final Map<Path, BufferedWriter> open = new HashMap<>();

    public synchronized void append(Path file, Document doc) {
        try {
            BufferedWriter writer = writerFor(file);
            writer.write(objectMapper.writeValueAsString(doc));
            writer.write('\n');
            writer.flush();
        } catch (IOException e) {
            log.error("Failed to append to {}: {}", file, e.getMessage(), e);
            throw new UncheckedIOException("JSONL write failed: " + file, e);
        }
    }

    public synchronized void close() {
        for (Map.Entry<Path, BufferedWriter> e : open.entrySet()) {
            try {
                e.getValue().close();
            } catch (IOException ex) {
                log.warn("Failed to close {}: {}", e.getKey(), ex.getMessage());
            }
        }
        open.clear();
    }

    private BufferedWriter writerFor(Path file) throws IOException {
        BufferedWriter writer = open.get(file);
        if (writer == null) {
            Path parent = file.toAbsolutePath().getParent();
            Files.createDirectories(parent);
            writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND);
            open.put(file, writer);
            log.debug("Opened {} for append", file);
        }
        return writer;
    }
}
