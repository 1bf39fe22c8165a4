package com.npssenti.crawler.output;

import com.npssenti.crawler.config.CrawlerProperties;
import com.npssenti.crawler.model.Document;
import com.npssenti.crawler.model.SourceType;
import com.npssenti.crawler.service.DocumentIds;
import com.npssenti.crawler.service.dedup.DedupKeyBuilder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.HashSet;
import java.util.Set;

/**
 * Routes accepted documents to their output file and keeps the index in step.
 * Supports PER_SOURCE (gdelt.jsonl, youtube.jsonl, forum_&lt;site&gt;.jsonl) or UNIFIED modes.
 *
 * Duplicate checks, in order: id already in the index (earlier runs), then the content key
 * already seen in this run. The router is the only writer of the index, which is flushed after
 * every accepted write.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class OutputRouter {

    private final JsonlWriter jsonlWriter;
    private final IndexStore indexStore;
    private final DedupKeyBuilder keyBuilder;
    private final DocumentIds documentIds;
    private final CrawlerProperties properties;

    private final Set<String> runKeys = new HashSet<>();
    private long position;

    /** Loads the index and clears the in-run key set. */
    public synchronized void open() {
        indexStore.load();
        runKeys.clear();
        position = 0;
    }

    public synchronized StoreOutcome store(Document doc) {
        position++;
        if (indexStore.containsId(doc.getId())) {
            log.debug("Duplicate id {} already indexed: {}", doc.getId(), doc.getUrl());
            return StoreOutcome.DUPLICATE;
        }
        String key = keyBuilder.key(doc);
        if (key == null) {
            key = DedupKeyBuilder.positionKey(position);
        }
        if (!runKeys.add(key)) {
            log.debug("Duplicate content in this run: {}", doc.getUrl());
            return StoreOutcome.DUPLICATE;
        }

        jsonlWriter.append(fileFor(doc), doc);
        indexStore.add(doc.getId(), doc.getUrl() == null ? null : documentIds.urlFingerprint(doc.getUrl()));
        indexStore.flush();
        return StoreOutcome.WRITTEN;
    }

    /** Pre-fetch check against URLs stored by earlier runs. */
    public boolean isIndexedUrl(String urlFingerprint) {
        return indexStore.containsUrl(urlFingerprint);
    }

    /** Closes output files and flushes the index; called once per pipeline run. */
    public synchronized void close() {
        jsonlWriter.close();
        indexStore.flush();
    }

    public Path fileFor(Document doc) {
        CrawlerProperties.Output output = properties.getOutput();
        if (output.getMode() == CrawlerProperties.Output.OutputMode.UNIFIED) {
            return properties.dataDir().resolve(output.getUnifiedFile() + ".jsonl");
        }
        String name = doc.getSourceType() == SourceType.FORUM
                ? "forum_" + doc.getSource()
                : doc.getSource();
        return properties.dataDir().resolve(name + ".jsonl");
    }
}
