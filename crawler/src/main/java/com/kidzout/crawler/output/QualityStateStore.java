package com.kidzout.crawler.output;

import com.fasterxml.jackson.core.type.TypeReference;
import com.kidzout.crawler.config.CrawlerConfig;
import com.kidzout.crawler.model.SourceStats;
import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * crawler_stats.json: source name to reliability history.
 */
@Component
@Slf4j
public class QualityStateStore {

    private static final TypeReference<LinkedHashMap<String, SourceStats>> TYPE = new TypeReference<>() {
    };

    private final AtomicJsonWriter jsonWriter;
    private final Path file;

    @Autowired
    public QualityStateStore(AtomicJsonWriter jsonWriter, CrawlerConfig crawlerConfig) {
        this(jsonWriter, Path.of(crawlerConfig.getOutput().getStatsFile()));
    }

    public QualityStateStore(AtomicJsonWriter jsonWriter, Path file) {
        this.jsonWriter = jsonWriter;
        this.file = file;
    }

    public Map<String, SourceStats> load() {
        try {
            return jsonWriter.read(file, TYPE).orElseGet(LinkedHashMap::new);
        } catch (IOException e) {
            log.warn("⚠️ Ignoring unreadable quality state {}: {}", file, e.getMessage());
            return new LinkedHashMap<>();
        }
    }

    public void save(Map<String, SourceStats> stats) {
        jsonWriter.write(file, stats);
        log.info("💾 Saved quality state for {} sources to {}", stats.size(), file);
    }
}
