package com.kidzout.crawler.output;

import com.fasterxml.jackson.core.type.TypeReference;
import com.kidzout.crawler.config.CrawlerConfig;
import com.kidzout.crawler.model.GeocodeCacheEntry;
import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * geocode_cache.json: normalized address key to coordinates or unresolvable marker.
 */
@Component
@Slf4j
public class GeocodeCacheStore {

    private static final TypeReference<LinkedHashMap<String, GeocodeCacheEntry>> TYPE = new TypeReference<>() {
    };

    private final AtomicJsonWriter jsonWriter;
    private final Path file;

    @Autowired
    public GeocodeCacheStore(AtomicJsonWriter jsonWriter, CrawlerConfig crawlerConfig) {
        this(jsonWriter, Path.of(crawlerConfig.getOutput().getGeocodeCacheFile()));
    }

    public GeocodeCacheStore(AtomicJsonWriter jsonWriter, Path file) {
        this.jsonWriter = jsonWriter;
        this.file = file;
    }

    /**
     * Entries from the previous run. An unreadable cache is discarded; it only costs lookups.
     */
    public Map<String, GeocodeCacheEntry> load() {
        try {
            return jsonWriter.read(file, TYPE).orElseGet(LinkedHashMap::new);
        } catch (IOException e) {
            log.warn("⚠️ Ignoring unreadable geocode cache {}: {}", file, e.getMessage());
            return new LinkedHashMap<>();
        }
    }

    public void save(Map<String, GeocodeCacheEntry> entries) {
        jsonWriter.write(file, entries);
        log.info("💾 Saved {} geocode cache entries to {}", entries.size(), file);
    }
}
