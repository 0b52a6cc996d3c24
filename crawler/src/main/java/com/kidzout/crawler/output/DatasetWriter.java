package com.kidzout.crawler.output;

import com.kidzout.crawler.config.CrawlerConfig;
import com.kidzout.crawler.model.EnrichedEvent;
import com.kidzout.crawler.model.dto.CrawlSummaryDTO;
import com.kidzout.crawler.model.dto.DatasetDTO;
import java.nio.file.Path;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * data.json: events, locations and the run summary as metadata.
 */
@Component
@Slf4j
public class DatasetWriter {

    private final AtomicJsonWriter jsonWriter;
    private final Path file;

    @Autowired
    public DatasetWriter(AtomicJsonWriter jsonWriter, CrawlerConfig crawlerConfig) {
        this(jsonWriter, Path.of(crawlerConfig.getOutput().getDataFile()));
    }

    public DatasetWriter(AtomicJsonWriter jsonWriter, Path file) {
        this.jsonWriter = jsonWriter;
        this.file = file;
    }

    public void write(List<EnrichedEvent> events, List<EnrichedEvent> locations, CrawlSummaryDTO summary) {
        jsonWriter.write(file, new DatasetDTO(events, locations, summary));
        log.info("💾 Saved {} events and {} locations to {}", events.size(), locations.size(), file);
    }

    public Path getFile() {
        return file;
    }
}
