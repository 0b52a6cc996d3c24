package com.kidzout.crawler.output;

import com.fasterxml.jackson.databind.JsonNode;
import com.kidzout.crawler.config.CrawlerConfig;
import com.kidzout.crawler.exception.PersistenceException;
import com.kidzout.crawler.model.EnrichedEvent;
import com.kidzout.crawler.model.EventTime;
import com.kidzout.crawler.model.dto.CrawlSummaryDTO;
import com.kidzout.crawler.model.enums.RecordKind;
import com.kidzout.crawler.model.enums.RunState;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DatasetWriterTest {

    @TempDir
    Path tempDir;

    private final AtomicJsonWriter jsonWriter = new AtomicJsonWriter(new CrawlerConfig());

    @Test
    void writesEventsLocationsAndMetadata() throws IOException {
        Path file = tempDir.resolve("out").resolve("data.json");
        DatasetWriter writer = new DatasetWriter(jsonWriter, file);
        EnrichedEvent event = EnrichedEvent.builder()
                .id("ev-0123456789abcdef")
                .kind(RecordKind.EVENT)
                .title("Kinderflohmarkt")
                .start(EventTime.floating(LocalDateTime.of(2025, 5, 10, 9, 0)))
                .itemIndex(3)
                .build();
        EnrichedEvent location = EnrichedEvent.builder()
                .id("loc-0123456789abcdef")
                .kind(RecordKind.LOCATION)
                .title("Westpark")
                .build();
        CrawlSummaryDTO summary = CrawlSummaryDTO.builder()
                .startedAt(Instant.parse("2025-03-01T08:00:00Z"))
                .finalState(RunState.DONE)
                .eventCount(1)
                .locationCount(1)
                .build();

        writer.write(List.of(event), List.of(location), summary);

        JsonNode root = jsonWriter.objectMapper().readTree(file.toFile());
        assertEquals("Kinderflohmarkt", root.get("events").get(0).get("title").asText());
        assertEquals("2025-05-10T09:00:00", root.get("events").get(0).get("start").asText());
        assertFalse(root.get("events").get(0).has("itemIndex"));
        assertFalse(root.get("events").get(0).has("description"));
        assertEquals("Westpark", root.get("locations").get(0).get("title").asText());
        assertEquals("DONE", root.get("metadata").get("finalState").asText());
        assertEquals("2025-03-01T08:00:00Z", root.get("metadata").get("startedAt").asText());
        try (Stream<Path> files = Files.list(file.getParent())) {
            assertEquals(List.of(file), files.collect(Collectors.toList()));
        }
    }

    @Test
    void overwritesPreviousDataset() throws IOException {
        Path file = tempDir.resolve("data.json");
        DatasetWriter writer = new DatasetWriter(jsonWriter, file);
        CrawlSummaryDTO summary = CrawlSummaryDTO.builder().finalState(RunState.DONE).build();

        writer.write(List.of(EnrichedEvent.builder().title("alt").build()), List.of(), summary);
        writer.write(List.of(), List.of(), summary);

        JsonNode root = jsonWriter.objectMapper().readTree(file.toFile());
        assertTrue(root.get("events").isEmpty());
    }

    @Test
    void unwritableTargetRaisesPersistenceException() throws IOException {
        Path blocker = tempDir.resolve("blocker");
        Files.writeString(blocker, "not a directory");
        DatasetWriter writer = new DatasetWriter(jsonWriter, blocker.resolve("data.json"));

        assertThrows(PersistenceException.class,
                () -> writer.write(List.of(), List.of(), CrawlSummaryDTO.builder().build()));
    }
}
