package com.kidzout.crawler.output;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.kidzout.crawler.config.CrawlerConfig;
import com.kidzout.crawler.exception.PersistenceException;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * JSON file access for run output. Writes go to a temporary file in the target directory that is
 * then renamed over the target, so readers never see a half-written file.
 */
@Component
@Slf4j
public class AtomicJsonWriter {

    private final ObjectMapper objectMapper;

    public AtomicJsonWriter(CrawlerConfig crawlerConfig) {
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .configure(SerializationFeature.INDENT_OUTPUT, crawlerConfig.getOutput().isPrettyPrint());
    }

    public void write(Path target, Object value) {
        Path absolute = target.toAbsolutePath();
        Path tmp = null;
        try {
            Path dir = absolute.getParent();
            Files.createDirectories(dir);
            tmp = Files.createTempFile(dir, absolute.getFileName().toString(), ".tmp");
            objectMapper.writeValue(tmp.toFile(), value);
            try {
                Files.move(tmp, absolute, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                log.debug("Atomic move not supported for {}, replacing non-atomically", absolute);
                Files.move(tmp, absolute, StandardCopyOption.REPLACE_EXISTING);
            }
            log.debug("Wrote {}", absolute);
        } catch (IOException e) {
            deleteQuietly(tmp);
            throw new PersistenceException("Failed to write " + absolute, e);
        }
    }

    /**
     * Read a JSON file; empty when it does not exist
     */
    public <T> Optional<T> read(Path source, TypeReference<T> type) throws IOException {
        if (!Files.exists(source)) {
            return Optional.empty();
        }
        return Optional.ofNullable(objectMapper.readValue(source.toFile(), type));
    }

    public ObjectMapper objectMapper() {
        return objectMapper;
    }

    private static void deleteQuietly(Path tmp) {
        if (tmp == null) return;
        try {
            Files.deleteIfExists(tmp);
        } catch (IOException e) {
            log.warn("Could not remove temporary file {}: {}", tmp, e.getMessage());
        }
    }
}
