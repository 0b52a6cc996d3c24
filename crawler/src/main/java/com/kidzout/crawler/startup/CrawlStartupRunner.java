package com.kidzout.crawler.startup;

import com.kidzout.crawler.model.dto.CrawlSummaryDTO;
import com.kidzout.crawler.model.enums.RunState;
import com.kidzout.crawler.scraping.CrawlOrchestrator;
import java.time.LocalDateTime;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Runs one crawl when the application starts. The process exit code reflects the run's final
 * state: 0 when the dataset was written, 1 otherwise.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "crawler.run-on-startup", havingValue = "true", matchIfMissing = true)
public class CrawlStartupRunner implements ApplicationRunner, ExitCodeGenerator {

    private final CrawlOrchestrator crawlOrchestrator;

    private volatile int exitCode = 0;

    @Override
    public void run(ApplicationArguments args) {
        log.info("🚀 KidzOut crawler starting at {}", LocalDateTime.now());
        CrawlSummaryDTO summary = crawlOrchestrator.run();
        if (summary.getFinalState() != RunState.DONE) {
            log.error("❌ Crawl did not complete: {}", summary.getError());
            exitCode = 1;
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
