package com.kidzout.crawler.scraping.fetch;

import com.kidzout.crawler.config.CrawlerConfig;
import com.kidzout.crawler.exception.FetchException;
import com.kidzout.crawler.scraping.Sleeper;
import jakarta.annotation.PreDestroy;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import lombok.extern.slf4j.Slf4j;
import org.openqa.selenium.TimeoutException;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebDriverException;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Browser-backed transport for sites that only render with JavaScript or reject plain clients.
 * <p>
 * Keeps one driver per domain, used by one request at a time. The browser does not expose the
 * HTTP status of the navigation, so a loaded page is reported as 200. Request headers other than
 * those baked into the browser profile cannot be set per call and are ignored.
 */
@Component
@ConditionalOnProperty(name = "crawler.fetch.type", havingValue = "browser")
@Slf4j
public class SeleniumBrowserFetcher extends AbstractRetryingFetcher {

    private final ObjectProvider<WebDriver> webDriverProvider;
    private final Map<String, DriverSlot> drivers = new ConcurrentHashMap<>();

    public SeleniumBrowserFetcher(CrawlerConfig crawlerConfig, ObjectProvider<WebDriver> webDriverProvider) {
        super(crawlerConfig.getFetch(), Sleeper.SYSTEM);
        this.webDriverProvider = webDriverProvider;
    }

    @Override
    protected FetchResult fetchOnce(String url, Map<String, String> headers) throws FetchException {
        DriverSlot slot = drivers.computeIfAbsent(domainOf(url), domain -> new DriverSlot());
        slot.lock.lock();
        try {
            if (slot.driver == null) {
                slot.driver = webDriverProvider.getObject();
            }
            slot.driver.get(url);
            String html = slot.driver.getPageSource();
            byte[] body = html == null ? new byte[0] : html.getBytes(StandardCharsets.UTF_8);
            log.debug("Browser loaded {} ({} bytes)", url, body.length);
            return FetchResult.builder()
                    .url(slot.driver.getCurrentUrl())
                    .statusCode(200)
                    .body(body)
                    .contentType("text/html; charset=UTF-8")
                    .build();
        } catch (TimeoutException e) {
            throw FetchException.transientFailure("Page load timeout for " + url, null, true, e);
        } catch (WebDriverException e) {
            // A crashed driver is replaced on the next attempt
            quietlyQuit(slot);
            throw FetchException.transientFailure("Browser error for " + url + ": " + e.getClass().getSimpleName(),
                    null, false, e);
        } finally {
            slot.lock.unlock();
        }
    }

    @PreDestroy
    public void shutdown() {
        log.info("Closing {} browser session(s)", drivers.size());
        drivers.values().forEach(this::quietlyQuit);
        drivers.clear();
    }

    private void quietlyQuit(DriverSlot slot) {
        if (slot.driver == null) return;
        try {
            slot.driver.quit();
        } catch (WebDriverException e) {
            log.warn("Failed to quit browser driver: {}", e.getMessage());
        } finally {
            slot.driver = null;
        }
    }

    private static final class DriverSlot {
        private final ReentrantLock lock = new ReentrantLock();
        private WebDriver driver;
    }
}
