package com.kidzout.crawler.scraping.fetch;

import com.kidzout.crawler.config.CrawlerConfig;
import com.kidzout.crawler.exception.FetchException;
import com.kidzout.crawler.scraping.Sleeper;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Connection;
import org.jsoup.Jsoup;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Default transport: plain HTTP through Jsoup, one session (and cookie store) per domain.
 */
@Component
@ConditionalOnProperty(name = "crawler.fetch.type", havingValue = "http", matchIfMissing = true)
@Slf4j
public class JsoupHttpFetcher extends AbstractRetryingFetcher {

    private final int timeoutMillis;
    private final int maxBodyBytes;
    private final Map<String, Connection> sessions = new ConcurrentHashMap<>();

    @Autowired
    public JsoupHttpFetcher(CrawlerConfig crawlerConfig) {
        this(crawlerConfig.getFetch(), Sleeper.SYSTEM);
    }

    public JsoupHttpFetcher(CrawlerConfig.Fetch settings, Sleeper sleeper) {
        super(settings, sleeper);
        this.timeoutMillis = (int) settings.getTimeout().toMillis();
        this.maxBodyBytes = settings.getMaxBodyBytes();
    }

    @Override
    protected FetchResult fetchOnce(String url, Map<String, String> headers) throws FetchException {
        Connection session = sessions.computeIfAbsent(domainOf(url), domain -> Jsoup.newSession()
                .timeout(timeoutMillis)
                .maxBodySize(maxBodyBytes)
                .followRedirects(true)
                .ignoreHttpErrors(true)
                .ignoreContentType(true));

        try {
            Connection.Response response = session.newRequest()
                    .url(url)
                    .headers(headers)
                    .method(Connection.Method.GET)
                    .execute();

            FetchException failure = statusFailure(response.statusCode(), url);
            if (failure != null) {
                throw failure;
            }

            // The body is streamed lazily; read errors surface here as unchecked
            byte[] body = response.bodyAsBytes();
            if (maxBodyBytes > 0 && body.length >= maxBodyBytes) {
                log.warn("⚠️ Response from {} truncated at {} bytes", url, maxBodyBytes);
            }
            log.debug("Fetched {} -> HTTP {} ({} bytes)", url, response.statusCode(), body.length);
            return FetchResult.builder()
                    .url(response.url().toString())
                    .statusCode(response.statusCode())
                    .body(body)
                    .contentType(response.contentType())
                    .build();
        } catch (IOException e) {
            throw ioFailure(e, url);
        } catch (UncheckedIOException e) {
            throw ioFailure(e.getCause(), url);
        } catch (IllegalArgumentException e) {
            throw FetchException.permanent("Malformed URL " + url + ": " + e.getMessage(), null);
        }
    }
}
