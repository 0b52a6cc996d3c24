package com.kidzout.crawler.scraping.fetch;

import com.kidzout.crawler.config.CrawlerConfig;
import com.kidzout.crawler.exception.FetchException;
import com.kidzout.crawler.scraping.Sleeper;
import java.io.IOException;
import java.net.MalformedURLException;
import java.net.SocketTimeoutException;
import java.net.URI;
import java.net.URISyntaxException;
import java.time.Duration;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.HttpStatusException;

/**
 * Retry policy shared by all transports.
 * <p>
 * Subclasses perform a single attempt in {@link #fetchOnce}. Transient failures (timeouts,
 * connection errors, HTTP 429 and 5xx) are retried with exponential backoff; permanent ones
 * (malformed URL, 403, 404 and the other 4xx codes) are rethrown at once with zero retries.
 */
@Slf4j
public abstract class AbstractRetryingFetcher implements Fetcher {

    private final int maxRetries;
    private final Duration initialBackoff;
    private final double backoffMultiplier;
    private final Sleeper sleeper;

    protected AbstractRetryingFetcher(CrawlerConfig.Fetch settings, Sleeper sleeper) {
        this.maxRetries = settings.getMaxRetries();
        this.initialBackoff = settings.getInitialBackoff();
        this.backoffMultiplier = settings.getBackoffMultiplier();
        this.sleeper = sleeper;
    }

    @Override
    public final FetchResult fetch(String url, Map<String, String> headers) throws FetchException {
        validateUrl(url);

        int retries = 0;
        Duration backoff = initialBackoff;
        while (true) {
            try {
                return fetchOnce(url, headers).withRetries(retries);
            } catch (FetchException e) {
                if (!e.isTransient() || retries >= maxRetries) {
                    throw e.withRetries(retries);
                }
                log.warn("Transient failure fetching {} ({}), retry {}/{} in {} ms",
                        url, e.getMessage(), retries + 1, maxRetries, backoff.toMillis());
                try {
                    sleeper.sleep(backoff);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw FetchException.transientFailure("Interrupted while backing off", e.getStatusCode(), true, ie)
                            .withRetries(retries);
                }
                retries++;
                backoff = Duration.ofMillis((long) (backoff.toMillis() * backoffMultiplier));
            }
        }
    }

    /**
     * Perform exactly one request. Failures must be classified with {@link #statusFailure} and
     * {@link #ioFailure} so the retry loop can tell transient from permanent ones.
     */
    protected abstract FetchResult fetchOnce(String url, Map<String, String> headers) throws FetchException;

    /**
     * Classify an HTTP status; returns null for codes that count as a successful response
     */
    protected static FetchException statusFailure(int status, String url) {
        if (status < 400) {
            return null;
        }
        if (status == 429 || status >= 500) {
            return FetchException.transientFailure("HTTP " + status + " from " + url, status, false, null);
        }
        return FetchException.permanent("HTTP " + status + " from " + url, status);
    }

    protected static FetchException ioFailure(IOException e, String url) {
        if (e instanceof HttpStatusException) {
            return statusFailure(((HttpStatusException) e).getStatusCode(), url);
        }
        if (e instanceof SocketTimeoutException) {
            return FetchException.transientFailure("Timeout fetching " + url, null, true, e);
        }
        if (e instanceof MalformedURLException) {
            return FetchException.permanent("Malformed URL " + url, null);
        }
        return FetchException.transientFailure(e.getClass().getSimpleName() + ": " + e.getMessage(), null, false, e);
    }

    protected static String domainOf(String url) {
        String host = URI.create(url).getHost();
        return host == null ? "" : host.toLowerCase();
    }

    private static void validateUrl(String url) throws FetchException {
        if (url == null || url.isBlank()) {
            throw FetchException.permanent("Malformed URL: empty", null);
        }
        try {
            URI uri = new URI(url);
            String scheme = uri.getScheme();
            if (scheme == null || !(scheme.equalsIgnoreCase("http") || scheme.equalsIgnoreCase("https"))
                    || uri.getHost() == null) {
                throw FetchException.permanent("Malformed URL " + url, null);
            }
        } catch (URISyntaxException e) {
            throw FetchException.permanent("Malformed URL " + url, null);
        }
    }
}
