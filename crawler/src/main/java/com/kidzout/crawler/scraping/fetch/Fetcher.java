package com.kidzout.crawler.scraping.fetch;

import com.kidzout.crawler.exception.FetchException;
import java.util.Map;

/**
 * Transport seam of the crawler. Implementations decide how bytes are retrieved (plain HTTP or a
 * real browser); callers only see the body or a classified failure.
 */
public interface Fetcher {

    /**
     * Retrieve the resource, applying the implementation's retry policy.
     *
     * @param url     absolute http(s) URL
     * @param headers request headers, usually from {@link RequestHeaderFactory}
     * @return the successful response
     * @throws FetchException when the request failed permanently or ran out of retries
     */
    FetchResult fetch(String url, Map<String, String> headers) throws FetchException;
}
