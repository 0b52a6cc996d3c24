package com.kidzout.crawler.scraping.fetch;

import com.kidzout.crawler.config.CrawlerConfig;
import java.net.URI;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.stereotype.Component;

/**
 * Builds browser-like request headers. The User-Agent rotates through the configured pool on every
 * call and the Referer points at the site root of the requested URL.
 */
@Component
public class RequestHeaderFactory {

    private final List<String> userAgents;
    private final Map<String, String> defaultHeaders;
    private final AtomicInteger rotation = new AtomicInteger();

    public RequestHeaderFactory(CrawlerConfig crawlerConfig) {
        this.userAgents = List.copyOf(crawlerConfig.getFetch().getUserAgents());
        this.defaultHeaders = new LinkedHashMap<>(crawlerConfig.getFetch().getDefaultHeaders());
    }

    public Map<String, String> headersFor(String url) {
        Map<String, String> headers = new LinkedHashMap<>(defaultHeaders);
        headers.put("User-Agent", nextUserAgent());
        String referer = siteRoot(url);
        if (referer != null) {
            headers.put("Referer", referer);
        }
        return headers;
    }

    public String nextUserAgent() {
        if (userAgents.isEmpty()) {
            return "Mozilla/5.0";
        }
        return userAgents.get(Math.floorMod(rotation.getAndIncrement(), userAgents.size()));
    }

    private static String siteRoot(String url) {
        try {
            URI uri = URI.create(url);
            if (uri.getScheme() == null || uri.getHost() == null) return null;
            return uri.getScheme() + "://" + uri.getHost() + "/";
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
