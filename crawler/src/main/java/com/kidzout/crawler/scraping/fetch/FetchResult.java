package com.kidzout.crawler.scraping.fetch;

import java.nio.charset.Charset;
import java.util.Locale;
import lombok.Builder;
import lombok.Value;
import lombok.With;

/**
 * Successful response of a {@link Fetcher}.
 */
@Value
@Builder
public class FetchResult {
    String url;
    int statusCode;
    byte[] body;
    String contentType;
    @With
    int retries;

    public int size() {
        return body == null ? 0 : body.length;
    }

    /**
     * Charset declared in the content type, or null so the parser can detect it from the document
     */
    public String charsetName() {
        if (contentType == null) return null;
        int idx = contentType.toLowerCase(Locale.ROOT).indexOf("charset=");
        if (idx < 0) return null;
        String name = contentType.substring(idx + 8).replaceAll(";.*$", "").replace("\"", "").trim();
        try {
            return name.isEmpty() || !Charset.isSupported(name) ? null : name;
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
