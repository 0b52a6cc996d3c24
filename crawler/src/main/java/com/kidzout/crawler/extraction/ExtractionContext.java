package com.kidzout.crawler.extraction;

import com.kidzout.crawler.model.Source;
import com.kidzout.crawler.model.enums.RecordKind;
import java.time.Year;
import lombok.Builder;
import lombok.Value;

/**
 * Everything an extractor may know about a document besides its bytes.
 */
@Value
@Builder
public class ExtractionContext {
    Source source;
    String baseUrl;       // final URL after redirects, used to resolve relative links
    String charsetName;   // from the Content-Type header; null lets the parser detect it
    // Year assumed for dates written without one, fixed when the document is fetched
    @Builder.Default
    int referenceYear = Year.now().getValue();

    public static ExtractionContext forSource(Source source) {
        return ExtractionContext.builder().source(source).baseUrl(source.getUrl()).build();
    }

    public RecordKind recordKind() {
        return source.getRecordKind();
    }

    public String sourceName() {
        return source.getName();
    }
}
