package com.kidzout.crawler.extraction;

import com.kidzout.crawler.exception.DocumentParseException;
import com.kidzout.crawler.model.Source;
import com.kidzout.crawler.model.enums.ExtractionFormat;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.nodes.Document;
import org.springframework.stereotype.Service;

/**
 * Picks the extractor for a document from the source's declared format.
 * <p>
 * HTML pages and location directories try structured data first and fall back to the heuristic
 * extractor only when it yields nothing. Feeds are dispatched on their actual root element, so a
 * source declared as RSS that serves Atom still works.
 */
@Service
@Slf4j
public class ExtractionService {

    private final Map<ExtractionFormat, FormatExtractor> extractors = new EnumMap<>(ExtractionFormat.class);

    public ExtractionService(List<FormatExtractor> formatExtractors) {
        for (FormatExtractor extractor : formatExtractors) {
            extractors.put(extractor.format(), extractor);
        }
        log.debug("Registered extractors: {}", extractors.keySet());
    }

    public ExtractionResult extract(byte[] raw, ExtractionContext context) throws DocumentParseException {
        Source source = context.getSource();
        return switch (source.getFormat()) {
            case HTML, LOCATION_DIRECTORY -> extractHtml(raw, context);
            case RSS, ATOM -> extractFeed(raw, context);
            case ICAL -> extractor(ExtractionFormat.ICAL).extract(raw, context);
        };
    }

    private ExtractionResult extractHtml(byte[] raw, ExtractionContext context) throws DocumentParseException {
        ExtractionResult structured = extractor(ExtractionFormat.STRUCTURED_DATA).extract(raw, context);
        if (!structured.isEmpty()) {
            log.info("   ✨ {}: {} records via JSON-LD", context.sourceName(), structured.size());
            return structured;
        }

        ExtractionResult heuristic = extractor(ExtractionFormat.HTML_HEURISTIC).extract(raw, context);
        return new ExtractionResult(heuristic.getRecords(), structured.getSkippedItems() + heuristic.getSkippedItems());
    }

    private ExtractionResult extractFeed(byte[] raw, ExtractionContext context) throws DocumentParseException {
        Document doc = ExtractionSupport.parseXml(raw, context);
        String rootName = ExtractionSupport.rootName(doc);
        if ("feed".equals(rootName)) {
            return extractor(ExtractionFormat.ATOM).extract(raw, context);
        }
        if ("rss".equals(rootName) || "rdf".equals(rootName)) {
            return extractor(ExtractionFormat.RSS).extract(raw, context);
        }
        throw new DocumentParseException("Expected an RSS or Atom feed from " + context.sourceName()
                + " but found root element " + rootName);
    }

    private FormatExtractor extractor(ExtractionFormat format) {
        FormatExtractor extractor = extractors.get(format);
        if (extractor == null) {
            throw new IllegalStateException("No extractor registered for " + format);
        }
        return extractor;
    }
}
