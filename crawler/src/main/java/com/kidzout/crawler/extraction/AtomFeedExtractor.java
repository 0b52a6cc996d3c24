package com.kidzout.crawler.extraction;

import com.kidzout.crawler.config.CrawlerConfig;
import com.kidzout.crawler.exception.DocumentParseException;
import com.kidzout.crawler.model.CandidateRecord;
import com.kidzout.crawler.model.EventTime;
import com.kidzout.crawler.model.enums.ExtractionFormat;
import com.kidzout.crawler.model.enums.RecordKind;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

/**
 * Atom 1.0 feeds: title, summary (or content), alternate link and published (or updated) date per entry.
 */
@Component
@Slf4j
public class AtomFeedExtractor implements FormatExtractor {

    private final int maxItems;
    private final int descriptionLimit;

    public AtomFeedExtractor(CrawlerConfig crawlerConfig) {
        this.maxItems = crawlerConfig.getExtraction().getMaxFeedItems();
        this.descriptionLimit = crawlerConfig.getExtraction().getDescriptionLimit();
    }

    @Override
    public ExtractionFormat format() {
        return ExtractionFormat.ATOM;
    }

    @Override
    public ExtractionResult extract(byte[] raw, ExtractionContext context) throws DocumentParseException {
        Document doc = ExtractionSupport.parseXml(raw, context);
        String rootName = ExtractionSupport.rootName(doc);
        if (!"feed".equals(rootName)) {
            throw new DocumentParseException("Not an Atom feed (root element: " + rootName + ") at " + context.getBaseUrl());
        }

        List<CandidateRecord> records = new ArrayList<>();
        int skipped = 0;

        for (Element entry : ExtractionSupport.elementsNamed(doc, "entry")) {
            if (records.size() >= maxItems) break;

            String title = ExtractionSupport.stripHtml(ExtractionSupport.childText(entry, "title"));
            if (title == null) {
                log.debug("Skipping Atom entry without title in {}", context.sourceName());
                skipped++;
                continue;
            }

            String dateText = ExtractionSupport.childText(entry, "published", "updated");
            EventTime start = DateTimeNormalizer.parse(dateText, context.getReferenceYear());

            records.add(CandidateRecord.builder()
                    .title(title)
                    .description(ExtractionSupport.truncate(ExtractionSupport.stripHtml(
                            ExtractionSupport.childText(entry, "summary", "content")), descriptionLimit))
                    .start(start)
                    .timeExpression(start == null ? dateText : null)
                    .url(ExtractionSupport.absoluteUrl(context.getBaseUrl(), alternateLink(entry)))
                    .sourceName(context.sourceName())
                    .format(ExtractionFormat.ATOM)
                    .kind(RecordKind.EVENT)
                    .itemIndex(records.size())
                    .build());
        }

        return new ExtractionResult(records, skipped);
    }

    private static String alternateLink(Element entry) {
        String fallback = null;
        for (Element child : entry.children()) {
            if (!ExtractionSupport.localName(child).equals("link") || !child.hasAttr("href")) continue;
            String rel = child.attr("rel");
            if (rel.isEmpty() || rel.equals("alternate")) {
                return child.attr("href");
            }
            if (fallback == null) {
                fallback = child.attr("href");
            }
        }
        return fallback;
    }
}
