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
 * RSS 2.0 and RSS 1.0 (RDF) feeds, read with Jsoup's XML parser.
 */
@Component
@Slf4j
public class RssFeedExtractor implements FormatExtractor {

    private final int maxItems;
    private final int descriptionLimit;

    public RssFeedExtractor(CrawlerConfig crawlerConfig) {
        this.maxItems = crawlerConfig.getExtraction().getMaxFeedItems();
        this.descriptionLimit = crawlerConfig.getExtraction().getDescriptionLimit();
    }

    @Override
    public ExtractionFormat format() {
        return ExtractionFormat.RSS;
    }

    @Override
    public ExtractionResult extract(byte[] raw, ExtractionContext context) throws DocumentParseException {
        Document doc = ExtractionSupport.parseXml(raw, context);
        String rootName = ExtractionSupport.rootName(doc);
        if (!"rss".equals(rootName) && !"rdf".equals(rootName)) {
            throw new DocumentParseException("Not an RSS feed (root element: " + rootName + ") at " + context.getBaseUrl());
        }

        List<CandidateRecord> records = new ArrayList<>();
        int skipped = 0;

        for (Element item : ExtractionSupport.elementsNamed(doc, "item")) {
            if (records.size() >= maxItems) break;

            String title = ExtractionSupport.stripHtml(ExtractionSupport.childText(item, "title"));
            if (title == null) {
                log.debug("Skipping RSS item without title in {}", context.sourceName());
                skipped++;
                continue;
            }

            String dateText = ExtractionSupport.childText(item, "pubDate", "dc:date");
            EventTime start = DateTimeNormalizer.parse(dateText, context.getReferenceYear());

            String link = ExtractionSupport.childText(item, "link");
            if (link == null) {
                link = permalinkGuid(item);
            }

            records.add(CandidateRecord.builder()
                    .title(title)
                    .description(ExtractionSupport.truncate(ExtractionSupport.stripHtml(
                            ExtractionSupport.childText(item, "description", "content:encoded")), descriptionLimit))
                    .start(start)
                    .timeExpression(start == null ? dateText : null)
                    .locationText(ExtractionSupport.childText(item, "ev:location", "location"))
                    .url(ExtractionSupport.absoluteUrl(context.getBaseUrl(), link))
                    .sourceName(context.sourceName())
                    .format(ExtractionFormat.RSS)
                    .kind(RecordKind.EVENT)
                    .itemIndex(records.size())
                    .build());
        }

        return new ExtractionResult(records, skipped);
    }

    private static String permalinkGuid(Element item) {
        for (Element child : item.children()) {
            if (ExtractionSupport.localName(child).equals("guid") && !"false".equalsIgnoreCase(child.attr("isPermaLink"))) {
                String guid = ExtractionSupport.clean(child.text());
                if (guid != null && guid.startsWith("http")) return guid;
            }
        }
        return null;
    }
}
