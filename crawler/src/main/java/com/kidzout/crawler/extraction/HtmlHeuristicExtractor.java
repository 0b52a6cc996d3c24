package com.kidzout.crawler.extraction;

import com.kidzout.crawler.config.CrawlerConfig;
import com.kidzout.crawler.model.CandidateRecord;
import com.kidzout.crawler.model.Coordinates;
import com.kidzout.crawler.model.EventTime;
import com.kidzout.crawler.model.SourceSelectors;
import com.kidzout.crawler.model.enums.ExtractionFormat;
import com.kidzout.crawler.model.enums.RecordKind;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.jsoup.select.Selector;
import org.springframework.stereotype.Component;

/**
 * Best-effort extraction from pages without structured data.
 * <p>
 * Repeating blocks are located with the source's item selector followed by a list of common
 * listing selectors. Blocks with the same leading text are collapsed. Titles come from the
 * configured selector, the first heading or the first link; dates from the configured selector
 * or the first German/ISO date in the block text.
 */
@Component
@Slf4j
public class HtmlHeuristicExtractor implements FormatExtractor {

    private static final int PER_SELECTOR_LIMIT = 20;
    private static final String[] HEADINGS = {"h1", "h2", "h3", "h4"};

    private final CrawlerConfig.Extraction settings;

    public HtmlHeuristicExtractor(CrawlerConfig crawlerConfig) {
        this.settings = crawlerConfig.getExtraction();
    }

    @Override
    public ExtractionFormat format() {
        return ExtractionFormat.HTML_HEURISTIC;
    }

    @Override
    public ExtractionResult extract(byte[] raw, ExtractionContext context) {
        Document doc = ExtractionSupport.parseHtml(raw, context);
        boolean locations = context.recordKind() == RecordKind.LOCATION;
        SourceSelectors selectors = context.getSource().getSelectors() != null
                ? context.getSource().getSelectors()
                : new SourceSelectors();

        List<Element> blocks = uniqueBlocks(findBlocks(doc, selectors.getItem(), locations), locations ? 15 : 20);
        log.debug("{}: {} unique candidate blocks", context.sourceName(), blocks.size());

        List<CandidateRecord> records = new ArrayList<>();
        int skipped = 0;
        for (Element block : blocks) {
            if (records.size() >= settings.getMaxHeuristicItems()) break;

            CandidateRecord record = locations
                    ? toLocation(block, selectors, records.size(), context)
                    : toEvent(block, selectors, records.size(), context);
            if (record == null) {
                skipped++;
            } else {
                records.add(record);
            }
        }
        return new ExtractionResult(records, skipped);
    }

    private CandidateRecord toEvent(Element block, SourceSelectors selectors, int index, ExtractionContext context) {
        String title = title(block, selectors.getTitle());
        if (title == null || title.length() < 5) {
            return null;
        }

        String dateText = selectText(block, selectors.getDate());
        if (dateText == null) {
            dateText = DateTimeNormalizer.findDateText(block.text()).orElse(null);
        }
        EventTime start = DateTimeNormalizer.parse(dateText, context.getReferenceYear());

        return CandidateRecord.builder()
                .title(ExtractionSupport.truncate(title, 200))
                .description(description(block, selectors.getDescription()))
                .start(start)
                .timeExpression(start == null ? dateText : null)
                .url(link(block, context))
                .sourceName(context.sourceName())
                .format(ExtractionFormat.HTML_HEURISTIC)
                .kind(RecordKind.EVENT)
                .itemIndex(index)
                .build();
    }

    private CandidateRecord toLocation(Element block, SourceSelectors selectors, int index, ExtractionContext context) {
        String name = title(block, selectors.getName() != null ? selectors.getName() : selectors.getTitle());
        if (name == null || name.length() < 3) {
            return null;
        }

        Coordinates coordinates = Coordinates.parse(block.attr("data-lat"),
                block.hasAttr("data-lng") ? block.attr("data-lng") : block.attr("data-lon"));

        return CandidateRecord.builder()
                .title(ExtractionSupport.truncate(name, 200))
                .description(description(block, selectors.getDescription()))
                .address(selectText(block, selectors.getAddress()))
                .url(link(block, context))
                .sourceName(context.sourceName())
                .format(ExtractionFormat.HTML_HEURISTIC)
                .kind(RecordKind.LOCATION)
                .itemIndex(index)
                .openingHoursText(openingHoursText(block))
                .coordinates(coordinates)
                .build();
    }

    private List<Element> findBlocks(Document doc, String itemSelector, boolean locations) {
        List<String> selectorsToTry = new ArrayList<>();
        if (itemSelector != null && !itemSelector.isBlank()) {
            selectorsToTry.add(itemSelector);
        }
        selectorsToTry.addAll(locations ? settings.getLocationFallbackSelectors() : settings.getEventFallbackSelectors());

        Set<Element> found = new LinkedHashSet<>();
        for (String selector : selectorsToTry) {
            try {
                Elements elements = doc.select(selector);
                if (!elements.isEmpty()) {
                    log.debug("Found {} elements with '{}'", elements.size(), selector);
                    elements.stream().limit(PER_SELECTOR_LIMIT).forEach(found::add);
                    if (found.size() >= settings.getMaxHeuristicItems()) break;
                }
            } catch (Selector.SelectorParseException e) {
                log.debug("Invalid selector '{}': {}", selector, e.getMessage());
            }
        }
        return new ArrayList<>(found);
    }

    /**
     * Drop blocks whose leading text was already seen, or that carry too little text to be an item
     */
    private static List<Element> uniqueBlocks(List<Element> blocks, int minTextLength) {
        Set<String> seen = new HashSet<>();
        List<Element> unique = new ArrayList<>();
        for (Element block : blocks) {
            String text = block.text();
            String key = text.length() > 100 ? text.substring(0, 100) : text;
            if (key.length() > minTextLength && seen.add(key)) {
                unique.add(block);
            }
        }
        return unique;
    }

    private static String title(Element block, String selector) {
        String title = selectText(block, selector);
        if (title != null) return title;

        for (String heading : HEADINGS) {
            Element element = block.selectFirst(heading);
            if (element != null) {
                String text = ExtractionSupport.clean(element.text());
                if (text != null) return text;
            }
        }

        Element link = block.is("a") ? block : block.selectFirst("a");
        return link != null ? ExtractionSupport.clean(link.text()) : null;
    }

    private String description(Element block, String selector) {
        String description = selectText(block, selector);
        if (description == null) {
            description = ExtractionSupport.clean(block.text());
        }
        return ExtractionSupport.truncate(description, settings.getDescriptionLimit());
    }

    private static String link(Element block, ExtractionContext context) {
        Element anchor = block.is("a[href]") ? block : block.selectFirst("a[href]");
        if (anchor != null) {
            String href = anchor.absUrl("href");
            if (!href.isEmpty()) return href;
        }
        return context.getBaseUrl();
    }

    private static String openingHoursText(Element block) {
        Element hours = block.selectFirst("[itemprop=openingHours], .opening-hours, .oeffnungszeiten, [class*='hours']");
        if (hours == null) return null;
        String content = hours.attr("content");
        return ExtractionSupport.clean(content.isEmpty() ? hours.text() : content);
    }

    private static String selectText(Element block, String selector) {
        if (selector == null || selector.isBlank()) return null;
        try {
            Element element = block.selectFirst(selector);
            if (element == null) return null;
            // Prefer machine-readable attributes for dates
            if (element.hasAttr("datetime")) {
                return ExtractionSupport.clean(element.attr("datetime"));
            }
            return ExtractionSupport.clean(element.text());
        } catch (Selector.SelectorParseException e) {
            log.debug("Invalid selector '{}': {}", selector, e.getMessage());
            return null;
        }
    }
}
