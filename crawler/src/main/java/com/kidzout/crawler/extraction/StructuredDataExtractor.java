package com.kidzout.crawler.extraction;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.kidzout.crawler.config.CrawlerConfig;
import com.kidzout.crawler.model.CandidateRecord;
import com.kidzout.crawler.model.Coordinates;
import com.kidzout.crawler.model.EventTime;
import com.kidzout.crawler.model.enums.ExtractionFormat;
import com.kidzout.crawler.model.enums.RecordKind;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

/**
 * Extracts schema.org events and places from JSON-LD blocks embedded in HTML pages.
 * <p>
 * Blocks may hold a single object, an array, or an {@code @graph}. Event sources keep nodes whose
 * type is a configured event type or any {@code *Event} subtype; location directories keep the
 * configured place types. A block that is not valid JSON, or a matching node without a name,
 * is skipped and counted.
 */
@Component
@Slf4j
public class StructuredDataExtractor implements FormatExtractor {

    private final ObjectMapper objectMapper;
    private final Set<String> eventTypesLowercase;
    private final Set<String> locationTypesLowercase;
    private final int descriptionLimit;

    public StructuredDataExtractor(CrawlerConfig crawlerConfig) {
        CrawlerConfig.Extraction settings = crawlerConfig.getExtraction();
        this.objectMapper = new ObjectMapper();
        // Pre-compute lowercase sets for O(1) lookup
        this.eventTypesLowercase = lowercase(settings.getEventJsonLdTypes());
        this.locationTypesLowercase = lowercase(settings.getLocationJsonLdTypes());
        this.descriptionLimit = settings.getDescriptionLimit();
    }

    @Override
    public ExtractionFormat format() {
        return ExtractionFormat.STRUCTURED_DATA;
    }

    @Override
    public ExtractionResult extract(byte[] raw, ExtractionContext context) {
        Document doc = ExtractionSupport.parseHtml(raw, context);
        RecordKind kind = context.recordKind();

        List<CandidateRecord> records = new ArrayList<>();
        int skipped = 0;

        for (Element script : doc.select("script[type='application/ld+json']")) {
            String jsonContent = script.data();
            if (jsonContent == null || jsonContent.isBlank()) continue;

            JsonNode root;
            try {
                root = objectMapper.readTree(jsonContent.trim());
            } catch (JsonProcessingException e) {
                log.debug("Skipping malformed JSON-LD block on {}: {}", context.getBaseUrl(), e.getOriginalMessage());
                skipped++;
                continue;
            }

            for (JsonNode node : candidateNodes(root)) {
                if (!matchesKind(node, kind)) continue;

                String name = ExtractionSupport.stripHtml(text(node, "name"));
                if (name == null) {
                    log.debug("Skipping JSON-LD {} without a name on {}", typeNames(node), context.getBaseUrl());
                    skipped++;
                    continue;
                }

                CandidateRecord record = kind == RecordKind.LOCATION
                        ? toLocation(node, name, records.size(), context)
                        : toEvent(node, name, records.size(), context);
                records.add(record);
            }
        }

        return new ExtractionResult(records, skipped);
    }

    private CandidateRecord toEvent(JsonNode node, String name, int index, ExtractionContext context) {
        CandidateRecord.CandidateRecordBuilder builder = CandidateRecord.builder()
                .title(name)
                .description(ExtractionSupport.truncate(ExtractionSupport.stripHtml(text(node, "description")), descriptionLimit))
                .url(link(node, context))
                .sourceName(context.sourceName())
                .format(ExtractionFormat.STRUCTURED_DATA)
                .kind(RecordKind.EVENT)
                .itemIndex(index);

        String startText = text(node, "startDate");
        EventTime start = DateTimeNormalizer.parse(startText, context.getReferenceYear());
        builder.start(start);
        builder.end(DateTimeNormalizer.parse(text(node, "endDate"), context.getReferenceYear()));
        if (start == null && startText != null) {
            builder.timeExpression(startText);
        }

        JsonNode location = node.get("location");
        if (location != null) {
            if (location.isArray() && !location.isEmpty()) {
                location = location.get(0);
            }
            if (location.isTextual()) {
                builder.locationText(ExtractionSupport.clean(location.asText()));
            } else if (location.isObject()) {
                builder.locationText(ExtractionSupport.clean(text(location, "name")));
                builder.address(address(location.get("address")));
                builder.coordinates(geo(location.get("geo")));
            }
        }
        return builder.build();
    }

    private CandidateRecord toLocation(JsonNode node, String name, int index, ExtractionContext context) {
        return CandidateRecord.builder()
                .title(name)
                .description(ExtractionSupport.truncate(ExtractionSupport.stripHtml(text(node, "description")), descriptionLimit))
                .address(address(node.get("address")))
                .url(link(node, context))
                .sourceName(context.sourceName())
                .format(ExtractionFormat.STRUCTURED_DATA)
                .kind(RecordKind.LOCATION)
                .itemIndex(index)
                .openingHoursText(openingHours(node))
                .coordinates(geo(node.get("geo")))
                .build();
    }

    /**
     * Flatten a JSON-LD root into the nodes worth looking at: array elements and @graph members
     */
    private List<JsonNode> candidateNodes(JsonNode root) {
        List<JsonNode> nodes = new ArrayList<>();
        if (root.isArray()) {
            for (JsonNode element : root) {
                nodes.addAll(candidateNodes(element));
            }
        } else if (root.isObject()) {
            if (root.has("@type")) {
                nodes.add(root);
            }
            JsonNode graph = root.get("@graph");
            if (graph != null && graph.isArray()) {
                graph.forEach(member -> {
                    if (member.isObject()) nodes.add(member);
                });
            }
        }
        return nodes;
    }

    private boolean matchesKind(JsonNode node, RecordKind kind) {
        for (String type : typeNames(node)) {
            String lower = type.toLowerCase();
            if (kind == RecordKind.LOCATION) {
                if (locationTypesLowercase.contains(lower)) return true;
            } else if (eventTypesLowercase.contains(lower) || lower.endsWith("event")) {
                return true;
            }
        }
        return false;
    }

    private List<String> typeNames(JsonNode node) {
        JsonNode typeNode = node.get("@type");
        if (typeNode == null) return List.of();
        List<String> types = new ArrayList<>();
        if (typeNode.isArray()) {
            typeNode.forEach(t -> types.add(stripVocabulary(t.asText())));
        } else {
            types.add(stripVocabulary(typeNode.asText()));
        }
        return types;
    }

    private String link(JsonNode node, ExtractionContext context) {
        String url = ExtractionSupport.absoluteUrl(context.getBaseUrl(), text(node, "url"));
        return url != null ? url : context.getBaseUrl();
    }

    private String address(JsonNode addressNode) {
        if (addressNode == null || addressNode.isNull()) return null;
        if (addressNode.isTextual()) {
            return ExtractionSupport.clean(addressNode.asText());
        }
        if (addressNode.isArray() && !addressNode.isEmpty()) {
            return address(addressNode.get(0));
        }
        String street = ExtractionSupport.clean(text(addressNode, "streetAddress"));
        String postal = ExtractionSupport.clean(text(addressNode, "postalCode"));
        String city = ExtractionSupport.clean(text(addressNode, "addressLocality"));

        String locality = ((postal != null ? postal + " " : "") + (city != null ? city : "")).trim();
        if (street != null && !locality.isEmpty()) return street + ", " + locality;
        if (street != null) return street;
        return locality.isEmpty() ? null : locality;
    }

    private Coordinates geo(JsonNode geoNode) {
        if (geoNode == null || !geoNode.isObject()) return null;
        return Coordinates.parse(text(geoNode, "latitude"), text(geoNode, "longitude"));
    }

    /**
     * openingHours as text; an openingHoursSpecification is rendered as "Monday 09:00-17:00; ..."
     */
    private String openingHours(JsonNode node) {
        JsonNode hours = node.get("openingHours");
        if (hours != null) {
            if (hours.isArray()) {
                List<String> parts = new ArrayList<>();
                hours.forEach(h -> parts.add(h.asText()));
                return ExtractionSupport.clean(String.join("; ", parts));
            }
            return ExtractionSupport.clean(hours.asText());
        }

        JsonNode specification = node.get("openingHoursSpecification");
        if (specification == null) return null;
        List<String> parts = new ArrayList<>();
        for (JsonNode spec : asList(specification)) {
            String opens = text(spec, "opens");
            String closes = text(spec, "closes");
            JsonNode days = spec.get("dayOfWeek");
            if (opens == null || closes == null || days == null) continue;
            List<String> dayNames = new ArrayList<>();
            for (JsonNode day : asList(days)) {
                dayNames.add(stripVocabulary(day.asText()));
            }
            parts.add(String.join(", ", dayNames) + " " + shortTime(opens) + "-" + shortTime(closes));
        }
        return parts.isEmpty() ? null : String.join("; ", parts);
    }

    private static String shortTime(String time) {
        // "09:00:00" -> "09:00"
        return time.length() > 5 && time.charAt(5) == ':' ? time.substring(0, 5) : time;
    }

    private static String stripVocabulary(String value) {
        int slash = value.lastIndexOf('/');
        return slash >= 0 ? value.substring(slash + 1) : value;
    }

    private static List<JsonNode> asList(JsonNode node) {
        List<JsonNode> nodes = new ArrayList<>();
        if (node.isArray()) {
            node.forEach(nodes::add);
        } else {
            nodes.add(node);
        }
        return nodes;
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || value.isContainerNode()) return null;
        String text = value.asText();
        return text.isBlank() ? null : text.trim();
    }

    private static Set<String> lowercase(List<String> values) {
        return values == null ? Set.of() : values.stream().map(String::toLowerCase).collect(Collectors.toSet());
    }
}
