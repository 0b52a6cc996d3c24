package com.kidzout.crawler.extraction;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import org.jsoup.Jsoup;
import org.jsoup.internal.StringUtil;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.parser.Parser;

/**
 * Text and document helpers shared by the extractors.
 */
public final class ExtractionSupport {

    private ExtractionSupport() {
    }

    public static Document parseHtml(byte[] raw, ExtractionContext context) {
        try {
            return Jsoup.parse(new ByteArrayInputStream(raw), context.getCharsetName(), baseUrl(context));
        } catch (IOException e) {
            // Reading from a byte array only fails on an unsupported charset name
            throw new UncheckedIOException(e);
        }
    }

    public static Document parseXml(byte[] raw, ExtractionContext context) {
        try {
            return Jsoup.parse(new ByteArrayInputStream(raw), context.getCharsetName(), baseUrl(context),
                    Parser.xmlParser());
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * Lowercase local name (namespace prefix removed) of the document's root element, or null when
     * the document has none
     */
    public static String rootName(Document doc) {
        Element root = doc.children().first();
        return root == null ? null : localName(root);
    }

    /**
     * Lowercase tag name without its namespace prefix, so {@code a:entry} reads as {@code entry}
     */
    public static String localName(Element element) {
        String name = element.normalName();
        int colon = name.indexOf(':');
        return colon < 0 ? name : name.substring(colon + 1);
    }

    /**
     * All elements of the document with the given local name, whatever prefix they carry
     */
    public static List<Element> elementsNamed(Document doc, String localName) {
        List<Element> matches = new ArrayList<>();
        for (Element element : doc.getAllElements()) {
            if (localName(element).equals(localName)) {
                matches.add(element);
            }
        }
        return matches;
    }

    /**
     * Collapse whitespace and trim; null for blank input
     */
    public static String clean(String text) {
        if (text == null) return null;
        String cleaned = text.replace('\u00A0', ' ').replaceAll("\\s+", " ").trim();
        return cleaned.isEmpty() ? null : cleaned;
    }

    /**
     * Plain text of a value that may contain (possibly escaped) HTML markup
     */
    public static String stripHtml(String text) {
        if (text == null) return null;
        if (text.indexOf('<') < 0 && text.indexOf('&') < 0) {
            return clean(text);
        }
        return clean(Jsoup.parse(text).text());
    }

    public static String truncate(String text, int limit) {
        if (text == null || text.length() <= limit) return text;
        return text.substring(0, limit - 1) + "…";
    }

    /**
     * Text of the first direct child whose tag name matches one of the names, case-insensitive.
     * A name given without prefix also matches prefixed children after the exact matches.
     */
    public static String childText(Element parent, String... tagNames) {
        for (String tagName : tagNames) {
            String text = firstChildText(parent, tagName, false);
            if (text == null && tagName.indexOf(':') < 0) {
                text = firstChildText(parent, tagName, true);
            }
            if (text != null) return text;
        }
        return null;
    }

    private static String firstChildText(Element parent, String tagName, boolean byLocalName) {
        for (Element child : parent.children()) {
            String name = byLocalName ? localName(child) : child.normalName();
            if (name.equalsIgnoreCase(tagName)) {
                String text = clean(child.wholeText());
                if (text != null) return text;
            }
        }
        return null;
    }

    public static String absoluteUrl(String baseUrl, String href) {
        if (href == null || href.isBlank()) return null;
        String trimmed = href.trim();
        if (baseUrl == null) return trimmed;
        String resolved = StringUtil.resolve(baseUrl, trimmed);
        return resolved.isEmpty() ? trimmed : resolved;
    }

    private static String baseUrl(ExtractionContext context) {
        return context.getBaseUrl() != null ? context.getBaseUrl() : "";
    }
}
