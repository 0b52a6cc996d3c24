package com.kidzout.crawler.extraction;

import com.kidzout.crawler.exception.DocumentParseException;
import com.kidzout.crawler.model.enums.ExtractionFormat;

/**
 * Turns the raw bytes of one fetched document into candidate records.
 * <p>
 * Implementations are pure: the same bytes and context always give the same records in the same
 * order. Problems with single items are counted in {@link ExtractionResult#getSkippedItems()};
 * only a document that cannot be read as its format at all raises {@link DocumentParseException}.
 */
public interface FormatExtractor {

    ExtractionFormat format();

    ExtractionResult extract(byte[] raw, ExtractionContext context) throws DocumentParseException;
}
