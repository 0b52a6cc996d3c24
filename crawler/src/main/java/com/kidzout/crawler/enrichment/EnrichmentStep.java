package com.kidzout.crawler.enrichment;

import com.kidzout.crawler.exception.EnrichmentException;
import com.kidzout.crawler.model.CandidateRecord;
import com.kidzout.crawler.model.EnrichedEvent;
import com.kidzout.crawler.model.Source;

/**
 * One derivation applied to a record during enrichment.
 * <p>
 * A step reads the candidate (and the partially enriched event, for fields set by earlier steps)
 * and writes its own fields. A step that fails leaves its fields unset; the other steps still run.
 */
public interface EnrichmentStep {

    String name();

    void apply(CandidateRecord candidate, Source source, EnrichedEvent event) throws EnrichmentException;
}
