package com.kidzout.crawler.scraping;

import com.kidzout.crawler.model.CandidateRecord;
import com.kidzout.crawler.model.FetchAttempt;
import com.kidzout.crawler.model.Source;
import java.util.List;
import lombok.Value;

/**
 * What one worker produced for one source: the attempt to report and the extracted records.
 */
@Value
public class SourceCrawlResult {
    Source source;
    FetchAttempt attempt;
    List<CandidateRecord> records;
}
