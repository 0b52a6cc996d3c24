package com.kidzout.crawler.quality;

import com.kidzout.crawler.config.CrawlerConfig;
import com.kidzout.crawler.model.FetchAttempt;
import com.kidzout.crawler.model.Source;
import com.kidzout.crawler.model.SourceStats;
import com.kidzout.crawler.model.enums.FetchOutcome;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Rolling reliability score per source, carried across runs.
 * <p>
 * The score is the weighted success ratio over the last {@code windowSize} outcomes, damped by
 * {@code penalty ^ consecutiveFailures}. Sources without history score 0.5. A source is flagged
 * for exclusion from the next run when its failure streak reaches the threshold, or when it has
 * enough history and a score below the minimum. Updates for one source are applied atomically;
 * different sources never contend.
 */
@Service
@Slf4j
public class SourceQualityTracker {

    static final double NO_HISTORY_SCORE = 0.5;

    private final CrawlerConfig.Quality settings;
    private final Map<String, SourceStats> stats = new ConcurrentHashMap<>();

    public SourceQualityTracker(CrawlerConfig crawlerConfig) {
        this.settings = crawlerConfig.getQuality();
    }

    public void report(Source source, FetchAttempt attempt) {
        SourceStats current = stats.computeIfAbsent(source.getName(), SourceStats::new);
        synchronized (current) {
            apply(current, attempt);
        }
    }

    public double score(Source source) {
        return score(source.getName());
    }

    public double score(String sourceName) {
        SourceStats current = stats.get(sourceName);
        if (current == null) return NO_HISTORY_SCORE;
        synchronized (current) {
            return score(current);
        }
    }

    /**
     * Names of the sources flagged by the previous run. The flags are cleared: each flag skips
     * exactly one run.
     */
    public Set<String> consumeExclusions(List<Source> sources) {
        Set<String> excluded = new LinkedHashSet<>();
        for (Source source : sources) {
            SourceStats current = stats.get(source.getName());
            if (current == null) continue;
            synchronized (current) {
                if (current.isExcludeNextRun()) {
                    excluded.add(source.getName());
                    current.setExcludeNextRun(false);
                }
            }
        }
        return excluded;
    }

    public SourceStats stats(String sourceName) {
        return stats.get(sourceName);
    }

    public void load(Map<String, SourceStats> persisted) {
        persisted.forEach((name, value) -> {
            if (value == null) return;
            value.setSourceName(name);
            if (value.getRecentOutcomes() == null) value.setRecentOutcomes(new ArrayList<>());
            if (value.getTotals() == null) value.setTotals(new EnumMap<>(FetchOutcome.class));
            stats.put(name, value);
        });
        log.info("📊 Loaded quality history for {} sources", stats.size());
    }

    public Map<String, SourceStats> snapshot() {
        Map<String, SourceStats> copy = new TreeMap<>();
        stats.forEach(copy::put);
        return copy;
    }

    private void apply(SourceStats s, FetchAttempt attempt) {
        FetchOutcome outcome = attempt.getOutcome();

        s.getRecentOutcomes().add(new SourceStats.OutcomeEntry(outcome, attempt.getHttpStatus(),
                attempt.getTimestamp(), attempt.getItemCount()));
        while (s.getRecentOutcomes().size() > settings.getWindowSize()) {
            s.getRecentOutcomes().remove(0);
        }
        s.getTotals().merge(outcome, 1L, Long::sum);
        s.setTotalAttempts(s.getTotalAttempts() + 1);
        s.setTotalItems(s.getTotalItems() + attempt.getItemCount());
        s.setLastAttempt(attempt.getTimestamp());

        if (outcome == FetchOutcome.SUCCESS) {
            s.setConsecutiveFailures(0);
            s.setLastSuccess(attempt.getTimestamp());
        } else if (outcome.isFailure()) {
            s.setConsecutiveFailures(s.getConsecutiveFailures() + 1);
        }
        // EMPTY leaves the streak unchanged

        double score = score(s);
        boolean exclude = s.getConsecutiveFailures() >= settings.getExclusionThreshold()
                || (s.getTotalAttempts() >= settings.getMinAttemptsForScoreExclusion() && score < settings.getMinScore());
        if (exclude && !s.isExcludeNextRun()) {
            log.warn("⏭️  {} flagged for exclusion from the next run (score {}, {} consecutive failures)",
                    s.getSourceName(), String.format("%.2f", score), s.getConsecutiveFailures());
        }
        s.setExcludeNextRun(exclude);
    }

    private double score(SourceStats s) {
        List<SourceStats.OutcomeEntry> window = s.getRecentOutcomes();
        if (window.isEmpty()) return NO_HISTORY_SCORE;

        double weighted = 0;
        for (SourceStats.OutcomeEntry entry : window) {
            weighted += entry.getOutcome().getWeight();
        }
        double ratio = weighted / window.size();
        double damped = ratio * Math.pow(settings.getConsecutiveFailurePenalty(), s.getConsecutiveFailures());
        return Math.max(0.0, Math.min(1.0, damped));
    }
}
