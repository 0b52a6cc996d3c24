package com.kidzout.crawler.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

@Component
@ConfigurationProperties(prefix = "crawler")
@Validated
@Data
public class CrawlerConfig {

    private String sourcesFile = "classpath:sources.yml";
    private boolean runOnStartup = true;
    @Min(1)
    private int workerCount = 5;
    @Min(1)
    private int enrichmentThreads = 4;
    private Duration runTimeout = Duration.ofMinutes(10);

    @Valid
    private RateLimit rateLimit = new RateLimit();
    @Valid
    private Fetch fetch = new Fetch();
    @Valid
    private Quality quality = new Quality();
    private Geocoder geocoder = new Geocoder();
    private Output output = new Output();
    private Defaults defaults = new Defaults();
    private Extraction extraction = new Extraction();

    @Data
    public static class RateLimit {
        private Duration baseInterval = Duration.ofSeconds(4);
        @DecimalMin("0.0")
        @DecimalMax("0.9")
        private double jitterFraction = 0.2;
        @Min(1)
        private int maxBackoffMultiplier = 8;
        // Consecutive successes needed to halve the backoff multiplier
        @Min(1)
        private int recoverySuccesses = 3;
    }

    @Data
    public static class Fetch {
        private FetcherType type = FetcherType.HTTP;
        @Min(0)
        private int maxRetries = 3;
        private Duration initialBackoff = Duration.ofSeconds(1);
        private double backoffMultiplier = 2.0;
        private Duration timeout = Duration.ofSeconds(30);
        private int maxBodyBytes = 10 * 1024 * 1024;
        // Only read by the browser transport
        private boolean headlessBrowser = true;

        private List<String> userAgents = new ArrayList<>(Arrays.asList(
                "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/120.0.0.0 Safari/537.36",
                "Mozilla/5.0 (Macintosh; Intel Mac OS X 10_15_7) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/120.0.0.0 Safari/537.36",
                "Mozilla/5.0 (Windows NT 10.0; Win64; x64; rv:121.0) Gecko/20100101 Firefox/121.0",
                "Mozilla/5.0 (Macintosh; Intel Mac OS X 10_15_7) AppleWebKit/605.1.15 (KHTML, like Gecko) Version/17.1 Safari/605.1.15",
                "Mozilla/5.0 (X11; Linux x86_64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/120.0.0.0 Safari/537.36"
        ));

        // Browser profile sent with every request; User-Agent and Referer are added per call
        private Map<String, String> defaultHeaders = new LinkedHashMap<>(Map.of(
                "Accept", "text/html,application/xhtml+xml,application/xml;q=0.9,text/calendar;q=0.8,*/*;q=0.7",
                "Accept-Language", "de-DE,de;q=0.9,en;q=0.8",
                "Accept-Encoding", "gzip, deflate",
                "Cache-Control", "no-cache",
                "DNT", "1",
                "Upgrade-Insecure-Requests", "1"
        ));

        public enum FetcherType {
            HTTP, BROWSER
        }
    }

    @Data
    public static class Quality {
        @Min(1)
        private int windowSize = 20;
        // Consecutive failures that flag a source for exclusion from the next run
        @Min(1)
        private int exclusionThreshold = 5;
        private int minAttemptsForScoreExclusion = 10;
        private double minScore = 0.2;
        private double consecutiveFailurePenalty = 0.8;
    }

    @Data
    public static class Geocoder {
        private boolean enabled = true;
        private String baseUrl = "https://nominatim.openstreetmap.org/search";
        private String userAgent = "KidzOut-Crawler/4.1 (+https://github.com/ElCapitano-builder/kidzout)";
        private Duration minInterval = Duration.ofSeconds(1);
        private Duration timeout = Duration.ofSeconds(10);
        private Duration staleAfter = Duration.ofDays(90);
        private Duration negativeStaleAfter = Duration.ofDays(7);
        private String countrySuffix = "Germany";
    }

    @Data
    public static class Output {
        private String dataFile = "data.json";
        private String geocodeCacheFile = "geocode_cache.json";
        private String statsFile = "crawler_stats.json";
        private boolean prettyPrint = true;
    }

    @Data
    public static class Defaults {
        private String city = "München";
        private String region = "BY";
        private String country = "DE";
    }

    @Data
    public static class Extraction {
        private int maxFeedItems = 50;
        private int maxHeuristicItems = 30;
        private int descriptionLimit = 500;

        private List<String> eventJsonLdTypes = new ArrayList<>(Arrays.asList(
                "Event", "ChildrensEvent", "TheaterEvent", "MusicEvent", "ExhibitionEvent",
                "Festival", "EducationEvent", "SportsEvent", "ScreeningEvent", "SocialEvent"
        ));

        private List<String> locationJsonLdTypes = new ArrayList<>(Arrays.asList(
                "Place", "LocalBusiness", "TouristAttraction", "Museum", "Park", "Playground",
                "Zoo", "Aquarium", "AmusementPark", "PublicSwimmingPool", "SportsActivityLocation"
        ));

        // Tried after the source's own item selector, in order
        private List<String> eventFallbackSelectors = new ArrayList<>(Arrays.asList(
                "div[class*='event']", "div[class*='veranstaltung']", "article[class*='event']",
                "article[class*='teaser']", "div[class*='teaser']", "div[class*='item']",
                "div[class*='card']", "li[class*='event']", ".m-teaser", ".event-card",
                ".list-item", "a[href*='/event']"
        ));

        private List<String> locationFallbackSelectors = new ArrayList<>(Arrays.asList(
                "div[class*='location']", "div[class*='place']", "article[class*='location']",
                "div[class*='item']", ".location-card", ".place-item"
        ));
    }
}
