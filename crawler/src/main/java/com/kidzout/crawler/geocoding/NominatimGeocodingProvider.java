package com.kidzout.crawler.geocoding;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.kidzout.crawler.config.CrawlerConfig;
import com.kidzout.crawler.exception.GeocodeException;
import com.kidzout.crawler.model.Coordinates;
import com.kidzout.crawler.scraping.RateLimiter;
import java.io.IOException;
import java.util.Locale;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Connection;
import org.jsoup.Jsoup;
import org.springframework.stereotype.Component;

/**
 * OpenStreetMap Nominatim search API. The public instance allows one request per second and
 * requires an identifying User-Agent.
 */
@Component
@Slf4j
public class NominatimGeocodingProvider implements GeocodingProvider {

    private static final String PROVIDER_DOMAIN = "nominatim";

    private final CrawlerConfig.Geocoder settings;
    private final RateLimiter rateLimiter;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public NominatimGeocodingProvider(CrawlerConfig crawlerConfig) {
        this.settings = crawlerConfig.getGeocoder();
        this.rateLimiter = RateLimiter.fixedInterval(settings.getMinInterval());
    }

    @Override
    public Optional<Coordinates> lookup(String address) throws GeocodeException {
        String query = withCountry(address);
        try {
            rateLimiter.acquire(PROVIDER_DOMAIN);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new GeocodeException("Interrupted while waiting for geocoding slot", e);
        }

        Connection.Response response;
        try {
            response = Jsoup.connect(settings.getBaseUrl())
                    .userAgent(settings.getUserAgent())
                    .timeout((int) settings.getTimeout().toMillis())
                    .ignoreContentType(true)
                    .ignoreHttpErrors(true)
                    .data("q", query)
                    .data("format", "json")
                    .data("limit", "1")
                    .method(Connection.Method.GET)
                    .execute();
        } catch (IOException e) {
            throw new GeocodeException("Geocoding request failed for '" + query + "': " + e.getMessage(), e);
        }

        if (response.statusCode() != 200) {
            throw new GeocodeException("Geocoding provider returned HTTP " + response.statusCode() + " for '" + query + "'");
        }

        try {
            JsonNode results = objectMapper.readTree(response.body());
            if (!results.isArray() || results.isEmpty()) {
                log.debug("No geocoding result for '{}'", query);
                return Optional.empty();
            }
            JsonNode first = results.get(0);
            return Optional.ofNullable(Coordinates.parse(first.path("lat").asText(null), first.path("lon").asText(null)));
        } catch (IOException e) {
            throw new GeocodeException("Unreadable geocoding response for '" + query + "'", e);
        }
    }

    private String withCountry(String address) {
        String suffix = settings.getCountrySuffix();
        if (suffix == null || suffix.isBlank()
                || address.toLowerCase(Locale.ROOT).contains(suffix.toLowerCase(Locale.ROOT))) {
            return address;
        }
        return address + ", " + suffix;
    }
}
