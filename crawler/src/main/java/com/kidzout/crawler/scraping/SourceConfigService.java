package com.kidzout.crawler.scraping;

import com.kidzout.crawler.config.CrawlerConfig;
import com.kidzout.crawler.exception.ConfigException;
import com.kidzout.crawler.model.Source;
import com.kidzout.crawler.model.SourceSelectors;
import com.kidzout.crawler.model.enums.SourceFormat;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Service;
import org.springframework.util.ResourceUtils;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Loads the ordered source list from sources.yml.
 * <p>
 * Every entry is validated before any is returned. All problems are collected into a single
 * {@link ConfigException} so a broken file can be fixed in one pass.
 */
@Service
@Slf4j
public class SourceConfigService {

    private static final Set<String> SELECTOR_KEYS = Set.of("item", "title", "date", "description", "name", "address");

    private final ResourceLoader resourceLoader;
    private final String sourcesFile;

    public SourceConfigService(ResourceLoader resourceLoader, CrawlerConfig crawlerConfig) {
        this.resourceLoader = resourceLoader;
        this.sourcesFile = crawlerConfig.getSourcesFile();
    }

    public List<Source> loadSources() {
        Resource resource = ResourceUtils.isUrl(sourcesFile)
                ? resourceLoader.getResource(sourcesFile)
                : new FileSystemResource(sourcesFile);
        if (!resource.exists()) {
            throw new ConfigException("Source configuration not found: " + sourcesFile, List.of());
        }

        try (InputStream inputStream = resource.getInputStream()) {
            List<Source> sources = parse(inputStream);
            log.info("Successfully loaded {} source configurations from {}", sources.size(), sourcesFile);
            return sources;
        } catch (IOException e) {
            throw new ConfigException("Failed to read source configuration " + sourcesFile, e);
        }
    }

    /**
     * Parse and validate a sources document
     */
    public List<Source> parse(InputStream inputStream) {
        Object document;
        try {
            Yaml yaml = new Yaml();
            document = yaml.load(inputStream);
        } catch (YAMLException e) {
            throw new ConfigException("Source configuration is not valid YAML: " + e.getMessage(), e);
        }

        if (!(document instanceof Map)) {
            throw new ConfigException("Source configuration must contain a 'sources' list", List.of());
        }
        Object entries = ((Map<?, ?>) document).get("sources");
        if (!(entries instanceof List) || ((List<?>) entries).isEmpty()) {
            throw new ConfigException("No sources configured", List.of("'sources' is missing or empty"));
        }

        List<Source> sources = new ArrayList<>();
        List<String> problems = new ArrayList<>();
        Set<String> names = new HashSet<>();

        List<?> entryList = (List<?>) entries;
        for (int i = 0; i < entryList.size(); i++) {
            Object entry = entryList.get(i);
            if (!(entry instanceof Map)) {
                problems.add("entry #" + (i + 1) + ": expected a mapping");
                continue;
            }
            Source source = createSourceFromMap((Map<?, ?>) entry, "entry #" + (i + 1), problems);
            if (source == null) continue;
            if (!names.add(source.getName())) {
                problems.add("entry #" + (i + 1) + " (" + source.getName() + "): duplicate source name");
                continue;
            }
            sources.add(source);
        }

        if (!problems.isEmpty()) {
            problems.forEach(problem -> log.error("Invalid source configuration: {}", problem));
            throw new ConfigException("Invalid source configuration", problems);
        }
        return sources;
    }

    /**
     * Create a Source from YAML map data, adding to problems instead of failing fast
     */
    private Source createSourceFromMap(Map<?, ?> data, String label, List<String> problems) {
        int before = problems.size();

        String name = string(data.get("name"));
        if (name == null) {
            problems.add(label + ": missing 'name'");
        } else {
            label = label + " (" + name + ")";
        }

        String url = string(data.get("url"));
        if (url == null) {
            problems.add(label + ": missing 'url'");
        } else if (!isHttpUrl(url)) {
            problems.add(label + ": 'url' is not an http(s) URL: " + url);
        }

        String formatKey = string(data.get("format"));
        SourceFormat format = SourceFormat.fromYamlKey(formatKey);
        if (formatKey == null) {
            problems.add(label + ": missing 'format'");
        } else if (format == null) {
            problems.add(label + ": unknown format '" + formatKey + "'");
        }

        List<String> categories = new ArrayList<>();
        Object rawCategories = data.get("categories");
        if (rawCategories instanceof List) {
            for (Object category : (List<?>) rawCategories) {
                String value = string(category);
                if (value != null) categories.add(value);
            }
        } else if (rawCategories instanceof String) {
            categories.add(((String) rawCategories).trim());
        } else if (rawCategories != null) {
            problems.add(label + ": 'categories' must be a list");
        }

        SourceSelectors selectors = null;
        Object rawSelectors = data.get("selectors");
        if (rawSelectors instanceof Map) {
            selectors = createSelectors((Map<?, ?>) rawSelectors, label);
        } else if (rawSelectors != null) {
            problems.add(label + ": 'selectors' must be a mapping");
        }

        if (problems.size() > before) {
            return null;
        }
        return Source.builder()
                .name(name)
                .url(url)
                .format(format)
                .categories(List.copyOf(categories))
                .selectors(selectors)
                .city(string(data.get("city")))
                .build();
    }

    private SourceSelectors createSelectors(Map<?, ?> data, String label) {
        for (Object key : data.keySet()) {
            if (!SELECTOR_KEYS.contains(String.valueOf(key))) {
                log.warn("{}: ignoring unknown selector '{}'", label, key);
            }
        }
        return SourceSelectors.builder()
                .item(string(data.get("item")))
                .title(string(data.get("title")))
                .date(string(data.get("date")))
                .description(string(data.get("description")))
                .name(string(data.get("name")))
                .address(string(data.get("address")))
                .build();
    }

    private static boolean isHttpUrl(String url) {
        try {
            URI uri = new URI(url);
            return uri.getScheme() != null
                    && (uri.getScheme().equalsIgnoreCase("http") || uri.getScheme().equalsIgnoreCase("https"))
                    && uri.getHost() != null;
        } catch (Exception e) {
            return false;
        }
    }

    private static String string(Object value) {
        if (value == null) return null;
        String text = String.valueOf(value).trim();
        return text.isEmpty() ? null : text;
    }
}
