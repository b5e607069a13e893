package com.scholar.corpus;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

/**
 * Reads crawler output: a JSON array of publication objects. The primary location wins; the fallback is read
 * only when the primary does not exist.
 */
@Component
public class JsonCorpusLoader implements CorpusLoader {
    private static final Logger log = LoggerFactory.getLogger(JsonCorpusLoader.class);

    private final CorpusProperties properties;
    private final ResourceLoader resourceLoader;
    private final ObjectMapper objectMapper;

    public JsonCorpusLoader(CorpusProperties properties, ResourceLoader resourceLoader, ObjectMapper objectMapper) {
        this.properties = properties;
        this.resourceLoader = resourceLoader;
        this.objectMapper = objectMapper;
    }

    @Override
    public List<PublicationRecord> load() {
        Resource resource = resolve();
        JsonNode root;
        try (InputStream input = resource.getInputStream()) {
            root = objectMapper.readTree(input);
        } catch (IOException e) {
            throw new CorpusLoadException("failed to read corpus from " + resource.getDescription(), e);
        }
        if (root == null || !root.isArray()) {
            throw new CorpusLoadException("corpus root is not an array: " + resource.getDescription());
        }
        List<PublicationRecord> records = parse(root);
        log.info("corpus loaded source={} records={}", resource.getDescription(), records.size());
        return records;
    }

    List<PublicationRecord> parse(JsonNode root) {
        List<PublicationRecord> records = new ArrayList<>();
        Set<String> seenLinks = new LinkedHashSet<>();
        int skipped = 0;
        for (JsonNode node : root) {
            PublicationRecord record = toRecord(node);
            if (record == null || !seenLinks.add(record.link())) {
                skipped++;
                continue;
            }
            records.add(record);
        }
        if (skipped > 0) {
            log.warn("corpus records skipped count={} (missing title or duplicate link)", skipped);
        }
        return records;
    }

    private Resource resolve() {
        Resource primary = resourceLoader.getResource(properties.getLocation());
        if (primary.exists()) {
            return primary;
        }
        String fallbackLocation = properties.getFallbackLocation();
        if (fallbackLocation != null && !fallbackLocation.isBlank()) {
            Resource fallback = resourceLoader.getResource(fallbackLocation);
            if (fallback.exists()) {
                log.warn("corpus not found at {}, using fallback {}", properties.getLocation(), fallbackLocation);
                return fallback;
            }
        }
        throw new CorpusLoadException("corpus not found at " + properties.getLocation());
    }

    private PublicationRecord toRecord(JsonNode node) {
        if (node == null || !node.isObject()) {
            return null;
        }
        String title = text(node, "title");
        if (title == null) {
            return null;
        }
        String link = text(node, "link");
        if (link == null) {
            link = "urn:title:" + title.trim().toLowerCase(Locale.ROOT).replaceAll("\\s+", "-");
        }
        String date = text(node, "published_date");
        if (date == null) {
            date = text(node, "date");
        }
        String abstractText = text(node, "abstract");
        return new PublicationRecord(
            title.trim(),
            link.trim(),
            authors(node.get("authors")),
            date,
            PublicationDates.parse(date),
            abstractText
        );
    }

    private List<Author> authors(JsonNode node) {
        List<Author> authors = new ArrayList<>();
        if (node == null || node.isNull()) {
            return authors;
        }
        if (node.isTextual()) {
            for (String part : node.asText().split(",")) {
                String name = part.trim();
                if (!name.isEmpty()) {
                    authors.add(new Author(name, null));
                }
            }
            return authors;
        }
        if (!node.isArray()) {
            return authors;
        }
        for (JsonNode item : node) {
            if (item.isObject()) {
                String name = text(item, "name");
                if (name != null) {
                    authors.add(new Author(name.trim(), text(item, "profile")));
                }
            } else if (item.isValueNode()) {
                String name = item.asText().trim();
                if (!name.isEmpty()) {
                    authors.add(new Author(name, null));
                }
            }
        }
        return authors;
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        String text = value.asText();
        return text == null || text.isBlank() ? null : text;
    }
}
