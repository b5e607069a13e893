package com.scholar.classify;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

/**
 * Reads {@code [{"text": ..., "category": ...}]}. A missing file falls back to a small built-in set so the
 * service can still train.
 */
@Component
public class JsonTrainingSetLoader implements TrainingSetLoader {
    private static final Logger log = LoggerFactory.getLogger(JsonTrainingSetLoader.class);
    private static final TypeReference<List<TrainingDocument>> LIST_TYPE = new TypeReference<>() {};

    static final List<TrainingDocument> FALLBACK_DOCUMENTS = List.of(
        new TrainingDocument(
            "The government announced new policies to tackle climate change and economic issues",
            "politics"
        ),
        new TrainingDocument(
            "Parliament voted on controversial legislation affecting immigration and social services",
            "politics"
        ),
        new TrainingDocument(
            "The company reported strong quarterly earnings with increased revenue and market expansion",
            "business"
        ),
        new TrainingDocument(
            "Tech startup secured funding for innovative product development and market growth",
            "business"
        ),
        new TrainingDocument(
            "Medical researchers discovered breakthrough treatment for chronic disease management",
            "health"
        ),
        new TrainingDocument(
            "Healthcare system implemented new patient safety protocols and quality improvements",
            "health"
        )
    );

    private final ClassifierProperties properties;
    private final ResourceLoader resourceLoader;
    private final ObjectMapper objectMapper;

    public JsonTrainingSetLoader(
        ClassifierProperties properties,
        ResourceLoader resourceLoader,
        ObjectMapper objectMapper
    ) {
        this.properties = properties;
        this.resourceLoader = resourceLoader;
        this.objectMapper = objectMapper;
    }

    @Override
    public List<TrainingDocument> load() {
        Resource resource = resourceLoader.getResource(properties.getTrainingLocation());
        if (!resource.exists()) {
            log.warn("training set not found at {}, using {} fallback documents",
                properties.getTrainingLocation(), FALLBACK_DOCUMENTS.size());
            return FALLBACK_DOCUMENTS;
        }
        try (InputStream input = resource.getInputStream()) {
            List<TrainingDocument> parsed = objectMapper.readValue(input, LIST_TYPE);
            if (parsed == null) {
                parsed = List.of();
            }
            List<TrainingDocument> documents = parsed.stream().filter(Objects::nonNull).toList();
            if (documents.size() < parsed.size()) {
                log.warn("training set skipped null entries source={} skipped={}",
                    resource.getDescription(), parsed.size() - documents.size());
            }
            log.info("training set loaded source={} documents={}", resource.getDescription(), documents.size());
            return documents;
        } catch (IOException e) {
            throw new UncheckedIOException("failed to read training set from " + resource.getDescription(), e);
        }
    }
}
