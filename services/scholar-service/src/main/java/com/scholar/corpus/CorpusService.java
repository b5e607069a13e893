package com.scholar.corpus;

import com.scholar.text.FeatureExtractor;
import jakarta.annotation.PostConstruct;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Owns the current {@link CorpusIndex}. Readers take the reference without locking; rebuilds are serialized
 * and publish a complete index in one swap.
 */
@Service
public class CorpusService {
    private static final Logger log = LoggerFactory.getLogger(CorpusService.class);

    private final CorpusLoader loader;
    private final CorpusProperties properties;
    private final FeatureExtractor extractor;
    private final AtomicReference<CorpusIndex> current = new AtomicReference<>(CorpusIndex.empty());
    private final Object rebuildLock = new Object();

    public CorpusService(CorpusLoader loader, CorpusProperties properties) {
        this.loader = loader;
        this.properties = properties;
        this.extractor = new FeatureExtractor(properties.getMinTokenLength(), properties.isStemming());
    }

    @PostConstruct
    public void init() {
        try {
            reload();
        } catch (CorpusLoadException ex) {
            if (properties.isStrict()) {
                throw ex;
            }
            log.warn("corpus load failed, serving empty index: {}", ex.getMessage());
        }
    }

    public CorpusIndex current() {
        return current.get();
    }

    public FeatureExtractor getExtractor() {
        return extractor;
    }

    /**
     * Loads the corpus and replaces the index. On failure the previous index stays published.
     */
    public CorpusIndex reload() {
        synchronized (rebuildLock) {
            List<PublicationRecord> records = loader.load();
            long generation = current.get().getGeneration() + 1;
            CorpusIndex rebuilt = CorpusIndex.build(records, extractor, generation);
            current.set(rebuilt);
            log.info(
                "corpus index rebuilt generation={} records={} terms={}",
                generation,
                rebuilt.size(),
                rebuilt.getVocabulary().size()
            );
            return rebuilt;
        }
    }
}
