package com.scholar.classify;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;
import org.springframework.stereotype.Component;

/**
 * Current model per algorithm. Readers take a snapshot reference without locking; publication of a training
 * run happens under one lock so two runs never interleave their swaps.
 */
@Component
public class ModelRegistry {
    private final Map<AlgorithmKind, AtomicReference<ClassifierModel>> models;
    private final Object publishLock = new Object();

    public ModelRegistry() {
        Map<AlgorithmKind, AtomicReference<ClassifierModel>> refs = new EnumMap<>(AlgorithmKind.class);
        for (AlgorithmKind kind : AlgorithmKind.values()) {
            refs.put(kind, new AtomicReference<>());
        }
        this.models = Collections.unmodifiableMap(refs);
    }

    /** Returns the published model, or {@code null} when none has been trained yet. */
    public ClassifierModel current(AlgorithmKind kind) {
        return models.get(kind).get();
    }

    public boolean isTrained(AlgorithmKind kind) {
        return current(kind) != null;
    }

    public void publish(Map<AlgorithmKind, ClassifierModel> trained) {
        synchronized (publishLock) {
            for (Map.Entry<AlgorithmKind, ClassifierModel> entry : trained.entrySet()) {
                models.get(entry.getKey()).set(entry.getValue());
            }
        }
    }
}
