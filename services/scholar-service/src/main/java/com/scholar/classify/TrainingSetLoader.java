package com.scholar.classify;

import java.util.List;

public interface TrainingSetLoader {
    List<TrainingDocument> load();
}
