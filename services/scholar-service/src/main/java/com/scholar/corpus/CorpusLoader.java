package com.scholar.corpus;

import java.util.List;

/**
 * Supplies the current publication snapshot. Implementations must return a complete list or throw.
 */
public interface CorpusLoader {
    List<PublicationRecord> load();
}
