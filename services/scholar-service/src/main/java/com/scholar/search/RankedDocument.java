package com.scholar.search;

import com.scholar.corpus.PublicationRecord;

public record RankedDocument(PublicationRecord record, double score) {
    public String recordId() {
        return record.link();
    }
}
