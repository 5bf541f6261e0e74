package com.dcruver.coursepipeline.domain;

import lombok.Value;

import java.util.List;

/**
 * The normalized set of research documents for one generation request,
 * plus the warnings recorded for records that had to be skipped.
 */
@Value
public class Corpus {
    List<Document> documents;
    List<String> warnings;

    public Corpus(List<Document> documents, List<String> warnings) {
        this.documents = documents != null ? List.copyOf(documents) : List.of();
        this.warnings = warnings != null ? List.copyOf(warnings) : List.of();
    }

    public static Corpus empty() {
        return new Corpus(List.of(), List.of());
    }

    public boolean isEmpty() {
        return documents.isEmpty();
    }

    public int size() {
        return documents.size();
    }

    public List<Document> getDocuments(Origin origin) {
        return documents.stream()
            .filter(doc -> doc.getOrigin() == origin)
            .toList();
    }

    public List<Document> getWebDocuments() {
        return getDocuments(Origin.WEB);
    }

    public List<Document> getVideoDocuments() {
        return getDocuments(Origin.VIDEO);
    }
}
