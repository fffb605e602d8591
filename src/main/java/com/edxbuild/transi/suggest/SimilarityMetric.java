package com.edxbuild.transi.suggest;

import java.util.function.Supplier;

/**
 * Selectable similarity measures for manual-match suggestions.
 */
public enum SimilarityMetric {

    SEQUENCE(SequenceMatcherSimilarity::new),
    LEVENSHTEIN(LevenshteinSimilarity::new);

    private final Supplier<SimilarityStrategy> factory;

    SimilarityMetric(Supplier<SimilarityStrategy> factory) {
        this.factory = factory;
    }

    public SimilarityStrategy create() {
        return factory.get();
    }
}
