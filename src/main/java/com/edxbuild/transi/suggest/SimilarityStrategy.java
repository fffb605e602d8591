package com.edxbuild.transi.suggest;

/**
 * Scores how alike two already-normalized strings are.
 */
@FunctionalInterface
public interface SimilarityStrategy {

    /**
     * @return a score in {@code [0, 1]}, 1 meaning identical
     */
    double score(String a, String b);
}
