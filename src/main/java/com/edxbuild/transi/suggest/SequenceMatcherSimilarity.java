package com.edxbuild.transi.suggest;

/**
 * Ratcliff/Obershelp "gestalt" ratio: {@code 2 * M / (|a| + |b|)}, where M counts the characters
 * of the longest common block plus, recursively, the blocks matched to its left and right.
 */
public class SequenceMatcherSimilarity implements SimilarityStrategy {

    @Override
    public double score(String a, String b) {
        int total = a.length() + b.length();
        if (total == 0) {
            return 1.0;
        }
        return 2.0 * matchingCharacters(a, 0, a.length(), b, 0, b.length()) / total;
    }

    private int matchingCharacters(String a, int aLo, int aHi, String b, int bLo, int bHi) {
        if (aLo >= aHi || bLo >= bHi) {
            return 0;
        }
        // longest common block; earliest in a, then in b, on ties
        int bestA = aLo;
        int bestB = bLo;
        int bestSize = 0;
        int[] previous = new int[bHi - bLo + 1];
        for (int i = aLo; i < aHi; i++) {
            int[] current = new int[bHi - bLo + 1];
            for (int j = bLo; j < bHi; j++) {
                if (a.charAt(i) == b.charAt(j)) {
                    int size = previous[j - bLo] + 1;
                    current[j - bLo + 1] = size;
                    if (size > bestSize) {
                        bestSize = size;
                        bestA = i - size + 1;
                        bestB = j - size + 1;
                    }
                }
            }
            previous = current;
        }
        if (bestSize == 0) {
            return 0;
        }
        return bestSize
                + matchingCharacters(a, aLo, bestA, b, bLo, bestB)
                + matchingCharacters(a, bestA + bestSize, aHi, b, bestB + bestSize, bHi);
    }
}
