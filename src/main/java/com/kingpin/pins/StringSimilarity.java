package com.kingpin.pins;

/**
 * Normalized similarity between two strings, used for fuzzy name matching.
 */
@FunctionalInterface
public interface StringSimilarity {
    /**
     * @param a first string, not null
     * @param b second string, not null
     * @return similarity in [0, 1]; 1 means equal
     */
    double similarity(String a, String b);
}
