package com.kingpin.pins;

import org.junit.jupiter.api.*;

import static org.junit.jupiter.api.Assertions.*;

public class SimilarityTest {
    private final StringSimilarity gestalt = new GestaltSimilarity();
    private final StringSimilarity levenshtein = new LevenshteinSimilarity();

    @Test
    void testGestaltRatio() {
        assertEquals(1.0, gestalt.similarity("cafe", "cafe"));
        assertEquals(0.75, gestalt.similarity("abcd", "bcde"));
        assertEquals(0.8, gestalt.similarity("apple", "appel"), 1e-12);
        assertEquals(0.0, gestalt.similarity("abc", "xyz"));
        assertEquals(0.0, gestalt.similarity("abc", ""));
        assertEquals(1.0, gestalt.similarity("", ""));
    }

    @Test
    void testGestaltMatchesBothSidesOfLongestBlock() {
        assertEquals(4, GestaltSimilarity.matchingCharacters("abxcd", "abcd"));
        assertEquals(4, GestaltSimilarity.matchingCharacters("cafe", "caffe nero"));
    }

    @Test
    void testGestaltIsSymmetricForTheseInputs() {
        assertEquals(gestalt.similarity("kafe", "cafe"), gestalt.similarity("cafe", "kafe"));
    }

    @Test
    void testLevenshtein() {
        assertEquals(3, LevenshteinSimilarity.distance("kitten", "sitting"));
        assertEquals(0, LevenshteinSimilarity.distance("", ""));
        assertEquals(4, LevenshteinSimilarity.distance("", "abcd"));
        assertEquals(1.0 - 3.0 / 7, levenshtein.similarity("kitten", "sitting"), 1e-12);
        assertEquals(1.0, levenshtein.similarity("", ""));
    }
}
