package com.vtb.refiner.semantic;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TextSimilarityTest {

    @Test
    void exactMatchAfterNormalizationIsOne() {
        assertEquals(1.0, TextSimilarity.componentSimilarity("  payment   API ", "Payment API"));
    }

    @Test
    void tokenDiceCountsSharedWords() {
        assertEquals(0.8, TextSimilarity.tokenDice("Payment API", "Payment Gateway API"), 1e-9);
        assertEquals(0.0, TextSimilarity.tokenDice("", ""));
    }

    @Test
    void levenshteinDistance() {
        assertEquals(3, TextSimilarity.levenshtein("kitten", "sitting"));
        assertEquals(0, TextSimilarity.levenshtein("api", "api"));
        assertEquals(0.9, TextSimilarity.levenshteinSimilarity("orders api", "orders apx"), 1e-9);
    }

    @Test
    void metricsAreSymmetricAndBounded() {
        String[][] pairs = {
            {"Customer DB", "Customer Database"},
            {"Web Client", "Payment API"},
            {"auth service", "Authentication Service"}
        };
        for (String[] pair : pairs) {
            double forward = TextSimilarity.componentSimilarity(pair[0], pair[1]);
            double backward = TextSimilarity.componentSimilarity(pair[1], pair[0]);
            assertEquals(forward, backward, 1e-12, "Метрика должна быть симметричной для " + pair[0]);
            assertTrue(forward >= 0.0 && forward <= 1.0);
        }
    }

    @Test
    void emptyInputGivesZero() {
        assertEquals(0.0, TextSimilarity.componentSimilarity(null, "Payment API"));
        assertEquals(0.0, TextSimilarity.componentSimilarity("   ", "Payment API"));
    }
}
