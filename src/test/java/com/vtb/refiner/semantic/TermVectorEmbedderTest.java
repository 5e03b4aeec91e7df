package com.vtb.refiner.semantic;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TermVectorEmbedderTest {

    private final TermVectorEmbedder embedder = new TermVectorEmbedder();

    @Test
    void stopWordsAndInflectionDoNotChangeVector() {
        SparseVector first = embedder.embedText("An attacker can tamper with payment amounts");
        SparseVector second = embedder.embedText("the attacker may tamper with the payment amount");

        assertEquals(1.0, first.cosine(second), 1e-9);
    }

    @Test
    void vectorIsNormalized() {
        SparseVector vector = embedder.embedText("replay replay replay of refund requests");
        double norm = 0.0;
        for (double weight : vector.getWeights().values()) {
            norm += weight * weight;
        }
        assertEquals(1.0, norm, 1e-9);
    }

    @Test
    void emptyTextGivesZeroVector() {
        SparseVector empty = embedder.embedText("the of and");
        assertTrue(empty.isZero());
        assertEquals(0.0, empty.cosine(embedder.embedText("payment")));
    }

    @Test
    void stemming() {
        assertEquals("tamper", TermVectorEmbedder.stem("tampering"));
        assertEquals("request", TermVectorEmbedder.stem("requests"));
        assertEquals("access", TermVectorEmbedder.stem("access"));
        assertEquals("policy", TermVectorEmbedder.stem("policies"));
    }
}
