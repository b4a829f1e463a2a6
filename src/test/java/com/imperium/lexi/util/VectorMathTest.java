package com.imperium.lexi.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class VectorMathTest {

    @Test
    void identicalVectorsHaveSimilarityOne() {
        float[] v = {0.3f, -1.2f, 4f};
        assertEquals(1.0, VectorMath.cosineSimilarity(v, v), 1e-9);
    }

    @Test
    void orthogonalVectorsHaveSimilarityZero() {
        assertEquals(0.0, VectorMath.cosineSimilarity(new float[]{1, 0}, new float[]{0, 1}), 1e-9);
    }

    @Test
    void oppositeVectorsHaveSimilarityMinusOne() {
        assertEquals(-1.0, VectorMath.cosineSimilarity(new float[]{1, 2, 3}, new float[]{-1, -2, -3}), 1e-9);
    }

    @Test
    void degenerateInputsReturnZero() {
        assertEquals(0.0, VectorMath.cosineSimilarity(null, new float[]{1}));
        assertEquals(0.0, VectorMath.cosineSimilarity(new float[0], new float[0]));
        assertEquals(0.0, VectorMath.cosineSimilarity(new float[]{1, 2}, new float[]{1, 2, 3}));
        assertEquals(0.0, VectorMath.cosineSimilarity(new float[]{0, 0}, new float[]{1, 1}));
    }

    @Test
    void normalizeProducesUnitLength() {
        float[] n = VectorMath.normalizeVector(new float[]{3, 4});
        assertArrayEquals(new float[]{0.6f, 0.8f}, n, 1e-6f);
    }

    @Test
    void normalizeZeroVectorReturnsInput() {
        float[] zero = {0, 0, 0};
        assertSame(zero, VectorMath.normalizeVector(zero));
    }
}
