package com.imperium.lexi.util;

/**
 * 向量工具：余弦相似度与 L2 归一化，无 I/O。
 */
public final class VectorMath {

    private VectorMath() {
    }

    /**
     * 余弦相似度，取值 [-1, 1]。
     * 任一向量为 null、为空、长度不一致或模为 0 时返回 0，不抛异常。
     */
    public static double cosineSimilarity(float[] a, float[] b) {
        if (a == null || b == null || a.length == 0 || a.length != b.length) {
            return 0;
        }
        double dot = 0;
        double normA = 0;
        double normB = 0;
        for (int i = 0; i < a.length; i++) {
            dot += (double) a[i] * b[i];
            normA += (double) a[i] * a[i];
            normB += (double) b[i] * b[i];
        }
        double denominator = Math.sqrt(normA) * Math.sqrt(normB);
        if (denominator == 0) {
            return 0;
        }
        double cos = dot / denominator;
        // 浮点误差可能略超出 [-1, 1]
        return Math.max(-1.0, Math.min(1.0, cos));
    }

    /**
     * L2 归一化为单位向量；模为 0 时原样返回同一个数组。
     */
    public static float[] normalizeVector(float[] v) {
        if (v == null) {
            return null;
        }
        double sum = 0;
        for (float x : v) {
            sum += (double) x * x;
        }
        double magnitude = Math.sqrt(sum);
        if (magnitude == 0) {
            return v;
        }
        float[] out = new float[v.length];
        for (int i = 0; i < v.length; i++) {
            out[i] = (float) (v[i] / magnitude);
        }
        return out;
    }
}
