package com.example.hybridrec.vector;

/**
 * 向量运算工具
 */
public final class VectorMath {

    private VectorMath() {
    }

    /**
     * 余弦相似度；任一向量为空、维度不同或结果非有限时返回 0
     */
    public static double cosine(double[] a, double[] b) {
        if (a == null || b == null || a.length == 0 || a.length != b.length) {
            return 0.0;
        }
        double dot = 0.0;
        double na = 0.0;
        double nb = 0.0;
        for (int i = 0; i < a.length; i++) {
            dot += a[i] * b[i];
            na += a[i] * a[i];
            nb += b[i] * b[i];
        }
        if (na == 0 || nb == 0) {
            return 0.0;
        }
        double sim = dot / (Math.sqrt(na) * Math.sqrt(nb));
        return Double.isFinite(sim) ? sim : 0.0;
    }

    public static double clamp(double value, double min, double max) {
        if (Double.isNaN(value)) {
            return min;
        }
        return Math.max(min, Math.min(max, value));
    }
}
