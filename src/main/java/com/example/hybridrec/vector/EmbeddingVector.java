package com.example.hybridrec.vector;

import com.example.hybridrec.exception.MalformedEmbeddingException;

import java.util.Arrays;
import java.util.List;

/**
 * 定长、已校验的 embedding 向量
 *
 * 所有外部 embedding 在边界处转换为该类型，非法输入在进入加权平均之前被拒绝
 */
public final class EmbeddingVector {

    private final double[] values;

    private EmbeddingVector(double[] values) {
        this.values = values;
    }

    /**
     * 从外部数值列表构建，校验维度与有限性
     *
     * @throws MalformedEmbeddingException 缺失、维度不符或包含 NaN/Infinity
     */
    public static EmbeddingVector of(List<? extends Number> raw, int dimension) {
        if (raw == null || raw.isEmpty()) {
            throw new MalformedEmbeddingException("embedding 缺失");
        }
        if (raw.size() != dimension) {
            throw new MalformedEmbeddingException(
                "embedding 维度不符: expected=" + dimension + ", actual=" + raw.size());
        }
        double[] values = new double[dimension];
        for (int i = 0; i < dimension; i++) {
            Number n = raw.get(i);
            if (n == null || !Double.isFinite(n.doubleValue())) {
                throw new MalformedEmbeddingException("embedding 第 " + i + " 维非法: " + n);
            }
            values[i] = n.doubleValue();
        }
        return new EmbeddingVector(values);
    }

    public static EmbeddingVector of(double[] raw, int dimension) {
        if (raw == null) {
            throw new MalformedEmbeddingException("embedding 缺失");
        }
        if (raw.length != dimension) {
            throw new MalformedEmbeddingException(
                "embedding 维度不符: expected=" + dimension + ", actual=" + raw.length);
        }
        for (int i = 0; i < raw.length; i++) {
            if (!Double.isFinite(raw[i])) {
                throw new MalformedEmbeddingException("embedding 第 " + i + " 维非法: " + raw[i]);
            }
        }
        return new EmbeddingVector(raw.clone());
    }

    /**
     * 冷启动哨兵：D 维全零向量
     */
    public static EmbeddingVector zero(int dimension) {
        return new EmbeddingVector(new double[dimension]);
    }

    public int dimension() {
        return values.length;
    }

    public double get(int index) {
        return values[index];
    }

    public double[] toArray() {
        return values.clone();
    }

    public boolean isZero() {
        for (double v : values) {
            if (v != 0.0) {
                return false;
            }
        }
        return true;
    }

    public double cosine(EmbeddingVector other) {
        return VectorMath.cosine(values, other.values);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EmbeddingVector)) return false;
        return Arrays.equals(values, ((EmbeddingVector) o).values);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return "EmbeddingVector{dimension=" + values.length + ", zero=" + isZero() + "}";
    }
}
