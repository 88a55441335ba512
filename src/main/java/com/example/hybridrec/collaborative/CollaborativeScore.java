package com.example.hybridrec.collaborative;

/**
 * 协同过滤打分结果
 *
 * 模型未训练、加载失败、用户或资源不在词表中时为 unavailable，
 * 调用方必须显式处理，不能当作 0 分参与排序
 */
public final class CollaborativeScore {

    private static final CollaborativeScore UNAVAILABLE = new CollaborativeScore(false, 0.0);

    private final boolean available;
    private final double value;

    private CollaborativeScore(boolean available, double value) {
        this.available = available;
        this.value = value;
    }

    public static CollaborativeScore scored(double value) {
        return new CollaborativeScore(true, value);
    }

    public static CollaborativeScore unavailable() {
        return UNAVAILABLE;
    }

    public boolean isAvailable() {
        return available;
    }

    /**
     * @throws IllegalStateException 打分不可用时
     */
    public double getValue() {
        if (!available) {
            throw new IllegalStateException("collaborative score unavailable");
        }
        return value;
    }

    public double orElse(double fallback) {
        return available ? value : fallback;
    }

    @Override
    public String toString() {
        return available ? "CollaborativeScore{" + value + "}" : "CollaborativeScore{unavailable}";
    }
}
