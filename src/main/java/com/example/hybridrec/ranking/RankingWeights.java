package com.example.hybridrec.ranking;

import com.example.hybridrec.config.RecommendationProperties;
import com.example.hybridrec.exception.InvalidRankingWeightsException;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 混合排序的五个分量权重
 */
public final class RankingWeights {

    public static final String COLLABORATIVE = "collaborative";
    public static final String CONTENT = "content";
    public static final String GRAPH = "graph";
    public static final String QUALITY = "quality";
    public static final String RECENCY = "recency";

    public static final List<String> COMPONENTS = List.of(COLLABORATIVE, CONTENT, GRAPH, QUALITY, RECENCY);

    private static final double SUM_TOLERANCE = 1e-6;

    private final Map<String, Double> weights;

    private RankingWeights(Map<String, Double> weights) {
        this.weights = weights;
    }

    public static RankingWeights defaults(RecommendationProperties.Ranking ranking) {
        Map<String, Double> weights = new LinkedHashMap<>();
        weights.put(COLLABORATIVE, ranking.getCollaborativeWeight());
        weights.put(CONTENT, ranking.getContentWeight());
        weights.put(GRAPH, ranking.getGraphWeight());
        weights.put(QUALITY, ranking.getQualityWeight());
        weights.put(RECENCY, ranking.getRecencyWeight());
        return new RankingWeights(weights);
    }

    /**
     * 校验并构建覆盖权重：五个分量齐全，各自在 [0,1]，总和为 1
     *
     * @throws InvalidRankingWeightsException 不满足上述任一条件
     */
    public static RankingWeights of(Map<String, Double> raw) {
        if (raw == null) {
            throw new InvalidRankingWeightsException("rankingWeights", "rankingWeights 不能为空");
        }
        for (String key : raw.keySet()) {
            if (!COMPONENTS.contains(key)) {
                throw new InvalidRankingWeightsException("rankingWeights", "未知的权重分量: " + key);
            }
        }

        Map<String, Double> weights = new LinkedHashMap<>();
        double sum = 0.0;
        for (String component : COMPONENTS) {
            Double w = raw.get(component);
            if (w == null) {
                throw new InvalidRankingWeightsException("rankingWeights", "缺少权重分量: " + component);
            }
            if (!Double.isFinite(w) || w < 0.0 || w > 1.0) {
                throw new InvalidRankingWeightsException("rankingWeights",
                    "权重分量 " + component + " 必须在 [0, 1] 之间，实际为: " + w);
            }
            weights.put(component, w);
            sum += w;
        }
        if (Math.abs(sum - 1.0) > SUM_TOLERANCE) {
            throw new InvalidRankingWeightsException("rankingWeights", "权重之和必须为 1，实际为: " + sum);
        }
        return new RankingWeights(weights);
    }

    public double weightOf(String component) {
        return weights.getOrDefault(component, 0.0);
    }

    public Map<String, Double> toMap() {
        return new LinkedHashMap<>(weights);
    }

    @Override
    public String toString() {
        return "RankingWeights" + weights;
    }
}
