package com.example.hybridrec.candidate;

import com.example.hybridrec.dto.ResourceMetadata;
import lombok.Data;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * 单次请求内的候选资源
 */
@Data
public class Candidate {

    private final String resourceId;

    /**
     * collaborative / content / graph / quality / recency -> 分量分数
     */
    private final Map<String, Double> componentScores = new LinkedHashMap<>();

    /**
     * 召回来源
     */
    private final Set<String> provenance = new LinkedHashSet<>();

    private double hybridScore;

    private double noveltyScore;

    private long viewCount;

    private ResourceMetadata metadata;

    public Candidate(String resourceId) {
        this.resourceId = resourceId;
    }

    public double componentScore(String component) {
        return componentScores.getOrDefault(component, 0.0);
    }

    /**
     * 召回阶段各来源分数的最大值（用于截断合并池）
     */
    public double maxComponentScore() {
        double max = 0.0;
        for (Double score : componentScores.values()) {
            if (score != null && score > max) {
                max = score;
            }
        }
        return max;
    }
}
