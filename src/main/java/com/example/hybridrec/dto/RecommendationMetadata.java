package com.example.hybridrec.dto;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class RecommendationMetadata {
    private int count;
    /**
     * 实际使用的策略（冷启动时 collaborative 会回退为 hybrid）
     */
    private String strategy;
    private double giniCoefficient;
    private boolean coldStart;
    private int interactionCount;
    private boolean collaborativeEligible;
    private boolean diversityApplied;
    private boolean noveltyApplied;
    private double diversityPreference;
    private double noveltyPreference;
    private double noveltyRatio;
}
