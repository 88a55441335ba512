package com.example.hybridrec.dto;

import lombok.Builder;
import lombok.Data;

import java.util.Map;
import java.util.Set;

@Data
@Builder
public class RecommendationItem {
    private String resourceId;
    private String title;
    private double hybridScore;
    /**
     * collaborative / content / graph / quality / recency
     */
    private Map<String, Double> componentScores;
    private Set<String> contributingStrategies;
    private int rank;
    private double noveltyScore;
    private long viewCount;
}
