package com.example.hybridrec.candidate;

import com.example.hybridrec.exception.InvalidStrategyException;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 推荐策略：决定启用哪些召回来源
 */
public enum RecommendationStrategy {
    COLLABORATIVE("collaborative", EnumSet.of(CandidateSource.COLLABORATIVE)),
    CONTENT("content", EnumSet.of(CandidateSource.CONTENT)),
    GRAPH("graph", EnumSet.of(CandidateSource.GRAPH)),
    HYBRID("hybrid", EnumSet.allOf(CandidateSource.class));

    private final String value;
    private final Set<CandidateSource> sources;

    RecommendationStrategy(String value, Set<CandidateSource> sources) {
        this.value = value;
        this.sources = Collections.unmodifiableSet(sources);
    }

    public String getValue() {
        return value;
    }

    public Set<CandidateSource> getSources() {
        return sources;
    }

    /**
     * @throws InvalidStrategyException 未知策略
     */
    public static RecommendationStrategy fromValue(String value) {
        if (value == null || value.isBlank()) {
            return HYBRID;
        }
        for (RecommendationStrategy strategy : values()) {
            if (strategy.value.equals(value.trim().toLowerCase())) {
                return strategy;
            }
        }
        String allowed = Arrays.stream(values()).map(RecommendationStrategy::getValue).collect(Collectors.joining(", "));
        throw new InvalidStrategyException("strategy", "strategy 必须是 [" + allowed + "] 之一，实际为: " + value);
    }
}
