package com.example.hybridrec.candidate;

import lombok.Builder;
import lombok.Data;

import java.util.List;
import java.util.Set;

/**
 * 召回结果
 */
@Data
@Builder
public class CandidatePool {

    private List<Candidate> candidates;

    /**
     * 实际生效的策略（不满足协同条件时 collaborative 回退为 hybrid）
     */
    private RecommendationStrategy effectiveStrategy;

    private boolean collaborativeEligible;

    /**
     * 超时或失败、按零候选处理的来源
     */
    private Set<CandidateSource> degradedSources;
}
