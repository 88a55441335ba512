package com.example.hybridrec.context;

import com.example.hybridrec.candidate.Candidate;
import com.example.hybridrec.candidate.CandidateSource;
import com.example.hybridrec.candidate.RecommendationStrategy;
import com.example.hybridrec.ranking.RankingWeights;
import com.example.hybridrec.vector.EmbeddingVector;
import lombok.Data;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * 推荐流水线上下文 - 单次请求内在各节点间传递的状态
 */
@Data
public class RecommendationContext {

    // ==================== 请求 ====================

    private String userId;

    private int limit;

    private RecommendationStrategy requestedStrategy;

    private Double minQuality;

    // ==================== 画像 ====================

    private int interactionCount;

    private boolean coldStart;

    /**
     * 生效的多样性偏好（请求覆盖优先于画像）
     */
    private double diversityPreference;

    private double noveltyPreference;

    private RankingWeights rankingWeights;

    private Set<String> excludedSources = new HashSet<>();

    // ==================== 召回 ====================

    private EmbeddingVector userEmbedding;

    private RecommendationStrategy effectiveStrategy;

    private boolean collaborativeEligible;

    private Set<CandidateSource> degradedSources = EnumSet.noneOf(CandidateSource.class);

    /**
     * 当前候选集合，各节点依次替换
     */
    private List<Candidate> candidates = new ArrayList<>();

    // ==================== 重排 ====================

    private boolean diversityApplied;

    private boolean noveltyApplied;

    private Set<String> topViewedIds = new HashSet<>();

    /**
     * 最终结果（按分数降序）
     */
    private List<Candidate> results = new ArrayList<>();
}
