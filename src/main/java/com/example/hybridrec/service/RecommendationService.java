package com.example.hybridrec.service;

import com.example.hybridrec.candidate.Candidate;
import com.example.hybridrec.candidate.RecommendationStrategy;
import com.example.hybridrec.context.RecommendationContext;
import com.example.hybridrec.dto.RecommendationItem;
import com.example.hybridrec.dto.RecommendationMetadata;
import com.example.hybridrec.dto.RecommendationQuery;
import com.example.hybridrec.dto.RecommendationResponse;
import com.example.hybridrec.entity.UserProfile;
import com.example.hybridrec.exception.InvalidPreferenceRangeException;
import com.example.hybridrec.pipeline.RecommendationPipelineBuilder;
import com.example.hybridrec.ranking.RankingWeights;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 推荐服务 - 对外入口
 *
 * 1. 加载画像并组装上下文
 * 2. 执行推荐流水线
 * 3. 组装响应、计算指标、记录曝光
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RecommendationService {

    private final UserProfileService profileService;
    private final RecommendationPipelineBuilder pipelineBuilder;
    private final FeedbackService feedbackService;
    private final RecommendationMetricsService metricsService;

    /**
     * @throws com.example.hybridrec.exception.InvalidStrategyException 未知策略
     * @throws InvalidPreferenceRangeException diversity / minQuality 不在 [0, 1]
     */
    public RecommendationResponse generateRecommendations(String userId, RecommendationQuery query) {
        long start = System.currentTimeMillis();
        RecommendationStrategy strategy = RecommendationStrategy.fromValue(query.getStrategy());
        checkUnit("diversity", query.getDiversity());
        checkUnit("minQuality", query.getMinQuality());
        int limit = Math.max(1, Math.min(RecommendationQuery.MAX_LIMIT, query.getLimit()));

        // ==================== 1. 上下文 ====================
        UserProfile profile = profileService.getOrCreateProfile(userId);
        int interactionCount = profile.getTotalInteractions() != null ? profile.getTotalInteractions() : 0;

        RecommendationContext ctx = new RecommendationContext();
        ctx.setUserId(userId);
        ctx.setLimit(limit);
        ctx.setRequestedStrategy(strategy);
        ctx.setEffectiveStrategy(strategy);
        ctx.setMinQuality(query.getMinQuality());
        ctx.setInteractionCount(interactionCount);
        ctx.setColdStart(interactionCount == 0);
        ctx.setDiversityPreference(query.getDiversity() != null
            ? query.getDiversity() : orDefault(profile.getDiversityPreference(), UserProfile.DEFAULT_DIVERSITY));
        ctx.setNoveltyPreference(orDefault(profile.getNoveltyPreference(), UserProfile.DEFAULT_NOVELTY));
        ctx.setRankingWeights(profileService.getRankingWeights(profile));
        ctx.setExcludedSources(new HashSet<>(profileService.getExcludedSources(profile)));

        // ==================== 2. 流水线 ====================
        pipelineBuilder.build().execute(ctx);

        // ==================== 3. 响应 ====================
        List<RecommendationItem> items = toItems(ctx.getResults());
        List<Double> scores = items.stream().map(RecommendationItem::getHybridScore).collect(Collectors.toList());
        List<String> ids = items.stream().map(RecommendationItem::getResourceId).collect(Collectors.toList());

        RecommendationMetadata metadata = RecommendationMetadata.builder()
            .count(items.size())
            .strategy(ctx.getEffectiveStrategy().getValue())
            .giniCoefficient(metricsService.computeGiniCoefficient(scores))
            .coldStart(ctx.isColdStart())
            .interactionCount(interactionCount)
            .collaborativeEligible(ctx.isCollaborativeEligible())
            .diversityApplied(ctx.isDiversityApplied())
            .noveltyApplied(ctx.isNoveltyApplied())
            .diversityPreference(ctx.getDiversityPreference())
            .noveltyPreference(ctx.getNoveltyPreference())
            .noveltyRatio(metricsService.computeNoveltyRatio(ids, ctx.getTopViewedIds()))
            .build();

        if (!items.isEmpty()) {
            try {
                feedbackService.recordImpressions(userId, metadata.getStrategy(), items);
            } catch (Exception e) {
                log.error("[Recommend] 记录曝光失败: userId={}", userId, e);
            }
        }

        log.info("[Recommend] 推荐完成: userId={}, strategy={}, count={}, coldStart={}, duration={}ms",
            userId, metadata.getStrategy(), items.size(), metadata.isColdStart(), System.currentTimeMillis() - start);
        return RecommendationResponse.builder().recommendations(items).metadata(metadata).build();
    }

    private List<RecommendationItem> toItems(List<Candidate> results) {
        List<RecommendationItem> items = new ArrayList<>(results.size());
        int rank = 1;
        for (Candidate candidate : results) {
            Map<String, Double> components = new LinkedHashMap<>();
            for (String component : RankingWeights.COMPONENTS) {
                components.put(component, candidate.componentScore(component));
            }
            items.add(RecommendationItem.builder()
                .resourceId(candidate.getResourceId())
                .title(candidate.getMetadata() != null ? candidate.getMetadata().getTitle() : null)
                .hybridScore(candidate.getHybridScore())
                .componentScores(components)
                .contributingStrategies(new LinkedHashSet<>(candidate.getProvenance()))
                .rank(rank++)
                .noveltyScore(candidate.getNoveltyScore())
                .viewCount(candidate.getViewCount())
                .build());
        }
        return items;
    }

    private static void checkUnit(String field, Double value) {
        if (value != null && (!Double.isFinite(value) || value < 0.0 || value > 1.0)) {
            throw new InvalidPreferenceRangeException(field, field + " 必须在 [0, 1] 之间，实际为: " + value);
        }
    }

    private static double orDefault(Double value, double fallback) {
        return value != null ? value : fallback;
    }
}
