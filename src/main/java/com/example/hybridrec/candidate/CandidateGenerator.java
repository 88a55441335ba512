package com.example.hybridrec.candidate;

import com.example.hybridrec.client.ContentSimilarityClient;
import com.example.hybridrec.client.GraphNeighborClient;
import com.example.hybridrec.collaborative.CollaborativeScorer;
import com.example.hybridrec.config.RecommendationProperties;
import com.example.hybridrec.dto.GraphNeighbor;
import com.example.hybridrec.dto.SimilarResource;
import com.example.hybridrec.mapper.UserInteractionMapper;
import com.example.hybridrec.vector.EmbeddingVector;
import com.example.hybridrec.vector.VectorMath;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * 候选召回
 *
 * 协同 / 内容 / 图三路并行召回，各自独立超时，超时或异常按零候选处理；
 * 用户交互过的资源不会出现在任何一路结果中
 */
@Component
@Slf4j
public class CandidateGenerator {

    private final CollaborativeScorer collaborativeScorer;
    private final ContentSimilarityClient similarityClient;
    private final GraphNeighborClient graphClient;
    private final UserInteractionMapper interactionMapper;
    private final RecommendationProperties properties;
    private final Executor executor;

    public CandidateGenerator(CollaborativeScorer collaborativeScorer,
                              ContentSimilarityClient similarityClient,
                              GraphNeighborClient graphClient,
                              UserInteractionMapper interactionMapper,
                              RecommendationProperties properties,
                              @Qualifier("candidateSourceExecutor") Executor executor) {
        this.collaborativeScorer = collaborativeScorer;
        this.similarityClient = similarityClient;
        this.graphClient = graphClient;
        this.interactionMapper = interactionMapper;
        this.properties = properties;
        this.executor = executor;
    }

    /**
     * @param interactionCount 用户累计交互次数（协同召回门槛）
     */
    public CandidatePool generateCandidates(String userId, RecommendationStrategy strategy,
                                            EmbeddingVector userEmbedding, int interactionCount) {
        RecommendationProperties.Candidate config = properties.getCandidate();

        boolean eligible = collaborativeScorer.isAvailable()
            && interactionCount >= config.getCollaborativeMinInteractions();
        RecommendationStrategy effective = strategy;
        if (strategy == RecommendationStrategy.COLLABORATIVE && !eligible) {
            log.info("[Candidate] 不满足协同召回条件，回退 hybrid: userId={}, interactions={}, modelAvailable={}",
                userId, interactionCount, collaborativeScorer.isAvailable());
            effective = RecommendationStrategy.HYBRID;
        }

        Set<CandidateSource> enabled = EnumSet.noneOf(CandidateSource.class);
        enabled.addAll(effective.getSources());
        if (!eligible) {
            enabled.remove(CandidateSource.COLLABORATIVE);
        }

        Set<String> seen = new HashSet<>(interactionMapper.findResourceIdsByUser(userId));

        // ==================== 1. 并行召回 ====================
        Map<CandidateSource, CompletableFuture<Map<String, Double>>> futures = new EnumMap<>(CandidateSource.class);
        if (enabled.contains(CandidateSource.COLLABORATIVE)) {
            futures.put(CandidateSource.COLLABORATIVE,
                submit(CandidateSource.COLLABORATIVE, () -> collaborativeSource(userId, seen)));
        }
        if (enabled.contains(CandidateSource.CONTENT)) {
            futures.put(CandidateSource.CONTENT,
                submit(CandidateSource.CONTENT, () -> contentSource(userEmbedding, seen)));
        }
        if (enabled.contains(CandidateSource.GRAPH)) {
            futures.put(CandidateSource.GRAPH,
                submit(CandidateSource.GRAPH, () -> graphSource(userId, seen)));
        }

        // ==================== 2. 合并 ====================
        Map<String, Candidate> merged = new LinkedHashMap<>();
        Set<CandidateSource> degraded = EnumSet.noneOf(CandidateSource.class);
        for (Map.Entry<CandidateSource, CompletableFuture<Map<String, Double>>> entry : futures.entrySet()) {
            CandidateSource source = entry.getKey();
            Map<String, Double> scores = entry.getValue().join();
            if (scores == null) {
                degraded.add(source);
                continue;
            }
            for (Map.Entry<String, Double> scored : scores.entrySet()) {
                if (seen.contains(scored.getKey())) {
                    continue;
                }
                Candidate candidate = merged.computeIfAbsent(scored.getKey(), Candidate::new);
                candidate.getComponentScores().put(source.getValue(), scored.getValue());
                candidate.getProvenance().add(source.getValue());
            }
        }

        List<Candidate> candidates = merged.values().stream()
            .sorted(Comparator.comparingDouble(Candidate::maxComponentScore).reversed()
                .thenComparing(Candidate::getResourceId))
            .limit(config.getMergedLimit())
            .collect(Collectors.toList());

        log.info("[Candidate] 召回完成: userId={}, strategy={}, sources={}, degraded={}, candidates={}",
            userId, effective.getValue(), enabled, degraded, candidates.size());

        return CandidatePool.builder()
            .candidates(candidates)
            .effectiveStrategy(effective)
            .collaborativeEligible(eligible)
            .degradedSources(degraded)
            .build();
    }

    // 超时、异常或线程池拒绝时结果为 null，由合并阶段记为降级来源
    private CompletableFuture<Map<String, Double>> submit(CandidateSource source, Supplier<Map<String, Double>> task) {
        long timeoutMs = properties.getCandidate().getSourceTimeoutMs();
        CompletableFuture<Map<String, Double>> future;
        try {
            future = CompletableFuture.supplyAsync(task, executor);
        } catch (RejectedExecutionException e) {
            log.warn("[Candidate] 召回线程池已满，跳过来源: source={}, error={}", source.getValue(), e.getMessage());
            return CompletableFuture.completedFuture(null);
        }
        return future
            .completeOnTimeout(null, timeoutMs, TimeUnit.MILLISECONDS)
            .exceptionally(ex -> {
                log.warn("[Candidate] 召回来源失败: source={}, error={}", source.getValue(), ex.getMessage());
                return null;
            })
            .thenApply(result -> {
                if (result == null) {
                    log.warn("[Candidate] 召回来源无结果（超时或失败）: source={}, timeoutMs={}", source.getValue(), timeoutMs);
                }
                return result;
            });
    }

    // ==================== 召回来源 ====================

    private Map<String, Double> collaborativeSource(String userId, Set<String> seen) {
        return collaborativeScorer.topItems(userId, seen, properties.getCandidate().getSourceLimit());
    }

    private Map<String, Double> contentSource(EmbeddingVector userEmbedding, Set<String> seen) {
        if (userEmbedding == null || userEmbedding.isZero()) {
            log.debug("[Candidate] 用户 embedding 为零向量，跳过内容召回");
            return Collections.emptyMap();
        }
        RecommendationProperties.Candidate config = properties.getCandidate();
        List<SimilarResource> similar = similarityClient.findSimilar(
            userEmbedding, config.getSourceLimit(), config.getContentMinSimilarity());

        return similar.stream()
            .filter(s -> s.getResourceId() != null && !seen.contains(s.getResourceId()))
            .filter(s -> Double.isFinite(s.getSimilarity()) && s.getSimilarity() > config.getContentMinSimilarity())
            .sorted(Comparator.comparingDouble(SimilarResource::getSimilarity).reversed()
                .thenComparing(SimilarResource::getResourceId))
            .limit(config.getSourceLimit())
            .collect(Collectors.toMap(SimilarResource::getResourceId,
                s -> VectorMath.clamp(s.getSimilarity(), 0.0, 1.0),
                (a, b) -> a, LinkedHashMap::new));
    }

    private Map<String, Double> graphSource(String userId, Set<String> seen) {
        RecommendationProperties.Candidate config = properties.getCandidate();
        List<String> seeds = interactionMapper.findRecentResourceIds(userId, config.getGraphSeedCount());
        if (seeds.isEmpty()) {
            return Collections.emptyMap();
        }
        List<GraphNeighbor> neighbors = graphClient.findNeighbors(seeds, config.getGraphHops(), config.getSourceLimit());

        return neighbors.stream()
            .filter(n -> n.getResourceId() != null && !seen.contains(n.getResourceId()))
            .filter(n -> n.getHops() <= config.getGraphHops())
            .sorted(Comparator.comparingDouble(GraphNeighbor::getScore).reversed()
                .thenComparing(GraphNeighbor::getResourceId))
            .limit(config.getSourceLimit())
            .collect(Collectors.toMap(GraphNeighbor::getResourceId,
                n -> VectorMath.clamp(n.getScore(), 0.0, 1.0),
                (a, b) -> a, LinkedHashMap::new));
    }
}
