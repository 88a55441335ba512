package com.example.hybridrec.pipeline;

import com.example.hybridrec.candidate.CandidateGenerator;
import com.example.hybridrec.client.ResourceMetadataClient;
import com.example.hybridrec.collaborative.CollaborativeScorer;
import com.example.hybridrec.config.RecommendationProperties;
import com.example.hybridrec.pipeline.edges.NonEmptyPoolEdge;
import com.example.hybridrec.pipeline.nodes.CandidateGenerationNode;
import com.example.hybridrec.pipeline.nodes.DiversityRerankNode;
import com.example.hybridrec.pipeline.nodes.HybridRankingNode;
import com.example.hybridrec.pipeline.nodes.MetadataEnrichmentNode;
import com.example.hybridrec.pipeline.nodes.NoveltyBoostNode;
import com.example.hybridrec.pipeline.nodes.QualityFilterNode;
import com.example.hybridrec.ranking.DiversityOptimizer;
import com.example.hybridrec.ranking.HybridRanker;
import com.example.hybridrec.ranking.NoveltyBooster;
import com.example.hybridrec.service.UserEmbeddingService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * 推荐流水线构建器
 *
 * candidate_generation → metadata_enrichment → quality_filter → hybrid_ranking
 *   → diversity_rerank → novelty_boost；候选池为空时提前结束
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RecommendationPipelineBuilder {

    public static final String CANDIDATE_GENERATION = "candidate_generation";
    public static final String METADATA_ENRICHMENT = "metadata_enrichment";
    public static final String QUALITY_FILTER = "quality_filter";
    public static final String HYBRID_RANKING = "hybrid_ranking";
    public static final String DIVERSITY_RERANK = "diversity_rerank";
    public static final String NOVELTY_BOOST = "novelty_boost";

    private final UserEmbeddingService userEmbeddingService;
    private final CandidateGenerator candidateGenerator;
    private final ResourceMetadataClient metadataClient;
    private final CollaborativeScorer collaborativeScorer;
    private final HybridRanker hybridRanker;
    private final DiversityOptimizer diversityOptimizer;
    private final NoveltyBooster noveltyBooster;
    private final RecommendationProperties properties;

    public RecommendationPipeline build() {
        RecommendationPipeline pipeline = new RecommendationPipeline();

        // 1. 节点
        pipeline.addNode(CANDIDATE_GENERATION, new CandidateGenerationNode(userEmbeddingService, candidateGenerator));
        pipeline.addNode(METADATA_ENRICHMENT, new MetadataEnrichmentNode(metadataClient));
        pipeline.addNode(QUALITY_FILTER, new QualityFilterNode());
        pipeline.addNode(HYBRID_RANKING, new HybridRankingNode(hybridRanker, collaborativeScorer));
        pipeline.addNode(DIVERSITY_RERANK,
            new DiversityRerankNode(diversityOptimizer, properties.getDiversity().getPoolFactor()));
        pipeline.addNode(NOVELTY_BOOST, new NoveltyBoostNode(noveltyBooster));

        // 2. 条件边
        pipeline.addEdge(CANDIDATE_GENERATION, new NonEmptyPoolEdge(METADATA_ENRICHMENT));
        pipeline.addEdge(METADATA_ENRICHMENT, (state, result) -> QUALITY_FILTER);
        pipeline.addEdge(QUALITY_FILTER, new NonEmptyPoolEdge(HYBRID_RANKING));
        pipeline.addEdge(HYBRID_RANKING, (state, result) -> DIVERSITY_RERANK);
        pipeline.addEdge(DIVERSITY_RERANK, (state, result) -> NOVELTY_BOOST);
        // novelty_boost 为终止节点

        pipeline.setStart(CANDIDATE_GENERATION);
        if (log.isTraceEnabled()) {
            log.trace("[Pipeline] 流水线结构:\n{}", pipeline.visualize());
        }
        return pipeline;
    }
}
