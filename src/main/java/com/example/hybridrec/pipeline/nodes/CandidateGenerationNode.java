package com.example.hybridrec.pipeline.nodes;

import com.example.hybridrec.candidate.CandidateGenerator;
import com.example.hybridrec.candidate.CandidatePool;
import com.example.hybridrec.context.RecommendationContext;
import com.example.hybridrec.pipeline.PipelineNode;
import com.example.hybridrec.service.UserEmbeddingService;
import com.example.hybridrec.vector.EmbeddingVector;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 召回节点：计算用户 embedding 并执行三路召回
 */
@Slf4j
@RequiredArgsConstructor
public class CandidateGenerationNode implements PipelineNode {

    private final UserEmbeddingService userEmbeddingService;
    private final CandidateGenerator candidateGenerator;

    @Override
    public NodeResult execute(RecommendationContext state) {
        EmbeddingVector embedding = userEmbeddingService.getUserEmbedding(state.getUserId());
        state.setUserEmbedding(embedding);

        CandidatePool pool = candidateGenerator.generateCandidates(
            state.getUserId(), state.getRequestedStrategy(), embedding, state.getInteractionCount());

        state.setCandidates(pool.getCandidates());
        state.setEffectiveStrategy(pool.getEffectiveStrategy());
        state.setCollaborativeEligible(pool.isCollaborativeEligible());
        state.getDegradedSources().addAll(pool.getDegradedSources());

        if (pool.getCandidates().isEmpty() && !pool.getDegradedSources().isEmpty()) {
            return NodeResult.failure("召回来源超时或失败: " + pool.getDegradedSources());
        }
        return NodeResult.success();
    }
}
