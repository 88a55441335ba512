package com.example.hybridrec.pipeline.nodes;

import com.example.hybridrec.candidate.Candidate;
import com.example.hybridrec.context.RecommendationContext;
import com.example.hybridrec.pipeline.PipelineNode;
import com.example.hybridrec.ranking.DiversityOptimizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * MMR 多样性重排节点
 *
 * 输出 limit * poolFactor 个，多出的部分留给新颖度阶段替换
 */
@Slf4j
@RequiredArgsConstructor
public class DiversityRerankNode implements PipelineNode {

    private final DiversityOptimizer diversityOptimizer;
    private final int poolFactor;

    @Override
    public NodeResult execute(RecommendationContext state) {
        int outputSize = state.getLimit() * poolFactor;
        List<Candidate> reranked = diversityOptimizer.rerank(
            state.getCandidates(), state.getDiversityPreference(), outputSize);

        // λ = 1 时退化为纯相关性排序
        state.setDiversityApplied(state.getDiversityPreference() < 1.0 && reranked.size() > 1);
        state.setCandidates(reranked);
        return NodeResult.success();
    }
}
