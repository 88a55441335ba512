package com.example.hybridrec.pipeline.nodes;

import com.example.hybridrec.candidate.Candidate;
import com.example.hybridrec.candidate.CandidateSource;
import com.example.hybridrec.collaborative.CollaborativeScore;
import com.example.hybridrec.collaborative.CollaborativeScorer;
import com.example.hybridrec.context.RecommendationContext;
import com.example.hybridrec.pipeline.PipelineNode;
import com.example.hybridrec.ranking.HybridRanker;
import com.example.hybridrec.ranking.RankingWeights;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 混合排序节点
 *
 * 协同可用且生效策略包含协同召回时，为非协同来源的候选补算协同分（不计入召回来源）；
 * content / graph 策略下协同分量保持为 0
 */
@Slf4j
@RequiredArgsConstructor
public class HybridRankingNode implements PipelineNode {

    private final HybridRanker ranker;
    private final CollaborativeScorer collaborativeScorer;

    @Override
    public NodeResult execute(RecommendationContext state) {
        if (state.isCollaborativeEligible()
            && state.getEffectiveStrategy().getSources().contains(CandidateSource.COLLABORATIVE)) {
            fillCollaborativeScores(state);
        }
        state.setCandidates(ranker.rank(state.getCandidates(), state.getRankingWeights()));
        return NodeResult.success();
    }

    private void fillCollaborativeScores(RecommendationContext state) {
        List<String> missing = state.getCandidates().stream()
            .filter(c -> !c.getComponentScores().containsKey(RankingWeights.COLLABORATIVE))
            .map(Candidate::getResourceId)
            .collect(Collectors.toList());
        if (missing.isEmpty()) {
            return;
        }

        Map<String, CollaborativeScore> scores = collaborativeScorer.predictBatch(state.getUserId(), missing);
        int filled = 0;
        for (Candidate candidate : state.getCandidates()) {
            CollaborativeScore score = scores.get(candidate.getResourceId());
            if (score != null && score.isAvailable()) {
                candidate.getComponentScores().put(RankingWeights.COLLABORATIVE, score.getValue());
                filled++;
            }
        }
        log.debug("[Ranking] 补算协同分: userId={}, filled={}/{}", state.getUserId(), filled, missing.size());
    }
}
