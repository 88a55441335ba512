package com.example.hybridrec.pipeline.nodes;

import com.example.hybridrec.candidate.Candidate;
import com.example.hybridrec.context.RecommendationContext;
import com.example.hybridrec.dto.ResourceMetadata;
import com.example.hybridrec.pipeline.PipelineNode;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 过滤节点：去掉低于最低质量或来自屏蔽来源的候选
 */
@Slf4j
public class QualityFilterNode implements PipelineNode {

    @Override
    public NodeResult execute(RecommendationContext state) {
        Double minQuality = state.getMinQuality();
        int before = state.getCandidates().size();

        List<Candidate> kept = state.getCandidates().stream()
            .filter(c -> minQuality == null || qualityOf(c) >= minQuality)
            .filter(c -> !isExcludedSource(c, state))
            .collect(Collectors.toList());
        state.setCandidates(kept);

        if (kept.size() < before) {
            log.debug("[Filter] 过滤候选: userId={}, before={}, after={}", state.getUserId(), before, kept.size());
        }
        return NodeResult.success();
    }

    private static double qualityOf(Candidate candidate) {
        ResourceMetadata meta = candidate.getMetadata();
        return meta != null && meta.getQualityScore() != null ? meta.getQualityScore() : 0.0;
    }

    private static boolean isExcludedSource(Candidate candidate, RecommendationContext state) {
        ResourceMetadata meta = candidate.getMetadata();
        return meta != null && meta.getSource() != null && state.getExcludedSources().contains(meta.getSource());
    }
}
