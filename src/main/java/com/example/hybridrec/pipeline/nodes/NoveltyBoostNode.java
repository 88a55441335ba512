package com.example.hybridrec.pipeline.nodes;

import com.example.hybridrec.context.RecommendationContext;
import com.example.hybridrec.pipeline.PipelineNode;
import com.example.hybridrec.ranking.NoveltyBooster;
import com.example.hybridrec.ranking.NoveltyResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 新颖度节点：加成、截取与新颖度下限
 */
@Slf4j
@RequiredArgsConstructor
public class NoveltyBoostNode implements PipelineNode {

    private final NoveltyBooster noveltyBooster;

    @Override
    public NodeResult execute(RecommendationContext state) {
        NoveltyResult result = noveltyBooster.apply(state.getCandidates(), state.getNoveltyPreference(), state.getLimit());
        state.setNoveltyApplied(result.isApplied());
        state.setTopViewedIds(result.getTopViewedIds());
        state.setResults(result.getItems());
        return NodeResult.success();
    }
}
