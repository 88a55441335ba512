package com.example.hybridrec.pipeline.edges;

import com.example.hybridrec.context.RecommendationContext;
import com.example.hybridrec.pipeline.ConditionalEdge;
import com.example.hybridrec.pipeline.PipelineNode;
import lombok.extern.slf4j.Slf4j;

/**
 * 候选池非空条件边
 *
 * 决策逻辑：
 * - 节点失败或候选池为空 -> null（结束，返回空列表）
 * - 否则 -> next
 */
@Slf4j
public class NonEmptyPoolEdge implements ConditionalEdge {

    private final String next;

    public NonEmptyPoolEdge(String next) {
        this.next = next;
    }

    @Override
    public String decide(RecommendationContext state, PipelineNode.NodeResult lastResult) {
        if (!lastResult.isSuccess()) {
            log.warn("[PoolEdge] 节点失败，结束流程: userId={}, reason={}", state.getUserId(), lastResult.getReason());
            return null;
        }
        if (state.getCandidates().isEmpty()) {
            log.info("[PoolEdge] 候选池为空，结束流程: userId={}", state.getUserId());
            return null;
        }
        return next;
    }
}
