package com.example.hybridrec.pipeline;

import com.example.hybridrec.context.RecommendationContext;

/**
 * 条件边 - 根据上下文与上一节点结果决定下一个节点
 */
@FunctionalInterface
public interface ConditionalEdge {

    /**
     * @return 下一个节点的名称，null 表示结束
     */
    String decide(RecommendationContext state, PipelineNode.NodeResult lastResult);
}
