package com.example.hybridrec.pipeline;

import com.example.hybridrec.context.RecommendationContext;

/**
 * 流水线节点接口
 *
 * 节点只读写上下文，下一步走向由条件边决定
 */
@FunctionalInterface
public interface PipelineNode {

    NodeResult execute(RecommendationContext state);

    /**
     * 节点执行结果
     */
    class NodeResult {
        private final boolean success;
        private final String reason;

        private NodeResult(boolean success, String reason) {
            this.success = success;
            this.reason = reason;
        }

        public static NodeResult success() {
            return new NodeResult(true, null);
        }

        public static NodeResult failure(String reason) {
            return new NodeResult(false, reason);
        }

        public boolean isSuccess() {
            return success;
        }

        public String getReason() {
            return reason;
        }
    }
}
