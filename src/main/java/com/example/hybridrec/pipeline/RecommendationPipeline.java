package com.example.hybridrec.pipeline;

import com.example.hybridrec.context.RecommendationContext;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 推荐流水线状态图
 */
@Slf4j
public class RecommendationPipeline {

    private static final int MAX_ITERATIONS = 100;

    private final Map<String, PipelineNode> nodes = new LinkedHashMap<>();
    private final Map<String, ConditionalEdge> edges = new LinkedHashMap<>();
    private String startNode;

    public RecommendationPipeline addNode(String name, PipelineNode node) {
        nodes.put(name, node);
        return this;
    }

    public RecommendationPipeline addEdge(String fromNode, ConditionalEdge edge) {
        edges.put(fromNode, edge);
        return this;
    }

    public RecommendationPipeline setStart(String nodeName) {
        this.startNode = nodeName;
        return this;
    }

    public void execute(RecommendationContext state) {
        if (startNode == null) {
            throw new IllegalStateException("起始节点未设置");
        }

        String currentNode = startNode;
        int iterations = 0;

        while (currentNode != null && iterations < MAX_ITERATIONS) {
            iterations++;

            PipelineNode node = nodes.get(currentNode);
            if (node == null) {
                throw new IllegalStateException("节点不存在: " + currentNode);
            }

            long start = System.currentTimeMillis();
            PipelineNode.NodeResult result = node.execute(state);
            log.debug("[Pipeline] 节点 {} 完成: success={}, candidates={}, duration={}ms",
                currentNode, result.isSuccess(), state.getCandidates().size(), System.currentTimeMillis() - start);

            ConditionalEdge edge = edges.get(currentNode);
            if (edge == null) {
                break;
            }
            String nextNode = edge.decide(state, result);
            if (nextNode != null) {
                log.debug("[Pipeline] 从 {} -> {}", currentNode, nextNode);
            }
            currentNode = nextNode;
        }

        if (iterations >= MAX_ITERATIONS) {
            log.error("[Pipeline] 达到最大迭代次数，可能存在环: userId={}", state.getUserId());
        }
        log.debug("[Pipeline] 执行完成: userId={}, nodes={}", state.getUserId(), iterations);
    }

    public String visualize() {
        StringBuilder sb = new StringBuilder();
        sb.append("起始节点: ").append(startNode).append("\n");
        for (String name : nodes.keySet()) {
            sb.append("  - ").append(name).append(edges.containsKey(name) ? " -> [条件边]" : " (终止)").append("\n");
        }
        return sb.toString();
    }
}
