package com.example.hybridrec.pipeline.nodes;

import com.example.hybridrec.candidate.Candidate;
import com.example.hybridrec.client.ResourceMetadataClient;
import com.example.hybridrec.context.RecommendationContext;
import com.example.hybridrec.dto.ResourceMetadata;
import com.example.hybridrec.pipeline.PipelineNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 元数据补全节点：批量查询资源元数据，填充浏览量
 *
 * 查不到元数据的候选保留，quality / recency 按 0 计
 */
@Slf4j
@RequiredArgsConstructor
public class MetadataEnrichmentNode implements PipelineNode {

    private final ResourceMetadataClient metadataClient;

    @Override
    public NodeResult execute(RecommendationContext state) {
        List<String> ids = state.getCandidates().stream()
            .map(Candidate::getResourceId)
            .collect(Collectors.toList());
        Map<String, ResourceMetadata> metadata = metadataClient.getMetadata(ids);

        int missing = 0;
        for (Candidate candidate : state.getCandidates()) {
            ResourceMetadata meta = metadata.get(candidate.getResourceId());
            candidate.setMetadata(meta);
            if (meta == null) {
                missing++;
                continue;
            }
            candidate.setViewCount(meta.getViewCount() != null ? Math.max(0L, meta.getViewCount()) : 0L);
        }
        if (missing > 0) {
            log.warn("[Enrichment] 部分候选缺少元数据: userId={}, missing={}/{}",
                state.getUserId(), missing, ids.size());
        }
        return NodeResult.success();
    }
}
