package com.example.hybridrec.client;

import com.example.hybridrec.dto.ResourceMetadata;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 基于 WebClient 的资源元数据客户端
 */
@Component
@Slf4j
public class HttpResourceMetadataClient implements ResourceMetadataClient {

    private static final ParameterizedTypeReference<List<ResourceMetadata>> METADATA_LIST =
        new ParameterizedTypeReference<>() {};

    private final WebClient resourceWebClient;
    private final Duration timeout;

    public HttpResourceMetadataClient(@Qualifier("resourceWebClient") WebClient resourceWebClient,
                                      @Value("${external.resource-service.timeout-ms:1000}") long timeoutMs) {
        this.resourceWebClient = resourceWebClient;
        this.timeout = Duration.ofMillis(timeoutMs);
    }

    @Override
    public Map<String, ResourceMetadata> getMetadata(Collection<String> resourceIds) {
        if (resourceIds == null || resourceIds.isEmpty()) {
            return Collections.emptyMap();
        }
        try {
            List<ResourceMetadata> rows = resourceWebClient.post()
                .uri("/api/resources/batch")
                .bodyValue(Map.of("resourceIds", resourceIds))
                .retrieve()
                .bodyToMono(METADATA_LIST)
                .block(timeout);
            Map<String, ResourceMetadata> result = new LinkedHashMap<>();
            if (rows != null) {
                for (ResourceMetadata row : rows) {
                    if (row != null && row.getResourceId() != null) {
                        result.put(row.getResourceId(), row);
                    }
                }
            }
            log.debug("[ResourceClient] 查询元数据: requested={}, found={}", resourceIds.size(), result.size());
            return result;
        } catch (Exception e) {
            log.warn("[ResourceClient] 查询元数据失败: requested={}, error={}", resourceIds.size(), e.getMessage());
            return Collections.emptyMap();
        }
    }
}
