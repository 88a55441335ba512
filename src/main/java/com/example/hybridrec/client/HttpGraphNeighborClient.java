package com.example.hybridrec.client;

import com.example.hybridrec.dto.GraphNeighbor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * 基于 WebClient 的图邻居客户端
 */
@Component
@Slf4j
public class HttpGraphNeighborClient implements GraphNeighborClient {

    private static final ParameterizedTypeReference<List<GraphNeighbor>> NEIGHBOR_LIST =
        new ParameterizedTypeReference<>() {};

    private final WebClient graphWebClient;
    private final Duration timeout;

    public HttpGraphNeighborClient(@Qualifier("graphWebClient") WebClient graphWebClient,
                                   @Value("${external.graph-service.timeout-ms:150}") long timeoutMs) {
        this.graphWebClient = graphWebClient;
        this.timeout = Duration.ofMillis(timeoutMs);
    }

    @Override
    public List<GraphNeighbor> findNeighbors(Collection<String> seedResourceIds, int hops, int limit) {
        if (seedResourceIds == null || seedResourceIds.isEmpty()) {
            return Collections.emptyList();
        }
        try {
            List<GraphNeighbor> results = graphWebClient.post()
                .uri("/api/graph/neighbors")
                .bodyValue(Map.of("seedIds", seedResourceIds, "hops", hops, "limit", limit))
                .retrieve()
                .bodyToMono(NEIGHBOR_LIST)
                .block(timeout);
            return results != null ? results : Collections.emptyList();
        } catch (Exception e) {
            log.warn("[GraphClient] 图邻居检索失败: seeds={}, error={}", seedResourceIds.size(), e.getMessage());
            return Collections.emptyList();
        }
    }
}
