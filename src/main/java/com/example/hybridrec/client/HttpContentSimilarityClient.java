package com.example.hybridrec.client;

import com.example.hybridrec.dto.SimilarResource;
import com.example.hybridrec.vector.EmbeddingVector;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 基于 WebClient 的内容相似度客户端
 *
 * 调用自带超时，超时后释放召回线程；召回层另有整体等待上限
 */
@Component
@Slf4j
public class HttpContentSimilarityClient implements ContentSimilarityClient {

    private static final ParameterizedTypeReference<List<SimilarResource>> SIMILAR_LIST =
        new ParameterizedTypeReference<>() {};

    private final WebClient similarityWebClient;
    private final Duration timeout;

    public HttpContentSimilarityClient(@Qualifier("similarityWebClient") WebClient similarityWebClient,
                                       @Value("${external.similarity-service.timeout-ms:150}") long timeoutMs) {
        this.similarityWebClient = similarityWebClient;
        this.timeout = Duration.ofMillis(timeoutMs);
    }

    @Override
    public List<SimilarResource> findSimilar(EmbeddingVector query, int topK, double minSimilarity) {
        Map<String, Object> payload = new HashMap<>();
        payload.put("embedding", query.toArray());
        payload.put("topK", topK);
        payload.put("minSimilarity", minSimilarity);

        try {
            List<SimilarResource> results = similarityWebClient.post()
                .uri("/api/similarity/search")
                .bodyValue(payload)
                .retrieve()
                .bodyToMono(SIMILAR_LIST)
                .block(timeout);
            return results != null ? results : Collections.emptyList();
        } catch (Exception e) {
            log.warn("[SimilarityClient] 相似度检索失败: {}", e.getMessage());
            return Collections.emptyList();
        }
    }
}
