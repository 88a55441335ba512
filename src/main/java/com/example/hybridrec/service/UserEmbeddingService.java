package com.example.hybridrec.service;

import com.example.hybridrec.client.ResourceMetadataClient;
import com.example.hybridrec.config.RecommendationProperties;
import com.example.hybridrec.dto.ResourceMetadata;
import com.example.hybridrec.entity.UserInteraction;
import com.example.hybridrec.exception.MalformedEmbeddingException;
import com.example.hybridrec.mapper.UserInteractionMapper;
import com.example.hybridrec.vector.EmbeddingVector;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 用户 embedding 计算
 *
 * 最近正向交互资源 embedding 的强度加权平均；没有可用 embedding 时返回零向量
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class UserEmbeddingService {

    private final UserInteractionMapper interactionMapper;
    private final ResourceMetadataClient metadataClient;
    private final EmbeddingCache embeddingCache;
    private final RecommendationProperties properties;

    public EmbeddingVector getUserEmbedding(String userId) {
        Optional<EmbeddingVector> cached = embeddingCache.get(userId);
        if (cached.isPresent()) {
            return cached.get();
        }

        EmbeddingVector embedding = computeEmbedding(userId);
        embeddingCache.put(userId, embedding);
        return embedding;
    }

    private EmbeddingVector computeEmbedding(String userId) {
        int dimension = properties.getEmbeddingDimension();
        List<UserInteraction> positives = interactionMapper.findRecentPositive(
            userId, properties.getLearning().getEmbeddingInteractionLimit());
        if (positives.isEmpty()) {
            log.debug("[UserEmbedding] 无正向交互，返回零向量: userId={}", userId);
            return EmbeddingVector.zero(dimension);
        }

        Set<String> resourceIds = positives.stream()
            .map(UserInteraction::getResourceId)
            .collect(Collectors.toCollection(LinkedHashSet::new));
        Map<String, ResourceMetadata> metadata = metadataClient.getMetadata(resourceIds);

        double[] sum = new double[dimension];
        double totalWeight = 0.0;
        int used = 0;
        for (UserInteraction interaction : positives) {
            ResourceMetadata meta = metadata.get(interaction.getResourceId());
            if (meta == null) {
                continue;
            }
            EmbeddingVector vector;
            try {
                vector = EmbeddingVector.of(meta.getEmbedding(), dimension);
            } catch (MalformedEmbeddingException e) {
                log.warn("[UserEmbedding] 跳过非法 embedding: resourceId={}, error={}",
                    interaction.getResourceId(), e.getMessage());
                continue;
            }
            double weight = interaction.getInteractionStrength() != null ? interaction.getInteractionStrength() : 0.0;
            if (weight <= 0.0) {
                continue;
            }
            for (int i = 0; i < dimension; i++) {
                sum[i] += weight * vector.get(i);
            }
            totalWeight += weight;
            used++;
        }

        if (used == 0 || totalWeight <= 0.0) {
            log.debug("[UserEmbedding] 无可用 embedding，返回零向量: userId={}", userId);
            return EmbeddingVector.zero(dimension);
        }
        for (int i = 0; i < dimension; i++) {
            sum[i] /= totalWeight;
        }
        log.debug("[UserEmbedding] 计算完成: userId={}, used={}/{}", userId, used, positives.size());
        return EmbeddingVector.of(sum, dimension);
    }
}
