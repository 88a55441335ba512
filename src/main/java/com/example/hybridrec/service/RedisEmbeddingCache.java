package com.example.hybridrec.service;

import com.example.hybridrec.config.RecommendationProperties;
import com.example.hybridrec.exception.MalformedEmbeddingException;
import com.example.hybridrec.vector.EmbeddingVector;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Redis embedding 缓存（多节点共享）
 *
 * 过期交给 Redis TTL
 */
@Service
@ConditionalOnProperty(name = "recommendation.embedding-cache.type", havingValue = "redis")
@RequiredArgsConstructor
@Slf4j
public class RedisEmbeddingCache implements EmbeddingCache {

    private final StringRedisTemplate stringRedisTemplate;
    private final ObjectMapper objectMapper;
    private final RecommendationProperties properties;

    @Override
    public Optional<EmbeddingVector> get(String userId) {
        String key = getKey(userId);
        try {
            String json = stringRedisTemplate.opsForValue().get(key);
            if (json == null) {
                return Optional.empty();
            }
            double[] values = objectMapper.readValue(json, double[].class);
            log.debug("[EmbeddingCache] 命中缓存: userId={}", userId);
            return Optional.of(EmbeddingVector.of(values, properties.getEmbeddingDimension()));
        } catch (JsonProcessingException | MalformedEmbeddingException e) {
            log.warn("[EmbeddingCache] 缓存内容无法解析，已清除: userId={}, error={}", userId, e.getMessage());
            stringRedisTemplate.delete(key);
            return Optional.empty();
        } catch (Exception e) {
            log.warn("[EmbeddingCache] 读取缓存失败: userId={}, error={}", userId, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public void put(String userId, EmbeddingVector embedding) {
        try {
            String json = objectMapper.writeValueAsString(embedding.toArray());
            stringRedisTemplate.opsForValue().set(getKey(userId), json,
                properties.getEmbeddingCache().getTtlSeconds(), TimeUnit.SECONDS);
        } catch (Exception e) {
            log.warn("[EmbeddingCache] 写入缓存失败: userId={}, error={}", userId, e.getMessage());
        }
    }

    @Override
    public void evict(String userId) {
        try {
            stringRedisTemplate.delete(getKey(userId));
        } catch (Exception e) {
            log.warn("[EmbeddingCache] 清除缓存失败: userId={}, error={}", userId, e.getMessage());
        }
    }

    private String getKey(String userId) {
        return "user:embedding:" + userId;
    }
}
