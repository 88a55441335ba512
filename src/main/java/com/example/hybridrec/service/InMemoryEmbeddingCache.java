package com.example.hybridrec.service;

import com.example.hybridrec.config.RecommendationProperties;
import com.example.hybridrec.vector.EmbeddingVector;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.LongSupplier;

/**
 * 进程内 embedding 缓存（单节点部署 / 测试）
 */
@Service
@ConditionalOnProperty(name = "recommendation.embedding-cache.type", havingValue = "memory", matchIfMissing = true)
@Slf4j
public class InMemoryEmbeddingCache implements EmbeddingCache {

    private final Map<String, CachedEmbedding> entries = new ConcurrentHashMap<>();
    private final long ttlMillis;
    private final LongSupplier clock;

    @Autowired
    public InMemoryEmbeddingCache(RecommendationProperties properties) {
        this(properties.getEmbeddingCache().getTtlSeconds() * 1000, System::currentTimeMillis);
    }

    InMemoryEmbeddingCache(long ttlMillis, LongSupplier clock) {
        this.ttlMillis = ttlMillis;
        this.clock = clock;
    }

    @Override
    public Optional<EmbeddingVector> get(String userId) {
        CachedEmbedding cached = entries.get(userId);
        if (cached == null) {
            return Optional.empty();
        }
        if (clock.getAsLong() - cached.storedAt >= ttlMillis) {
            // 只删除读到的这一条，避免误删并发写入的新值
            entries.remove(userId, cached);
            log.debug("[EmbeddingCache] 缓存过期: userId={}", userId);
            return Optional.empty();
        }
        return Optional.of(cached.embedding);
    }

    @Override
    public void put(String userId, EmbeddingVector embedding) {
        entries.put(userId, new CachedEmbedding(embedding, clock.getAsLong()));
    }

    @Override
    public void evict(String userId) {
        if (entries.remove(userId) != null) {
            log.debug("[EmbeddingCache] 清除缓存: userId={}", userId);
        }
    }

    private static final class CachedEmbedding {
        private final EmbeddingVector embedding;
        private final long storedAt;

        private CachedEmbedding(EmbeddingVector embedding, long storedAt) {
            this.embedding = embedding;
            this.storedAt = storedAt;
        }
    }
}
