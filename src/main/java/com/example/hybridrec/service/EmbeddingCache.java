package com.example.hybridrec.service;

import com.example.hybridrec.vector.EmbeddingVector;

import java.util.Optional;

/**
 * 用户 embedding 缓存
 *
 * 由 recommendation.embedding-cache.type 选择实现（memory / redis）
 */
public interface EmbeddingCache {

    /**
     * 读取未过期的缓存，过期条目在读取时淘汰
     */
    Optional<EmbeddingVector> get(String userId);

    void put(String userId, EmbeddingVector embedding);

    void evict(String userId);
}
