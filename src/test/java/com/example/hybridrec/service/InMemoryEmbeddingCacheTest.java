package com.example.hybridrec.service;

import com.example.hybridrec.vector.EmbeddingVector;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

public class InMemoryEmbeddingCacheTest {

    private final AtomicLong now = new AtomicLong(1_000_000L);
    private final InMemoryEmbeddingCache cache = new InMemoryEmbeddingCache(300_000L, now::get);

    @Test
    void returnsValueWithinTtl() {
        EmbeddingVector v = EmbeddingVector.of(new double[]{1, 2}, 2);
        cache.put("u1", v);
        now.addAndGet(299_999L);

        assertEquals(v, cache.get("u1").orElseThrow());
    }

    @Test
    void expiresLazilyOnRead() {
        cache.put("u1", EmbeddingVector.zero(2));
        now.addAndGet(300_000L);

        assertTrue(cache.get("u1").isEmpty());
    }

    @Test
    void evictRemovesEntry() {
        cache.put("u1", EmbeddingVector.zero(2));
        cache.evict("u1");

        assertTrue(cache.get("u1").isEmpty());
    }

    @Test
    void keysAreIndependent() {
        cache.put("u1", EmbeddingVector.zero(2));
        cache.evict("u2");

        assertTrue(cache.get("u1").isPresent());
    }
}
