package com.example.hybridrec.service;

import com.example.hybridrec.client.ResourceMetadataClient;
import com.example.hybridrec.config.RecommendationProperties;
import com.example.hybridrec.dto.ResourceMetadata;
import com.example.hybridrec.entity.UserInteraction;
import com.example.hybridrec.mapper.UserInteractionMapper;
import com.example.hybridrec.vector.EmbeddingVector;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class UserEmbeddingServiceTest {

    private UserInteractionMapper interactionMapper;
    private ResourceMetadataClient metadataClient;
    private UserEmbeddingService service;

    @BeforeEach
    void setUp() {
        interactionMapper = mock(UserInteractionMapper.class);
        metadataClient = mock(ResourceMetadataClient.class);
        RecommendationProperties properties = new RecommendationProperties();
        properties.setEmbeddingDimension(3);
        EmbeddingCache cache = new InMemoryEmbeddingCache(properties);
        service = new UserEmbeddingService(interactionMapper, metadataClient, cache, properties);
    }

    @Test
    void coldStartUserGetsZeroVector() {
        when(interactionMapper.findRecentPositive(eq("new"), anyInt())).thenReturn(List.of());

        EmbeddingVector embedding = service.getUserEmbedding("new");

        assertTrue(embedding.isZero());
        assertEquals(3, embedding.dimension());
    }

    @Test
    void strengthWeightedAverageSkippingMalformedEmbeddings() {
        when(interactionMapper.findRecentPositive(eq("u1"), anyInt())).thenReturn(List.of(
            positive("r1", 1.0), positive("r2", 0.5), positive("r3", 0.9), positive("r4", 0.9)));
        when(metadataClient.getMetadata(any())).thenReturn(Map.of(
            "r1", meta("r1", Arrays.asList(1.0, 0.0, 0.0)),
            "r2", meta("r2", Arrays.asList(0.0, 1.0, 0.0)),
            "r3", meta("r3", Arrays.asList(Double.NaN, 1.0, 1.0)),
            "r4", meta("r4", Arrays.asList(1.0, 1.0))));

        EmbeddingVector embedding = service.getUserEmbedding("u1");

        assertEquals(2.0 / 3, embedding.get(0), 1e-9);
        assertEquals(1.0 / 3, embedding.get(1), 1e-9);
        assertEquals(0.0, embedding.get(2), 1e-9);
    }

    @Test
    void allEmbeddingsUnusableGivesZeroVector() {
        when(interactionMapper.findRecentPositive(eq("u2"), anyInt())).thenReturn(List.of(positive("r1", 0.8)));
        when(metadataClient.getMetadata(any())).thenReturn(Map.of("r1", meta("r1", null)));

        assertTrue(service.getUserEmbedding("u2").isZero());
    }

    @Test
    void cachedEmbeddingIsReused() {
        when(interactionMapper.findRecentPositive(eq("u3"), anyInt())).thenReturn(List.of());

        service.getUserEmbedding("u3");
        service.getUserEmbedding("u3");

        verify(interactionMapper, times(1)).findRecentPositive(eq("u3"), anyInt());
    }

    private static UserInteraction positive(String resourceId, double strength) {
        return UserInteraction.builder()
            .userId("u")
            .resourceId(resourceId)
            .interactionStrength(strength)
            .isPositive(true)
            .build();
    }

    private static ResourceMetadata meta(String id, List<Double> embedding) {
        return ResourceMetadata.builder().resourceId(id).embedding(embedding).build();
    }
}
