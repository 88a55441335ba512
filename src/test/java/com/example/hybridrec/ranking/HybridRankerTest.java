package com.example.hybridrec.ranking;

import com.example.hybridrec.candidate.Candidate;
import com.example.hybridrec.config.RecommendationProperties;
import com.example.hybridrec.dto.ResourceMetadata;
import com.example.hybridrec.exception.InvalidRankingWeightsException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class HybridRankerTest {

    private final HybridRanker ranker = new HybridRanker();
    private final RankingWeights defaults = RankingWeights.defaults(new RecommendationProperties().getRanking());

    @Test
    void weightedSumOfAllComponents() {
        Candidate c = new Candidate("r1");
        c.getComponentScores().put(RankingWeights.COLLABORATIVE, 0.8);
        c.getComponentScores().put(RankingWeights.CONTENT, 0.6);
        c.setMetadata(ResourceMetadata.builder().resourceId("r1").qualityScore(0.5).recencyScore(1.0).build());

        List<Candidate> ranked = ranker.rank(List.of(c), defaults);

        // 0.35*0.8 + 0.30*0.6 + 0.20*0 + 0.10*0.5 + 0.05*1.0
        assertEquals(0.56, ranked.get(0).getHybridScore(), 1e-9);
        assertEquals(0.5, ranked.get(0).componentScore(RankingWeights.QUALITY));
    }

    @Test
    void missingMetadataCountsAsZero() {
        Candidate c = new Candidate("r1");
        c.getComponentScores().put(RankingWeights.GRAPH, 1.0);

        List<Candidate> ranked = ranker.rank(List.of(c), defaults);

        assertEquals(0.20, ranked.get(0).getHybridScore(), 1e-9);
        assertEquals(0.0, ranked.get(0).componentScore(RankingWeights.QUALITY));
        assertEquals(0.0, ranked.get(0).componentScore(RankingWeights.RECENCY));
    }

    @Test
    void sortsByScoreThenResourceId() {
        Candidate b = new Candidate("b");
        b.getComponentScores().put(RankingWeights.CONTENT, 0.5);
        Candidate a = new Candidate("a");
        a.getComponentScores().put(RankingWeights.CONTENT, 0.5);
        Candidate top = new Candidate("z");
        top.getComponentScores().put(RankingWeights.CONTENT, 0.9);

        List<Candidate> ranked = ranker.rank(List.of(b, a, top), defaults);

        assertEquals(List.of("z", "a", "b"), ranked.stream().map(Candidate::getResourceId).collect(Collectors.toList()));
    }

    @Test
    void profileOverrideReplacesDefaults() {
        RankingWeights contentOnly = RankingWeights.of(Map.of(
            "collaborative", 0.0, "content", 1.0, "graph", 0.0, "quality", 0.0, "recency", 0.0));
        Candidate c = new Candidate("r1");
        c.getComponentScores().put(RankingWeights.CONTENT, 0.4);
        c.getComponentScores().put(RankingWeights.GRAPH, 1.0);

        assertEquals(0.4, ranker.rank(List.of(c), contentOnly).get(0).getHybridScore(), 1e-9);
    }

    @Test
    void overrideMustCoverAllComponentsAndSumToOne() {
        assertThrows(InvalidRankingWeightsException.class, () -> RankingWeights.of(Map.of("content", 1.0)));
        assertThrows(InvalidRankingWeightsException.class, () -> RankingWeights.of(Map.of(
            "collaborative", 0.5, "content", 0.5, "graph", 0.5, "quality", 0.0, "recency", 0.0)));
        assertThrows(InvalidRankingWeightsException.class, () -> RankingWeights.of(Map.of(
            "collaborative", -0.1, "content", 0.6, "graph", 0.3, "quality", 0.1, "recency", 0.1)));
        assertThrows(InvalidRankingWeightsException.class, () -> RankingWeights.of(Map.of(
            "collaborative", 0.2, "content", 0.2, "graph", 0.2, "quality", 0.2, "recency", 0.1, "popularity", 0.1)));
    }
}
