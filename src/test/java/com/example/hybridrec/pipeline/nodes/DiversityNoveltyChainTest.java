package com.example.hybridrec.pipeline.nodes;

import com.example.hybridrec.candidate.Candidate;
import com.example.hybridrec.config.RecommendationProperties;
import com.example.hybridrec.context.RecommendationContext;
import com.example.hybridrec.dto.ResourceMetadata;
import com.example.hybridrec.ranking.DiversityOptimizer;
import com.example.hybridrec.ranking.NoveltyBooster;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class DiversityNoveltyChainTest {

    private final DiversityOptimizer optimizer = new DiversityOptimizer();
    private final DiversityRerankNode rerankNode = new DiversityRerankNode(optimizer, 2);
    private final NoveltyBoostNode noveltyNode = new NoveltyBoostNode(new NoveltyBooster(new RecommendationProperties()));

    @Test
    void servedListIsTheMmrSelection() {
        List<Candidate> pool = List.of(
            candidate("a", 0.9, 10, 1, 0),
            candidate("b", 0.85, 10, 1, 0),
            candidate("c", 0.7, 10, 0, 1),
            candidate("d", 0.6, 10, 0, 1));
        List<String> mmr = ids(optimizer.rerank(copyOf(pool), 0.3, 2));

        RecommendationContext ctx = context(copyOf(pool), 0.3, 2);
        rerankNode.execute(ctx);
        noveltyNode.execute(ctx);

        assertEquals(List.of("a", "c"), mmr);
        assertEquals(mmr, ids(ctx.getResults()));
        assertTrue(ctx.isDiversityApplied());
    }

    @Test
    void floorSwapDrawsFromMmrSurplus() {
        // λ = 1 时 MMR 顺序即分数顺序；浏览量前 ⌈8/4⌉ = 2 个为 a、b
        List<Candidate> pool = List.of(
            candidate("a", 0.9, 500, 1, 0),
            candidate("b", 0.85, 400, 0, 1),
            candidate("c", 0.7, 5, 1, 1),
            candidate("d", 0.6, 1, 1, -1),
            candidate("e", 0.5, 3, 1, 0),
            candidate("f", 0.4, 2, 0, 1),
            candidate("g", 0.3, 4, 1, 1),
            candidate("h", 0.2, 6, 1, -1));

        RecommendationContext ctx = context(new ArrayList<>(pool), 1.0, 2);
        ctx.setNoveltyPreference(1.0);
        rerankNode.execute(ctx);
        noveltyNode.execute(ctx);

        // 下限 ⌈0.2·2⌉ = 1：c 顶替分数最低的高浏览量项 b
        assertEquals(List.of("a", "c"), ids(ctx.getResults()));
        assertTrue(ctx.isNoveltyApplied());
        assertFalse(ctx.isDiversityApplied());
    }

    private static RecommendationContext context(List<Candidate> candidates, double lambda, int limit) {
        RecommendationContext ctx = new RecommendationContext();
        ctx.setUserId("u1");
        ctx.setLimit(limit);
        ctx.setDiversityPreference(lambda);
        ctx.setNoveltyPreference(0.3);
        ctx.setCandidates(candidates);
        return ctx;
    }

    private static Candidate candidate(String id, double score, long views, double... embedding) {
        List<Double> values = new ArrayList<>();
        for (double v : embedding) {
            values.add(v);
        }
        Candidate c = new Candidate(id);
        c.setHybridScore(score);
        c.setViewCount(views);
        c.setMetadata(ResourceMetadata.builder().resourceId(id).embedding(values).viewCount(views).build());
        return c;
    }

    private static List<Candidate> copyOf(List<Candidate> pool) {
        return pool.stream()
            .map(c -> candidate(c.getResourceId(), c.getHybridScore(), c.getViewCount(),
                c.getMetadata().getEmbedding().stream().mapToDouble(Double::doubleValue).toArray()))
            .collect(Collectors.toList());
    }

    private static List<String> ids(List<Candidate> candidates) {
        return candidates.stream().map(Candidate::getResourceId).collect(Collectors.toList());
    }
}
