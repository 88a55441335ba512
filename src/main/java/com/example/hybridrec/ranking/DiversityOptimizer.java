package com.example.hybridrec.ranking;

import com.example.hybridrec.candidate.Candidate;
import com.example.hybridrec.vector.VectorMath;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * MMR 多样性重排
 *
 * MMR(c) = λ·rel(c) − (1−λ)·max_{s∈已选} sim(c, s)
 * rel 为混合分数的 min-max 归一化（全部相同时为 1），sim 为资源 embedding 余弦相似度
 */
@Component
@Slf4j
public class DiversityOptimizer {

    private static final double TIE_EPSILON = 1e-12;

    /**
     * @param ranked     已按混合分数排序的候选
     * @param lambda     相关性权重 [0, 1]，1 为纯相关性，0 为纯多样性
     * @param outputSize 输出数量上限
     */
    public List<Candidate> rerank(List<Candidate> ranked, double lambda, int outputSize) {
        if (ranked == null || ranked.isEmpty() || outputSize <= 0) {
            return Collections.emptyList();
        }
        double l = VectorMath.clamp(lambda, 0.0, 1.0);
        int n = ranked.size();
        int k = Math.min(n, outputSize);

        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (Candidate c : ranked) {
            min = Math.min(min, c.getHybridScore());
            max = Math.max(max, c.getHybridScore());
        }
        double range = max - min;

        double[] relevance = new double[n];
        double[][] embeddings = new double[n][];
        for (int i = 0; i < n; i++) {
            Candidate c = ranked.get(i);
            relevance[i] = range > 0 ? (c.getHybridScore() - min) / range : 1.0;
            embeddings[i] = embeddingOf(c);
        }

        // 每个候选与已选集合的最大相似度，增量维护
        double[] maxSim = new double[n];
        boolean[] taken = new boolean[n];
        List<Candidate> selected = new ArrayList<>(k);

        for (int step = 0; step < k; step++) {
            int best = -1;
            double bestScore = Double.NEGATIVE_INFINITY;
            for (int i = 0; i < n; i++) {
                if (taken[i]) {
                    continue;
                }
                double mmr = l * relevance[i] - (1 - l) * maxSim[i];
                if (best < 0 || mmr > bestScore + TIE_EPSILON
                    || (Math.abs(mmr - bestScore) <= TIE_EPSILON && preferOnTie(ranked.get(i), ranked.get(best)))) {
                    best = i;
                    bestScore = mmr;
                }
            }
            taken[best] = true;
            selected.add(ranked.get(best));

            for (int i = 0; i < n; i++) {
                if (!taken[i]) {
                    maxSim[i] = Math.max(maxSim[i], similarity(embeddings[best], embeddings[i]));
                }
            }
        }

        log.debug("[MMR] 重排完成: pool={}, output={}, lambda={}", n, selected.size(), l);
        return selected;
    }

    /**
     * 同 MMR 分数时：混合分数高者优先，再按资源 ID 升序
     */
    private static boolean preferOnTie(Candidate challenger, Candidate incumbent) {
        int byScore = Double.compare(challenger.getHybridScore(), incumbent.getHybridScore());
        if (byScore != 0) {
            return byScore > 0;
        }
        return challenger.getResourceId().compareTo(incumbent.getResourceId()) < 0;
    }

    private static double similarity(double[] a, double[] b) {
        if (a == null || b == null) {
            return 0.0;
        }
        return VectorMath.cosine(a, b);
    }

    private static double[] embeddingOf(Candidate candidate) {
        if (candidate.getMetadata() == null || candidate.getMetadata().getEmbedding() == null) {
            return null;
        }
        List<Double> raw = candidate.getMetadata().getEmbedding();
        double[] values = new double[raw.size()];
        for (int i = 0; i < values.length; i++) {
            Double v = raw.get(i);
            values[i] = v != null ? v : Double.NaN;
        }
        return values;
    }
}
