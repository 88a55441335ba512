package com.example.hybridrec.ranking;

import com.example.hybridrec.candidate.Candidate;
import com.example.hybridrec.dto.ResourceMetadata;
import com.example.hybridrec.vector.VectorMath;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * 混合排序：五个分量加权求和
 *
 * quality / recency 来自资源元数据，缺失按 0 计
 */
@Component
@Slf4j
public class HybridRanker {

    public static final Comparator<Candidate> BY_SCORE_DESC =
        Comparator.comparingDouble(Candidate::getHybridScore).reversed()
            .thenComparing(Candidate::getResourceId);

    /**
     * 计算混合分数并按分数降序（同分按资源 ID 升序）返回新列表
     */
    public List<Candidate> rank(List<Candidate> candidates, RankingWeights weights) {
        List<Candidate> ranked = new ArrayList<>(candidates.size());
        for (Candidate candidate : candidates) {
            ResourceMetadata meta = candidate.getMetadata();
            candidate.getComponentScores().put(RankingWeights.QUALITY,
                meta != null ? unit(meta.getQualityScore()) : 0.0);
            candidate.getComponentScores().put(RankingWeights.RECENCY,
                meta != null ? unit(meta.getRecencyScore()) : 0.0);

            double score = 0.0;
            for (String component : RankingWeights.COMPONENTS) {
                score += weights.weightOf(component) * candidate.componentScore(component);
            }
            candidate.setHybridScore(score);
            ranked.add(candidate);
        }
        ranked.sort(BY_SCORE_DESC);

        if (!ranked.isEmpty()) {
            log.debug("[Ranker] 排序完成: candidates={}, top={}, topScore={}",
                ranked.size(), ranked.get(0).getResourceId(), ranked.get(0).getHybridScore());
        }
        return ranked;
    }

    private static double unit(Double value) {
        return value != null ? VectorMath.clamp(value, 0.0, 1.0) : 0.0;
    }
}
