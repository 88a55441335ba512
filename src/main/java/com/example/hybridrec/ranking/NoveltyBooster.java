package com.example.hybridrec.ranking;

import com.example.hybridrec.candidate.Candidate;
import com.example.hybridrec.config.RecommendationProperties;
import com.example.hybridrec.vector.VectorMath;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 新颖度加成
 *
 * 1. novelty = clamp(1 − views / median, 0, 1)
 * 2. novelty 高于用户新颖度偏好时，hybrid *= 1 + boostFactor·novelty
 * 3. 按 MMR 顺序取前 limit 个，并保证至少 ⌈floorRatio·limit⌉ 个不在浏览量前 1/4；
 *    替换进来的候选占据被替换者的位置
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class NoveltyBooster {

    private final RecommendationProperties properties;

    public NoveltyResult apply(List<Candidate> pool, double noveltyPreference, int limit) {
        if (pool == null || pool.isEmpty() || limit <= 0) {
            return NoveltyResult.builder().items(new ArrayList<>()).topViewedIds(Set.of()).applied(false).build();
        }
        RecommendationProperties.Novelty config = properties.getNovelty();

        // ==================== 1. 新颖度与加成 ====================
        double median = medianViews(pool);
        boolean applied = false;
        for (Candidate candidate : pool) {
            double novelty = noveltyOf(candidate.getViewCount(), median);
            candidate.setNoveltyScore(novelty);
            if (novelty > noveltyPreference) {
                candidate.setHybridScore(candidate.getHybridScore() * (1 + config.getBoostFactor() * novelty));
                applied = true;
            }
        }

        // ==================== 2. 截取 ====================
        // 入参为 MMR 输出顺序，前 limit 个即下发集合，其余仅作为替换备选
        Set<String> topViewed = topViewedQuartile(pool);
        int size = Math.min(limit, pool.size());
        List<Candidate> selected = new ArrayList<>(pool.subList(0, size));
        List<Candidate> reserve = new ArrayList<>(pool.subList(size, pool.size()));

        // ==================== 3. 新颖度下限 ====================
        int floor = (int) Math.ceil(config.getFloorRatio() * limit);
        long novelSelected = selected.stream().filter(c -> !topViewed.contains(c.getResourceId())).count();
        int swaps = 0;
        while (novelSelected < floor) {
            // 降序比较器下 min 为分数最高者，max 为分数最低者
            Candidate incoming = reserve.stream()
                .filter(c -> !topViewed.contains(c.getResourceId()))
                .min(HybridRanker.BY_SCORE_DESC)
                .orElse(null);
            Candidate outgoing = selected.stream()
                .filter(c -> topViewed.contains(c.getResourceId()))
                .max(HybridRanker.BY_SCORE_DESC)
                .orElse(null);
            if (incoming == null || outgoing == null) {
                break;
            }
            selected.set(selected.indexOf(outgoing), incoming);
            reserve.remove(incoming);
            novelSelected++;
            swaps++;
        }
        if (swaps > 0) {
            applied = true;
            log.debug("[Novelty] 新颖度下限替换: swaps={}, floor={}", swaps, floor);
        }

        log.debug("[Novelty] 完成: pool={}, output={}, median={}, applied={}", pool.size(), selected.size(), median, applied);
        return NoveltyResult.builder().items(selected).topViewedIds(topViewed).applied(applied).build();
    }

    /**
     * 浏览量前 ⌈n/4⌉ 的资源（浏览量降序，同量按资源 ID 升序）
     */
    public Set<String> topViewedQuartile(List<Candidate> pool) {
        int quartile = (int) Math.ceil(pool.size() / 4.0);
        return pool.stream()
            .sorted(Comparator.comparingLong(Candidate::getViewCount).reversed()
                .thenComparing(Candidate::getResourceId))
            .limit(quartile)
            .map(Candidate::getResourceId)
            .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    static double noveltyOf(long views, double median) {
        if (median <= 0) {
            return views == 0 ? 1.0 : 0.0;
        }
        return VectorMath.clamp(1.0 - views / median, 0.0, 1.0);
    }

    static double medianViews(List<Candidate> pool) {
        long[] views = pool.stream().mapToLong(Candidate::getViewCount).toArray();
        Arrays.sort(views);
        int n = views.length;
        if (n % 2 == 1) {
            return views[n / 2];
        }
        return (views[n / 2 - 1] + views[n / 2]) / 2.0;
    }
}
