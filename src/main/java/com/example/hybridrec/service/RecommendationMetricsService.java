package com.example.hybridrec.service;

import com.example.hybridrec.dto.CtrReport;
import com.example.hybridrec.dto.StrategyCtrRow;
import com.example.hybridrec.mapper.RecommendationFeedbackMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.TreeMap;

/**
 * 推荐质量指标
 *
 * 1. Gini 系数：分数集中度（越小越均衡）
 * 2. CTR：窗口期内点击 / 曝光，总体与按策略
 * 3. 新颖度占比：不在高曝光四分位中的推荐占比
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RecommendationMetricsService {

    private final RecommendationFeedbackMapper feedbackMapper;

    /**
     * G = 2·Σ(i·x_i) / (n·Σx) − (n+1)/n，x 升序，i 从 1 开始；空集或总和为 0 时为 0
     */
    public double computeGiniCoefficient(Collection<Double> scores) {
        if (scores == null || scores.isEmpty()) {
            return 0.0;
        }
        double[] values = scores.stream()
            .mapToDouble(v -> v == null || !Double.isFinite(v) ? 0.0 : Math.max(0.0, v))
            .toArray();
        Arrays.sort(values);

        int n = values.length;
        double sum = 0.0;
        double weighted = 0.0;
        for (int i = 0; i < n; i++) {
            sum += values[i];
            weighted += (i + 1) * values[i];
        }
        if (sum <= 0.0) {
            return 0.0;
        }
        double gini = 2.0 * weighted / (n * sum) - (n + 1.0) / n;
        return Math.max(0.0, gini);
    }

    public CtrReport computeCtr(String userId, int windowDays) {
        LocalDateTime since = LocalDateTime.now().minusDays(windowDays);
        List<StrategyCtrRow> rows = feedbackMapper.aggregateByStrategy(userId, since);

        long impressions = 0;
        long clicks = 0;
        TreeMap<String, Double> byStrategy = new TreeMap<>();
        for (StrategyCtrRow row : rows) {
            long rowImpressions = row.getImpressions() != null ? row.getImpressions() : 0;
            long rowClicks = row.getClicks() != null ? row.getClicks() : 0;
            impressions += rowImpressions;
            clicks += rowClicks;
            if (row.getStrategy() != null) {
                byStrategy.put(row.getStrategy(), rowImpressions > 0 ? (double) rowClicks / rowImpressions : 0.0);
            }
        }

        double ctr = impressions > 0 ? (double) clicks / impressions : 0.0;
        log.debug("[Metrics] CTR: userId={}, windowDays={}, impressions={}, clicks={}", userId, windowDays, impressions, clicks);
        return CtrReport.builder()
            .userId(userId)
            .windowDays(windowDays)
            .impressions(impressions)
            .clicks(clicks)
            .ctr(ctr)
            .ctrByStrategy(byStrategy)
            .build();
    }

    /**
     * 推荐结果中不属于高曝光四分位的比例；空列表为 0
     */
    public double computeNoveltyRatio(List<String> recommendedIds, Set<String> topViewedIds) {
        if (recommendedIds == null || recommendedIds.isEmpty()) {
            return 0.0;
        }
        long novel = recommendedIds.stream()
            .filter(id -> topViewedIds == null || !topViewedIds.contains(id))
            .count();
        return (double) novel / recommendedIds.size();
    }
}
