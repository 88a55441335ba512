package com.example.hybridrec.service;

import com.example.hybridrec.dto.CtrReport;
import com.example.hybridrec.dto.StrategyCtrRow;
import com.example.hybridrec.mapper.RecommendationFeedbackMapper;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

public class RecommendationMetricsServiceTest {

    private final RecommendationFeedbackMapper feedbackMapper = mock(RecommendationFeedbackMapper.class);
    private final RecommendationMetricsService metrics = new RecommendationMetricsService(feedbackMapper);

    @Test
    void giniOfEmptyOrZeroSumIsZero() {
        assertEquals(0.0, metrics.computeGiniCoefficient(Collections.emptyList()));
        assertEquals(0.0, metrics.computeGiniCoefficient(List.of(0.0, 0.0, 0.0)));
    }

    @Test
    void giniOfEqualScoresIsZero() {
        assertEquals(0.0, metrics.computeGiniCoefficient(List.of(0.7, 0.7, 0.7, 0.7)), 1e-12);
    }

    @Test
    void giniOfConcentratedScores() {
        // 2·(4·1)/(4·1) − 5/4
        assertEquals(0.75, metrics.computeGiniCoefficient(List.of(0.0, 0.0, 1.0, 0.0)), 1e-12);
    }

    @Test
    void noveltyRatioCountsItemsOutsideTopViewed() {
        assertEquals(0.75, metrics.computeNoveltyRatio(List.of("a", "b", "c", "d"), Set.of("a")), 1e-12);
        assertEquals(0.0, metrics.computeNoveltyRatio(List.of(), Set.of("a")));
    }

    @Test
    void ctrOverallAndByStrategy() {
        when(feedbackMapper.aggregateByStrategy(eq("u1"), any())).thenReturn(List.of(
            new StrategyCtrRow("hybrid", 10L, 2L),
            new StrategyCtrRow("content", 5L, 0L)));

        CtrReport report = metrics.computeCtr("u1", 7);

        assertEquals(15, report.getImpressions());
        assertEquals(2, report.getClicks());
        assertEquals(2.0 / 15, report.getCtr(), 1e-12);
        assertEquals(0.2, report.getCtrByStrategy().get("hybrid"), 1e-12);
        assertEquals(0.0, report.getCtrByStrategy().get("content"), 1e-12);
    }

    @Test
    void ctrWithoutImpressionsIsZero() {
        when(feedbackMapper.aggregateByStrategy(eq("nobody"), any())).thenReturn(List.of());

        CtrReport report = metrics.computeCtr("nobody", 7);

        assertEquals(0.0, report.getCtr());
        assertTrue(report.getCtrByStrategy().isEmpty());
    }
}
