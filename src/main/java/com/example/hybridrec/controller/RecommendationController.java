package com.example.hybridrec.controller;

import com.example.hybridrec.dto.CtrReport;
import com.example.hybridrec.dto.FeedbackRequest;
import com.example.hybridrec.dto.RecommendationQuery;
import com.example.hybridrec.dto.RecommendationResponse;
import com.example.hybridrec.entity.RecommendationFeedback;
import com.example.hybridrec.service.FeedbackService;
import com.example.hybridrec.service.RecommendationMetricsService;
import com.example.hybridrec.service.RecommendationService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * 推荐接口
 */
@RestController
@RequestMapping("/api/recommendations")
@RequiredArgsConstructor
@Validated
@Slf4j
public class RecommendationController {

    private final RecommendationService recommendationService;
    private final FeedbackService feedbackService;
    private final RecommendationMetricsService metricsService;

    @GetMapping
    public ResponseEntity<RecommendationResponse> recommend(
            @RequestParam @NotBlank String userId,
            @RequestParam(defaultValue = "20") @Min(1) @Max(100) int limit,
            @RequestParam(defaultValue = "hybrid") String strategy,
            @RequestParam(required = false) Double diversity,
            @RequestParam(required = false) Double minQuality) {
        log.info("[REST API] 推荐请求: userId={}, limit={}, strategy={}", userId, limit, strategy);

        RecommendationQuery query = RecommendationQuery.builder()
            .limit(limit)
            .strategy(strategy)
            .diversity(diversity)
            .minQuality(minQuality)
            .build();
        return ResponseEntity.ok(recommendationService.generateRecommendations(userId, query));
    }

    @PostMapping("/feedback")
    public ResponseEntity<RecommendationFeedback> feedback(@Valid @RequestBody FeedbackRequest request) {
        log.info("[REST API] 推荐反馈: userId={}, resourceId={}", request.getUserId(), request.getResourceId());
        return ResponseEntity.ok(feedbackService.submitFeedback(request.getUserId(), request));
    }

    @GetMapping("/metrics")
    public ResponseEntity<CtrReport> metrics(
            @RequestParam @NotBlank String userId,
            @RequestParam(defaultValue = "7") @Min(1) @Max(365) int windowDays) {
        return ResponseEntity.ok(metricsService.computeCtr(userId, windowDays));
    }
}
