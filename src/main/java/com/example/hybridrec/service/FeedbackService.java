package com.example.hybridrec.service;

import com.example.hybridrec.dto.FeedbackRequest;
import com.example.hybridrec.dto.RecommendationItem;
import com.example.hybridrec.entity.RecommendationFeedback;
import com.example.hybridrec.mapper.RecommendationFeedbackMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 推荐反馈服务 - 曝光记录与点击/显式反馈
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class FeedbackService {

    static final String DEFAULT_STRATEGY = "hybrid";

    private final RecommendationFeedbackMapper feedbackMapper;

    /**
     * 为每个下发的推荐项写入一条曝光记录
     */
    @Transactional
    public void recordImpressions(String userId, String strategy, List<RecommendationItem> items) {
        LocalDateTime now = LocalDateTime.now();
        for (RecommendationItem item : items) {
            RecommendationFeedback row = RecommendationFeedback.builder()
                .userId(userId)
                .resourceId(item.getResourceId())
                .recommendationStrategy(strategy)
                .recommendationScore(item.getHybridScore())
                .rankPosition(item.getRank())
                .wasClicked(false)
                .recommendedAt(now)
                .build();
            feedbackMapper.insert(row);
        }
        log.debug("[Feedback] 记录曝光: userId={}, strategy={}, items={}", userId, strategy, items.size());
    }

    /**
     * 更新最近一次曝光的反馈；没有曝光记录时新建一行
     */
    @Transactional
    public RecommendationFeedback submitFeedback(String userId, FeedbackRequest request) {
        LocalDateTime now = LocalDateTime.now();
        RecommendationFeedback row = feedbackMapper.findLatest(userId, request.getResourceId());

        if (row == null) {
            row = RecommendationFeedback.builder()
                .userId(userId)
                .resourceId(request.getResourceId())
                .recommendationStrategy(DEFAULT_STRATEGY)
                .recommendationScore(0.0)
                .rankPosition(0)
                .wasClicked(Boolean.TRUE.equals(request.getWasClicked()))
                .wasUseful(request.getWasUseful())
                .feedbackNotes(request.getNotes())
                .recommendedAt(now)
                .feedbackAt(now)
                .build();
            feedbackMapper.insert(row);
            log.info("[Feedback] 无曝光记录，新建反馈: userId={}, resourceId={}", userId, request.getResourceId());
            return row;
        }

        if (request.getWasClicked() != null) {
            row.setWasClicked(request.getWasClicked());
        }
        if (request.getWasUseful() != null) {
            row.setWasUseful(request.getWasUseful());
        }
        if (request.getNotes() != null) {
            row.setFeedbackNotes(request.getNotes());
        }
        row.setFeedbackAt(now);
        feedbackMapper.updateById(row);

        log.info("[Feedback] 更新反馈: userId={}, resourceId={}, clicked={}, useful={}",
            userId, request.getResourceId(), row.getWasClicked(), row.getWasUseful());
        return row;
    }
}
