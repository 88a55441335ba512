package com.example.hybridrec.service;

import com.example.hybridrec.config.RecommendationProperties;
import com.example.hybridrec.dto.InteractionContext;
import com.example.hybridrec.entity.InteractionType;
import com.example.hybridrec.entity.UserInteraction;
import com.example.hybridrec.entity.UserProfile;
import com.example.hybridrec.mapper.UserInteractionMapper;
import com.example.hybridrec.mapper.UserProfileMapper;
import com.example.hybridrec.vector.VectorMath;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.time.LocalDateTime;

/**
 * 交互记录服务
 *
 * 功能：
 * 1. 按交互类型与上下文计算交互强度
 * 2. 同一 (user, resource) 去重：累加 returnVisits，强度取历史最大值
 * 3. 维护画像计数，每 N 次交互触发一次偏好学习（事务提交后执行，尽力而为）
 * 4. 正向交互使用户 embedding 缓存失效
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class InteractionService {

    private static final int NEUTRAL_RATING = 3;

    private final UserInteractionMapper interactionMapper;
    private final UserProfileMapper profileMapper;
    private final UserProfileService profileService;
    private final PreferenceLearningService preferenceLearningService;
    private final EmbeddingCache embeddingCache;
    private final RecommendationProperties properties;

    /**
     * 记录一次交互
     *
     * @throws com.example.hybridrec.exception.InvalidInteractionTypeException 交互类型不在允许集合内
     */
    @Transactional
    public UserInteraction trackInteraction(String userId, String resourceId, String interactionType,
                                            InteractionContext context) {
        InteractionType type = InteractionType.fromValue(interactionType);
        InteractionContext ctx = context != null ? context : InteractionContext.empty();
        double strength = computeStrength(type, ctx);
        LocalDateTime now = LocalDateTime.now();

        UserInteraction interaction = interactionMapper.findByUserAndResource(userId, resourceId);
        if (interaction == null) {
            interaction = UserInteraction.builder()
                .userId(userId)
                .resourceId(resourceId)
                .interactionType(type.getValue())
                .interactionStrength(strength)
                .isPositive(strength > UserInteraction.POSITIVE_THRESHOLD)
                .returnVisits(0)
                .dwellTime(ctx.getDwellTime())
                .scrollDepth(ctx.getScrollDepth())
                .rating(ctx.getRating())
                .sessionId(ctx.getSessionId())
                .confidence(type.getConfidence())
                .interactionTimestamp(now)
                .createdAt(now)
                .updatedAt(now)
                .build();
            try {
                interactionMapper.insert(interaction);
                log.info("[Interaction] 新增交互: userId={}, resourceId={}, type={}, strength={}",
                    userId, resourceId, type.getValue(), strength);
            } catch (DuplicateKeyException e) {
                // 并发写入同一 (user, resource)，按重复交互处理
                interaction = interactionMapper.findByUserAndResource(userId, resourceId);
                applyRepeat(interaction, type, strength, ctx, now);
            }
        } else {
            applyRepeat(interaction, type, strength, ctx, now);
        }

        // ==================== 画像计数 ====================
        profileService.getOrCreateProfile(userId);
        profileMapper.incrementInteractions(userId, now);
        UserProfile profile = profileMapper.findByUserId(userId);
        int total = profile != null && profile.getTotalInteractions() != null ? profile.getTotalInteractions() : 0;

        int interval = properties.getLearning().getInterval();
        if (interval > 0 && total > 0 && total % interval == 0) {
            log.info("[Interaction] 触发偏好学习: userId={}, totalInteractions={}", userId, total);
            learnAfterCommit(userId);
        }

        if (Boolean.TRUE.equals(interaction.getIsPositive())) {
            embeddingCache.evict(userId);
        }
        return interaction;
    }

    /**
     * 交互强度 [0, 1]
     *
     * view：0.1 基础分 + 停留时长（每秒 0.001，最多 0.3）+ 0.1 * 滚动深度，上限 0.5
     * rating：评分 / 5，缺省按 3 星
     */
    public double computeStrength(InteractionType type, InteractionContext ctx) {
        switch (type) {
            case VIEW: {
                double dwell = ctx.getDwellTime() != null ? Math.max(0, ctx.getDwellTime()) : 0;
                double scroll = ctx.getScrollDepth() != null ? VectorMath.clamp(ctx.getScrollDepth(), 0.0, 1.0) : 0.0;
                return Math.min(0.5, 0.1 + Math.min(0.3, dwell / 1000.0) + 0.1 * scroll);
            }
            case RATING: {
                int rating = ctx.getRating() != null ? ctx.getRating() : NEUTRAL_RATING;
                return VectorMath.clamp(rating / 5.0, 0.0, 1.0);
            }
            default:
                return type.getBaseStrength();
        }
    }

    // 偏好学习涉及分布式锁与外部调用，不占用交互写入的事务
    private void learnAfterCommit(String userId) {
        if (!TransactionSynchronizationManager.isSynchronizationActive()) {
            preferenceLearningService.learnPreferences(userId);
            return;
        }
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCommit() {
                preferenceLearningService.learnPreferences(userId);
            }
        });
    }

    private void applyRepeat(UserInteraction interaction, InteractionType type, double strength,
                             InteractionContext ctx, LocalDateTime now) {
        int visits = interaction.getReturnVisits() != null ? interaction.getReturnVisits() : 0;
        interaction.setReturnVisits(visits + 1);

        double previous = interaction.getInteractionStrength() != null ? interaction.getInteractionStrength() : 0.0;
        if (strength > previous) {
            interaction.setInteractionStrength(strength);
            interaction.setInteractionType(type.getValue());
            interaction.setConfidence(type.getConfidence());
        }
        interaction.setIsPositive(interaction.getInteractionStrength() > UserInteraction.POSITIVE_THRESHOLD);

        if (ctx.getDwellTime() != null) {
            interaction.setDwellTime(ctx.getDwellTime());
        }
        if (ctx.getScrollDepth() != null) {
            interaction.setScrollDepth(ctx.getScrollDepth());
        }
        if (ctx.getRating() != null) {
            interaction.setRating(ctx.getRating());
        }
        if (ctx.getSessionId() != null) {
            interaction.setSessionId(ctx.getSessionId());
        }
        interaction.setInteractionTimestamp(now);
        interaction.setUpdatedAt(now);

        interactionMapper.updateById(interaction);
        log.info("[Interaction] 重复交互: userId={}, resourceId={}, returnVisits={}, strength={} -> {}",
            interaction.getUserId(), interaction.getResourceId(), interaction.getReturnVisits(),
            previous, interaction.getInteractionStrength());
    }
}
