package com.example.hybridrec.service;

import com.example.hybridrec.client.ResourceMetadataClient;
import com.example.hybridrec.config.RecommendationProperties;
import com.example.hybridrec.dto.ResourceMetadata;
import com.example.hybridrec.entity.UserInteraction;
import com.example.hybridrec.mapper.UserInteractionMapper;
import com.example.hybridrec.mapper.UserProfileMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 偏好学习服务
 *
 * 从近期正向交互中统计作者出现频次，取 Top N 写回画像的 preferredAuthors。
 * 尽力而为：任何失败只记日志，原有列表保持不变
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PreferenceLearningService {

    private final UserInteractionMapper interactionMapper;
    private final UserProfileMapper profileMapper;
    private final ResourceMetadataClient metadataClient;
    private final DistributedLockService lockService;
    private final UserProfileService profileService;
    private final RecommendationProperties properties;

    /**
     * 在独立事务中执行，交互写入提交之后调用也能落库
     *
     * @return 是否更新了 preferredAuthors
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public boolean learnPreferences(String userId) {
        try {
            return lockService.executeWithLock("preference:" + userId, () -> doLearn(userId), false);
        } catch (Exception e) {
            log.error("[Learning] 偏好学习失败: userId={}", userId, e);
            return false;
        }
    }

    private boolean doLearn(String userId) {
        RecommendationProperties.Learning config = properties.getLearning();
        LocalDateTime since = LocalDateTime.now().minusDays(config.getLookbackDays());

        List<UserInteraction> positives = interactionMapper.findPositiveSince(userId, since, config.getMaxRecords());
        if (positives.isEmpty()) {
            log.debug("[Learning] 窗口内无正向交互: userId={}", userId);
            return false;
        }

        Set<String> resourceIds = positives.stream()
            .map(UserInteraction::getResourceId)
            .collect(Collectors.toCollection(LinkedHashSet::new));
        Map<String, ResourceMetadata> metadata = metadataClient.getMetadata(resourceIds);

        Map<String, Integer> authorCounts = new HashMap<>();
        for (UserInteraction interaction : positives) {
            ResourceMetadata meta = metadata.get(interaction.getResourceId());
            if (meta == null || meta.getAuthors() == null) {
                continue;
            }
            for (String author : meta.getAuthors()) {
                if (author != null && !author.isBlank()) {
                    authorCounts.merge(author.trim(), 1, Integer::sum);
                }
            }
        }
        if (authorCounts.isEmpty()) {
            log.debug("[Learning] 未统计到作者，保留原偏好: userId={}", userId);
            return false;
        }

        List<String> topAuthors = authorCounts.entrySet().stream()
            .sorted(Map.Entry.<String, Integer>comparingByValue(Comparator.reverseOrder())
                .thenComparing(Map.Entry.comparingByKey()))
            .limit(config.getTopAuthors())
            .map(Map.Entry::getKey)
            .collect(Collectors.toCollection(ArrayList::new));

        profileMapper.updatePreferredAuthors(userId, profileService.writeJson(topAuthors), LocalDateTime.now());
        log.info("[Learning] 更新偏好作者: userId={}, interactions={}, authors={}",
            userId, positives.size(), topAuthors);
        return true;
    }
}
