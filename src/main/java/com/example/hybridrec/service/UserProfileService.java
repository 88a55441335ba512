package com.example.hybridrec.service;

import com.example.hybridrec.config.RecommendationProperties;
import com.example.hybridrec.dto.ProfileResponse;
import com.example.hybridrec.dto.ProfileUpdateRequest;
import com.example.hybridrec.entity.UserProfile;
import com.example.hybridrec.exception.InvalidInputListException;
import com.example.hybridrec.exception.InvalidPreferenceRangeException;
import com.example.hybridrec.mapper.UserProfileMapper;
import com.example.hybridrec.ranking.RankingWeights;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * 用户画像服务
 *
 * 功能：
 * 1. 画像懒创建（默认偏好）
 * 2. 偏好设置更新：全部校验通过后才写库，任一字段非法则画像保持不变
 * 3. JSON 列表字段的读写
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class UserProfileService {

    private static final int MAX_ENTRY_LENGTH = 255;
    private static final Pattern ENTRY_PATTERN = Pattern.compile("[A-Za-z0-9][A-Za-z0-9._:/-]*");

    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {};
    private static final TypeReference<Map<String, Double>> WEIGHT_MAP = new TypeReference<>() {};

    private final UserProfileMapper profileMapper;
    private final ObjectMapper objectMapper;
    private final RecommendationProperties properties;

    /**
     * 获取画像，不存在时以默认偏好创建
     */
    public UserProfile getOrCreateProfile(String userId) {
        UserProfile existing = profileMapper.findByUserId(userId);
        if (existing != null) {
            return existing;
        }

        LocalDateTime now = LocalDateTime.now();
        UserProfile profile = UserProfile.builder()
            .userId(userId)
            .diversityPreference(UserProfile.DEFAULT_DIVERSITY)
            .noveltyPreference(UserProfile.DEFAULT_NOVELTY)
            .recencyBias(UserProfile.DEFAULT_RECENCY)
            .researchDomains("[]")
            .excludedSources("[]")
            .preferredAuthors("[]")
            .totalInteractions(0)
            .createdAt(now)
            .updatedAt(now)
            .build();
        try {
            profileMapper.insert(profile);
            log.info("[Profile] 创建用户画像: userId={}", userId);
            return profile;
        } catch (DuplicateKeyException e) {
            // 并发创建，以已落库的为准
            log.debug("[Profile] 画像已被并发创建: userId={}", userId);
            return profileMapper.findByUserId(userId);
        }
    }

    /**
     * 更新偏好设置（null 字段不修改）
     *
     * @throws InvalidPreferenceRangeException 偏好标量不在 [0, 1]
     * @throws InvalidInputListException 列表条目无法清洗
     * @throws com.example.hybridrec.exception.InvalidRankingWeightsException 覆盖权重非法
     */
    @Transactional
    public UserProfile updateProfileSettings(String userId, ProfileUpdateRequest request) {
        // ==================== 1. 校验（不修改任何状态） ====================
        checkRange("diversityPreference", request.getDiversityPreference());
        checkRange("noveltyPreference", request.getNoveltyPreference());
        checkRange("recencyBias", request.getRecencyBias());

        List<String> excludedSources = request.getExcludedSources() != null
            ? sanitizeList("excludedSources", request.getExcludedSources()) : null;
        List<String> researchDomains = request.getResearchDomains() != null
            ? sanitizeList("researchDomains", request.getResearchDomains()) : null;
        String activeDomain = request.getActiveDomain() != null
            ? sanitizeEntry("activeDomain", request.getActiveDomain()) : null;

        // 空 map 表示清除覆盖，回到默认权重
        Map<String, Double> rankingWeights = null;
        if (request.getRankingWeights() != null && !request.getRankingWeights().isEmpty()) {
            rankingWeights = RankingWeights.of(request.getRankingWeights()).toMap();
        }

        // ==================== 2. 应用 ====================
        UserProfile profile = getOrCreateProfile(userId);

        if (request.getDiversityPreference() != null) {
            profile.setDiversityPreference(request.getDiversityPreference());
        }
        if (request.getNoveltyPreference() != null) {
            profile.setNoveltyPreference(request.getNoveltyPreference());
        }
        if (request.getRecencyBias() != null) {
            profile.setRecencyBias(request.getRecencyBias());
        }
        if (excludedSources != null) {
            profile.setExcludedSources(writeJson(excludedSources));
        }
        if (researchDomains != null) {
            profile.setResearchDomains(writeJson(researchDomains));
        }
        if (activeDomain != null) {
            profile.setActiveDomain(activeDomain);
        }
        if (rankingWeights != null) {
            profile.setRankingWeights(writeJson(rankingWeights));
        } else if (request.getRankingWeights() != null) {
            // updateById 会忽略 null 字段，清除覆盖时写入空对象
            profile.setRankingWeights("{}");
        }
        profile.setUpdatedAt(LocalDateTime.now());

        profileMapper.updateById(profile);
        log.info("[Profile] 更新偏好设置: userId={}, diversity={}, novelty={}, recency={}",
            userId, profile.getDiversityPreference(), profile.getNoveltyPreference(), profile.getRecencyBias());
        return profile;
    }

    /**
     * 画像中的排序权重，未覆盖时使用默认权重
     */
    public RankingWeights getRankingWeights(UserProfile profile) {
        Map<String, Double> override = readWeights(profile.getRankingWeights());
        if (override.isEmpty()) {
            return RankingWeights.defaults(properties.getRanking());
        }
        try {
            return RankingWeights.of(override);
        } catch (RuntimeException e) {
            log.warn("[Profile] 已存储的排序权重非法，回退默认: userId={}, error={}", profile.getUserId(), e.getMessage());
            return RankingWeights.defaults(properties.getRanking());
        }
    }

    public List<String> getExcludedSources(UserProfile profile) {
        return readList(profile.getExcludedSources());
    }

    public List<String> getPreferredAuthors(UserProfile profile) {
        return readList(profile.getPreferredAuthors());
    }

    public ProfileResponse toResponse(UserProfile profile) {
        Map<String, Double> weights = readWeights(profile.getRankingWeights());
        return ProfileResponse.builder()
            .userId(profile.getUserId())
            .diversityPreference(orDefault(profile.getDiversityPreference(), UserProfile.DEFAULT_DIVERSITY))
            .noveltyPreference(orDefault(profile.getNoveltyPreference(), UserProfile.DEFAULT_NOVELTY))
            .recencyBias(orDefault(profile.getRecencyBias(), UserProfile.DEFAULT_RECENCY))
            .researchDomains(readList(profile.getResearchDomains()))
            .activeDomain(profile.getActiveDomain())
            .excludedSources(readList(profile.getExcludedSources()))
            .preferredAuthors(readList(profile.getPreferredAuthors()))
            .rankingWeights(weights.isEmpty() ? RankingWeights.defaults(properties.getRanking()).toMap() : weights)
            .totalInteractions(profile.getTotalInteractions() != null ? profile.getTotalInteractions() : 0)
            .lastActiveAt(profile.getLastActiveAt())
            .build();
    }

    public String writeJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("画像字段序列化失败", e);
        }
    }

    // ==================== 校验与清洗 ====================

    private void checkRange(String field, Double value) {
        if (value == null) {
            return;
        }
        if (!Double.isFinite(value) || value < 0.0 || value > 1.0) {
            throw new InvalidPreferenceRangeException(field, field + " 必须在 [0, 1] 之间，实际为: " + value);
        }
    }

    private List<String> sanitizeList(String field, List<String> raw) {
        Set<String> cleaned = new LinkedHashSet<>();
        for (String entry : raw) {
            cleaned.add(sanitizeEntry(field, entry));
        }
        return new ArrayList<>(cleaned);
    }

    private String sanitizeEntry(String field, String raw) {
        if (raw == null || raw.isBlank()) {
            throw new InvalidInputListException(field, field + " 中包含空条目");
        }
        String trimmed = raw.trim();
        if (trimmed.length() > MAX_ENTRY_LENGTH) {
            throw new InvalidInputListException(field, field + " 条目超过 " + MAX_ENTRY_LENGTH + " 个字符");
        }
        if (!ENTRY_PATTERN.matcher(trimmed).matches()) {
            throw new InvalidInputListException(field, field + " 条目包含非法字符: " + trimmed);
        }
        return trimmed;
    }

    // ==================== JSON 字段 ====================

    private List<String> readList(String json) {
        if (json == null || json.isBlank()) {
            return Collections.emptyList();
        }
        try {
            List<String> values = objectMapper.readValue(json, STRING_LIST);
            return values != null ? values : Collections.emptyList();
        } catch (JsonProcessingException e) {
            log.warn("[Profile] 列表字段解析失败: {}", e.getMessage());
            return Collections.emptyList();
        }
    }

    private Map<String, Double> readWeights(String json) {
        if (json == null || json.isBlank()) {
            return Collections.emptyMap();
        }
        try {
            Map<String, Double> values = objectMapper.readValue(json, WEIGHT_MAP);
            return values != null ? new LinkedHashMap<>(values) : Collections.emptyMap();
        } catch (JsonProcessingException e) {
            log.warn("[Profile] 权重字段解析失败: {}", e.getMessage());
            return Collections.emptyMap();
        }
    }

    private static double orDefault(Double value, double fallback) {
        return value != null ? value : fallback;
    }
}
