package com.example.hybridrec.collaborative;

import com.example.hybridrec.config.RecommendationProperties;
import com.example.hybridrec.exception.ModelUnavailableException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 协同过滤打分服务
 *
 * 持有当前服务中的模型引用（volatile），训练完成后整体替换，推理过程不修改模型
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CollaborativeScorer {

    private final RecommendationProperties properties;
    private final ObjectMapper objectMapper;

    private volatile NcfModel model;

    @PostConstruct
    public void init() {
        reload();
    }

    /**
     * 从 modelPath 重新加载模型快照，失败时保留当前模型
     *
     * @return 是否加载成功
     */
    public boolean reload() {
        Path path = Paths.get(properties.getCollaborative().getModelPath());
        if (!Files.exists(path)) {
            log.info("[Collaborative] 未找到模型快照，协同打分暂不可用: path={}", path);
            return false;
        }
        try {
            NcfModelSnapshot snapshot = objectMapper.readValue(path.toFile(), NcfModelSnapshot.class);
            swap(NcfModel.fromSnapshot(snapshot));
            return true;
        } catch (IOException | ModelUnavailableException e) {
            log.warn("[Collaborative] 模型快照加载失败: path={}, error={}", path, e.getMessage());
            return false;
        }
    }

    public void swap(NcfModel newModel) {
        this.model = newModel;
        log.info("[Collaborative] 模型已切换: items={}", newModel.getItemIds().size());
    }

    public boolean isAvailable() {
        return model != null;
    }

    public CollaborativeScore predict(String userId, String itemId) {
        NcfModel current = model;
        if (current == null || !current.hasUser(userId) || !current.hasItem(itemId)) {
            return CollaborativeScore.unavailable();
        }
        return CollaborativeScore.scored(current.predict(userId, itemId));
    }

    public Map<String, CollaborativeScore> predictBatch(String userId, Collection<String> itemIds) {
        NcfModel current = model;
        Map<String, CollaborativeScore> result = new LinkedHashMap<>();
        for (String itemId : itemIds) {
            if (current == null || !current.hasUser(userId) || !current.hasItem(itemId)) {
                result.put(itemId, CollaborativeScore.unavailable());
            } else {
                result.put(itemId, CollaborativeScore.scored(current.predict(userId, itemId)));
            }
        }
        return result;
    }

    /**
     * 在模型词表上为用户打分，取 Top-K（分数降序，同分按资源 ID 升序）
     *
     * 模型不可用或用户未知时返回空
     */
    public Map<String, Double> topItems(String userId, Set<String> exclude, int k) {
        NcfModel current = model;
        Map<String, Double> result = new LinkedHashMap<>();
        if (current == null || !current.hasUser(userId) || k <= 0) {
            return result;
        }

        int user = current.userIndex(userId);
        List<Map.Entry<String, Double>> scored = new ArrayList<>();
        for (String itemId : current.getItemIds()) {
            if (exclude != null && exclude.contains(itemId)) {
                continue;
            }
            scored.add(Map.entry(itemId, current.predict(user, current.itemIndex(itemId))));
        }
        scored.sort(Map.Entry.<String, Double>comparingByValue(Comparator.reverseOrder())
            .thenComparing(Map.Entry.comparingByKey()));

        for (int i = 0; i < Math.min(k, scored.size()); i++) {
            result.put(scored.get(i).getKey(), scored.get(i).getValue());
        }
        return result;
    }
}
