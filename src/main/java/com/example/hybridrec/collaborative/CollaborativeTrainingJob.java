package com.example.hybridrec.collaborative;

import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import com.example.hybridrec.config.RecommendationProperties;
import com.example.hybridrec.entity.UserInteraction;
import com.example.hybridrec.exception.ModelUnavailableException;
import com.example.hybridrec.mapper.UserInteractionMapper;
import com.example.hybridrec.service.DistributedLockService;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * NCF 离线训练任务
 *
 * 定时或手动触发；集群内通过分布式锁互斥；成功后持久化快照并切换服务模型
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CollaborativeTrainingJob {

    private static final String LOCK_NAME = "ncf-training";

    private final UserInteractionMapper interactionMapper;
    private final CollaborativeModelTrainer trainer;
    private final CollaborativeScorer scorer;
    private final DistributedLockService lockService;
    private final RecommendationProperties properties;
    private final ObjectMapper objectMapper;

    @Scheduled(cron = "${recommendation.collaborative.training-cron:-}")
    public void scheduledTraining() {
        log.info("[NcfJob] 定时训练触发");
        trainNow();
    }

    /**
     * 立即训练
     *
     * @return 是否产出并发布了新模型（锁被占用或无数据时为 false）
     */
    public boolean trainNow() {
        return lockService.executeWithLock(LOCK_NAME, this::doTrain, false);
    }

    private boolean doTrain() {
        long start = System.currentTimeMillis();

        List<UserInteraction> positives = interactionMapper.findAllPositive();
        List<UserInteraction> pairs = interactionMapper.selectList(
            new LambdaQueryWrapper<UserInteraction>()
                .select(UserInteraction::getUserId, UserInteraction::getResourceId));

        Map<String, Set<String>> seenByUser = new HashMap<>();
        for (UserInteraction pair : pairs) {
            seenByUser.computeIfAbsent(pair.getUserId(), k -> new HashSet<>()).add(pair.getResourceId());
        }
        List<String> vocabulary = interactionMapper.findAllResourceIds();

        NcfModelSnapshot snapshot;
        try {
            snapshot = trainer.train(positives, seenByUser, vocabulary);
        } catch (ModelUnavailableException e) {
            log.warn("[NcfJob] 跳过训练: {}", e.getMessage());
            return false;
        }

        persist(snapshot);
        scorer.swap(NcfModel.fromSnapshot(snapshot));

        log.info("[NcfJob] 训练并发布完成: samples={}, loss={}, duration={}ms",
            snapshot.getTrainingSamples(), snapshot.getFinalLoss(), System.currentTimeMillis() - start);
        return true;
    }

    // 持久化失败不影响内存中的新模型上线，重启后会回到上一份快照
    private void persist(NcfModelSnapshot snapshot) {
        Path path = Paths.get(properties.getCollaborative().getModelPath());
        try {
            if (path.getParent() != null) {
                Files.createDirectories(path.getParent());
            }
            objectMapper.writeValue(path.toFile(), snapshot);
            log.info("[NcfJob] 模型快照已保存: path={}", path);
        } catch (IOException e) {
            log.error("[NcfJob] 模型快照保存失败: path={}", path, e);
        }
    }
}
