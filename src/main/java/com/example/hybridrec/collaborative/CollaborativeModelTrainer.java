package com.example.hybridrec.collaborative;

import com.example.hybridrec.config.RecommendationProperties;
import com.example.hybridrec.entity.UserInteraction;
import com.example.hybridrec.exception.ModelUnavailableException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.TreeSet;

/**
 * NCF 离线训练
 *
 * 正样本：正向交互；负样本：每个正样本随机采样 negativeRatio 个该用户从未交互过的资源
 * 同一份输入 + 同一个 seed 得到同一个模型
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CollaborativeModelTrainer {

    private final RecommendationProperties properties;

    /**
     * @param positives    全量正向交互
     * @param seenByUser   用户交互过的全部资源（含非正向），负采样时排除
     * @param vocabulary   资源词表
     * @throws ModelUnavailableException 没有可训练的正样本
     */
    public NcfModelSnapshot train(List<UserInteraction> positives,
                                  Map<String, Set<String>> seenByUser,
                                  Collection<String> vocabulary) {
        if (positives == null || positives.isEmpty()) {
            throw new ModelUnavailableException("没有正向交互，无法训练");
        }

        RecommendationProperties.Collaborative config = properties.getCollaborative();
        Random random = new Random(config.getSeed());

        // 排序后建索引，保证同输入同结果
        TreeSet<String> userSet = new TreeSet<>();
        TreeSet<String> itemSet = new TreeSet<>(vocabulary);
        for (UserInteraction interaction : positives) {
            userSet.add(interaction.getUserId());
            itemSet.add(interaction.getResourceId());
        }
        List<String> userIds = new ArrayList<>(userSet);
        List<String> itemIds = new ArrayList<>(itemSet);

        NcfModel model = NcfModel.initialize(userIds, itemIds,
            config.getEmbeddingDim(), config.getHiddenLayers(), random);

        List<double[]> samples = buildSamples(model, positives, seenByUser, itemIds, config.getNegativeRatio(), random);
        log.info("[NcfTrainer] 开始训练: users={}, items={}, samples={}, epochs={}",
            userIds.size(), itemIds.size(), samples.size(), config.getEpochs());

        double epochLoss = 0.0;
        for (int epoch = 1; epoch <= config.getEpochs(); epoch++) {
            Collections.shuffle(samples, random);
            double total = 0.0;
            for (double[] sample : samples) {
                total += model.trainStep((int) sample[0], (int) sample[1], sample[2], config.getLearningRate());
            }
            epochLoss = total / samples.size();
            log.debug("[NcfTrainer] epoch={}, loss={}", epoch, epochLoss);
        }

        NcfModelSnapshot snapshot = model.toSnapshot();
        snapshot.setTrainedAt(System.currentTimeMillis());
        snapshot.setTrainingSamples(samples.size());
        snapshot.setFinalLoss(epochLoss);

        log.info("[NcfTrainer] 训练完成: finalLoss={}", epochLoss);
        return snapshot;
    }

    // 样本格式：{userIdx, itemIdx, label}
    private List<double[]> buildSamples(NcfModel model,
                                        List<UserInteraction> positives,
                                        Map<String, Set<String>> seenByUser,
                                        List<String> itemIds,
                                        int negativeRatio,
                                        Random random) {
        List<double[]> samples = new ArrayList<>();
        int maxAttempts = Math.max(negativeRatio * 10, 20);

        for (UserInteraction interaction : positives) {
            int user = model.userIndex(interaction.getUserId());
            samples.add(new double[]{user, model.itemIndex(interaction.getResourceId()), 1.0});

            Set<String> seen = seenByUser.getOrDefault(interaction.getUserId(), Collections.emptySet());
            int drawn = 0;
            int attempts = 0;
            while (drawn < negativeRatio && attempts < maxAttempts) {
                attempts++;
                String candidate = itemIds.get(random.nextInt(itemIds.size()));
                if (seen.contains(candidate) || candidate.equals(interaction.getResourceId())) {
                    continue;
                }
                samples.add(new double[]{user, model.itemIndex(candidate), 0.0});
                drawn++;
            }
        }
        return samples;
    }
}
