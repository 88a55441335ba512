package com.example.hybridrec.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * 推荐核心配置
 *
 * 所有阈值、上限与模型超参数集中在 recommendation.* 下
 */
@Data
@ConfigurationProperties(prefix = "recommendation")
public class RecommendationProperties {

    /**
     * 资源 embedding 维度 D（全系统常量）
     */
    private int embeddingDimension = 768;

    private EmbeddingCache embeddingCache = new EmbeddingCache();

    private Candidate candidate = new Candidate();

    private Ranking ranking = new Ranking();

    private Diversity diversity = new Diversity();

    private Novelty novelty = new Novelty();

    private Learning learning = new Learning();

    private Collaborative collaborative = new Collaborative();

    @Data
    public static class EmbeddingCache {
        /**
         * memory / redis
         */
        private String type = "memory";
        private long ttlSeconds = 300;
    }

    @Data
    public static class Candidate {
        private int sourceLimit = 100;
        private int mergedLimit = 100;
        private double contentMinSimilarity = 0.3;
        private int graphHops = 2;
        private int graphSeedCount = 10;
        private int collaborativeMinInteractions = 5;
        private long sourceTimeoutMs = 150;
        private int executorPoolSize = 8;
    }

    @Data
    public static class Ranking {
        private double collaborativeWeight = 0.35;
        private double contentWeight = 0.30;
        private double graphWeight = 0.20;
        private double qualityWeight = 0.10;
        private double recencyWeight = 0.05;
    }

    @Data
    public static class Diversity {
        private double defaultLambda = 0.5;
        /**
         * MMR 输出规模 = limit * poolFactor（供新颖度阶段替换使用）
         */
        private int poolFactor = 2;
    }

    @Data
    public static class Novelty {
        private double boostFactor = 0.2;
        private double floorRatio = 0.2;
    }

    @Data
    public static class Learning {
        private int interval = 10;
        private int lookbackDays = 90;
        private int maxRecords = 1000;
        private int topAuthors = 10;
        private int embeddingInteractionLimit = 100;
    }

    @Data
    public static class Collaborative {
        private String modelPath = "models/ncf-snapshot.json";
        private int embeddingDim = 64;
        private List<Integer> hiddenLayers = new ArrayList<>(List.of(128, 64, 32));
        private int negativeRatio = 4;
        private int epochs = 10;
        private double learningRate = 0.01;
        private long seed = 42L;
        /**
         * 离线训练 cron，"-" 表示关闭定时训练
         */
        private String trainingCron = "-";
    }
}
