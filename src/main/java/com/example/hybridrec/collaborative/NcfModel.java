package com.example.hybridrec.collaborative;

import com.example.hybridrec.exception.ModelUnavailableException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;

/**
 * 神经协同过滤模型
 *
 * 结构：user/item embedding 拼接 → 全连接 + ReLU（隐藏层）→ 单输出 + sigmoid
 *
 * 服务端只读：对外发布的实例由快照构建，训练只发生在训练器自己的实例上
 */
public class NcfModel {

    private static final double EPS = 1e-7;

    private final int embeddingDim;
    private final List<String> userIds;
    private final List<String> itemIds;
    private final Map<String, Integer> userIndex;
    private final Map<String, Integer> itemIndex;
    private final double[][] userEmbeddings;
    private final double[][] itemEmbeddings;
    private final double[][][] weights;
    private final double[][] biases;

    private NcfModel(int embeddingDim, List<String> userIds, List<String> itemIds,
                     double[][] userEmbeddings, double[][] itemEmbeddings,
                     double[][][] weights, double[][] biases) {
        this.embeddingDim = embeddingDim;
        this.userIds = Collections.unmodifiableList(new ArrayList<>(userIds));
        this.itemIds = Collections.unmodifiableList(new ArrayList<>(itemIds));
        this.userIndex = indexOf(userIds);
        this.itemIndex = indexOf(itemIds);
        this.userEmbeddings = userEmbeddings;
        this.itemEmbeddings = itemEmbeddings;
        this.weights = weights;
        this.biases = biases;
    }

    /**
     * 随机初始化（embedding 小方差正态，权重 Xavier 均匀分布）
     */
    public static NcfModel initialize(List<String> userIds, List<String> itemIds,
                                      int embeddingDim, List<Integer> hiddenLayers, Random random) {
        double[][] users = new double[userIds.size()][embeddingDim];
        double[][] items = new double[itemIds.size()][embeddingDim];
        fillGaussian(users, random);
        fillGaussian(items, random);

        List<Integer> sizes = new ArrayList<>();
        sizes.add(embeddingDim * 2);
        sizes.addAll(hiddenLayers);
        sizes.add(1);

        int layerCount = sizes.size() - 1;
        double[][][] weights = new double[layerCount][][];
        double[][] biases = new double[layerCount][];
        for (int l = 0; l < layerCount; l++) {
            int in = sizes.get(l);
            int out = sizes.get(l + 1);
            double limit = Math.sqrt(6.0 / (in + out));
            weights[l] = new double[out][in];
            biases[l] = new double[out];
            for (int o = 0; o < out; o++) {
                for (int i = 0; i < in; i++) {
                    weights[l][o][i] = (random.nextDouble() * 2 - 1) * limit;
                }
            }
        }
        return new NcfModel(embeddingDim, userIds, itemIds, users, items, weights, biases);
    }

    /**
     * 从快照恢复，形状不一致时拒绝加载
     *
     * @throws ModelUnavailableException 快照不完整或形状不匹配
     */
    public static NcfModel fromSnapshot(NcfModelSnapshot snapshot) {
        if (snapshot == null || snapshot.getUserIds() == null || snapshot.getItemIds() == null
            || snapshot.getUserEmbeddings() == null || snapshot.getItemEmbeddings() == null
            || snapshot.getWeights() == null || snapshot.getBiases() == null) {
            throw new ModelUnavailableException("模型快照不完整");
        }
        int dim = snapshot.getEmbeddingDim();
        if (dim <= 0) {
            throw new ModelUnavailableException("embedding 维度非法: " + dim);
        }
        checkIds(snapshot.getUserIds(), "user");
        checkIds(snapshot.getItemIds(), "item");
        checkTable(snapshot.getUserEmbeddings(), snapshot.getUserIds().size(), dim, "user");
        checkTable(snapshot.getItemEmbeddings(), snapshot.getItemIds().size(), dim, "item");

        double[][][] weights = snapshot.getWeights();
        double[][] biases = snapshot.getBiases();
        if (weights.length == 0 || weights.length != biases.length) {
            throw new ModelUnavailableException("模型层数不一致");
        }
        int expectedIn = dim * 2;
        for (int l = 0; l < weights.length; l++) {
            if (weights[l] == null || biases[l] == null
                || weights[l].length == 0 || biases[l].length != weights[l].length) {
                throw new ModelUnavailableException("第 " + l + " 层形状非法");
            }
            checkTable(weights[l], weights[l].length, expectedIn, "第 " + l + " 层权重");
            checkFinite(biases[l], "第 " + l + " 层偏置");
            expectedIn = weights[l].length;
        }
        if (expectedIn != 1) {
            throw new ModelUnavailableException("输出层维度必须为 1");
        }
        return new NcfModel(dim, snapshot.getUserIds(), snapshot.getItemIds(),
            deepCopy(snapshot.getUserEmbeddings()), deepCopy(snapshot.getItemEmbeddings()),
            deepCopy(weights), deepCopy(biases));
    }

    public NcfModelSnapshot toSnapshot() {
        NcfModelSnapshot snapshot = new NcfModelSnapshot();
        snapshot.setEmbeddingDim(embeddingDim);
        snapshot.setUserIds(new ArrayList<>(userIds));
        snapshot.setItemIds(new ArrayList<>(itemIds));
        snapshot.setUserEmbeddings(deepCopy(userEmbeddings));
        snapshot.setItemEmbeddings(deepCopy(itemEmbeddings));
        snapshot.setWeights(deepCopy(weights));
        snapshot.setBiases(deepCopy(biases));
        return snapshot;
    }

    public boolean hasUser(String userId) {
        return userIndex.containsKey(userId);
    }

    public boolean hasItem(String itemId) {
        return itemIndex.containsKey(itemId);
    }

    public List<String> getItemIds() {
        return itemIds;
    }

    public int userIndex(String userId) {
        Integer idx = userIndex.get(userId);
        if (idx == null) {
            throw new IllegalArgumentException("unknown user: " + userId);
        }
        return idx;
    }

    public int itemIndex(String itemId) {
        Integer idx = itemIndex.get(itemId);
        if (idx == null) {
            throw new IllegalArgumentException("unknown item: " + itemId);
        }
        return idx;
    }

    /**
     * 交互概率 ∈ (0, 1)
     */
    public double predict(String userId, String itemId) {
        return predict(userIndex(userId), itemIndex(itemId));
    }

    public double predict(int user, int item) {
        double[][] activations = forward(user, item);
        return sigmoid(activations[weights.length][0]);
    }

    /**
     * 单样本 SGD（二元交叉熵）
     *
     * @return 更新前该样本的损失
     */
    double trainStep(int user, int item, double label, double learningRate) {
        double[][] activations = forward(user, item);
        int layerCount = weights.length;
        double p = sigmoid(activations[layerCount][0]);

        // sigmoid + BCE 的输出梯度
        double[] delta = {p - label};
        for (int l = layerCount - 1; l >= 0; l--) {
            double[] prev = activations[l];
            double[] prevDelta = new double[prev.length];
            double[][] w = weights[l];
            for (int o = 0; o < w.length; o++) {
                double d = delta[o];
                if (d == 0.0) {
                    continue;
                }
                for (int i = 0; i < prev.length; i++) {
                    prevDelta[i] += w[o][i] * d;
                    w[o][i] -= learningRate * d * prev[i];
                }
                biases[l][o] -= learningRate * d;
            }
            if (l > 0) {
                for (int i = 0; i < prev.length; i++) {
                    if (prev[i] <= 0.0) {
                        prevDelta[i] = 0.0;
                    }
                }
            }
            delta = prevDelta;
        }

        double[] u = userEmbeddings[user];
        double[] v = itemEmbeddings[item];
        for (int k = 0; k < embeddingDim; k++) {
            u[k] -= learningRate * delta[k];
            v[k] -= learningRate * delta[embeddingDim + k];
        }

        return -(label * Math.log(p + EPS) + (1 - label) * Math.log(1 - p + EPS));
    }

    // activations[0] 为输入，activations[L] 为输出层线性值（未过 sigmoid）
    private double[][] forward(int user, int item) {
        int layerCount = weights.length;
        double[][] activations = new double[layerCount + 1][];

        double[] input = new double[embeddingDim * 2];
        System.arraycopy(userEmbeddings[user], 0, input, 0, embeddingDim);
        System.arraycopy(itemEmbeddings[item], 0, input, embeddingDim, embeddingDim);
        activations[0] = input;

        for (int l = 0; l < layerCount; l++) {
            double[][] w = weights[l];
            double[] in = activations[l];
            double[] out = new double[w.length];
            for (int o = 0; o < w.length; o++) {
                double z = biases[l][o];
                double[] row = w[o];
                for (int i = 0; i < in.length; i++) {
                    z += row[i] * in[i];
                }
                out[o] = (l < layerCount - 1) ? Math.max(0.0, z) : z;
            }
            activations[l + 1] = out;
        }
        return activations;
    }

    private static double sigmoid(double z) {
        return 1.0 / (1.0 + Math.exp(-z));
    }

    private static Map<String, Integer> indexOf(List<String> ids) {
        Map<String, Integer> index = new HashMap<>(ids.size() * 2);
        for (int i = 0; i < ids.size(); i++) {
            index.put(ids.get(i), i);
        }
        return Collections.unmodifiableMap(index);
    }

    private static void fillGaussian(double[][] table, Random random) {
        for (double[] row : table) {
            for (int k = 0; k < row.length; k++) {
                row[k] = random.nextGaussian() * 0.1;
            }
        }
    }

    private static void checkIds(List<String> ids, String name) {
        Set<String> distinct = new HashSet<>();
        for (String id : ids) {
            if (id == null || !distinct.add(id)) {
                throw new ModelUnavailableException(name + " 词表包含空值或重复项");
            }
        }
    }

    private static void checkTable(double[][] table, int rows, int dim, String name) {
        if (table.length != rows) {
            throw new ModelUnavailableException(name + " 行数不一致");
        }
        for (double[] row : table) {
            if (row == null || row.length != dim) {
                throw new ModelUnavailableException(name + " 维度不一致");
            }
            checkFinite(row, name);
        }
    }

    private static void checkFinite(double[] values, String name) {
        for (double v : values) {
            if (!Double.isFinite(v)) {
                throw new ModelUnavailableException(name + " 包含非有限值");
            }
        }
    }

    private static double[][] deepCopy(double[][] source) {
        double[][] copy = new double[source.length][];
        for (int i = 0; i < source.length; i++) {
            copy[i] = source[i].clone();
        }
        return copy;
    }

    private static double[][][] deepCopy(double[][][] source) {
        double[][][] copy = new double[source.length][][];
        for (int i = 0; i < source.length; i++) {
            copy[i] = deepCopy(source[i]);
        }
        return copy;
    }
}
