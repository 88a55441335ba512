package com.example.hybridrec.collaborative;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * NCF 模型快照（JSON 持久化格式）
 */
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class NcfModelSnapshot {

    private int embeddingDim;

    private List<String> userIds;

    private List<String> itemIds;

    private double[][] userEmbeddings;

    private double[][] itemEmbeddings;

    /**
     * [layer][out][in]
     */
    private double[][][] weights;

    /**
     * [layer][out]
     */
    private double[][] biases;

    private long trainedAt;

    private int trainingSamples;

    private double finalLoss;
}
