package com.example.hybridrec.client;

import com.example.hybridrec.dto.SimilarResource;
import com.example.hybridrec.vector.EmbeddingVector;

import java.util.List;

/**
 * 内容相似度检索（外部向量索引）
 */
public interface ContentSimilarityClient {

    /**
     * 按余弦相似度返回 Top-K 资源
     */
    List<SimilarResource> findSimilar(EmbeddingVector query, int topK, double minSimilarity);
}
