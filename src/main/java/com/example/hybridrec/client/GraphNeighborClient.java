package com.example.hybridrec.client;

import com.example.hybridrec.dto.GraphNeighbor;

import java.util.Collection;
import java.util.List;

/**
 * 图邻居检索（外部图服务）
 */
public interface GraphNeighborClient {

    /**
     * 返回种子资源 N 跳范围内的资源
     */
    List<GraphNeighbor> findNeighbors(Collection<String> seedResourceIds, int hops, int limit);
}
