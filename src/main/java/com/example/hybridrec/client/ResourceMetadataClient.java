package com.example.hybridrec.client;

import com.example.hybridrec.dto.ResourceMetadata;

import java.util.Collection;
import java.util.Map;

/**
 * 资源元数据查询（外部资源服务）
 */
public interface ResourceMetadataClient {

    /**
     * 批量查询元数据，查不到的资源不出现在结果中
     *
     * @return resourceId -> 元数据
     */
    Map<String, ResourceMetadata> getMetadata(Collection<String> resourceIds);
}
