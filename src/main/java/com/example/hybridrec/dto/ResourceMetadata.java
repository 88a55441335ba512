package com.example.hybridrec.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 资源元数据（由资源服务提供，质量/时效/embedding 均已预先计算）
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ResourceMetadata {
    private String resourceId;
    private String title;
    private Double qualityScore;
    private Double recencyScore;
    /**
     * 预计算 embedding（原始数值，使用前需校验）
     */
    private List<Double> embedding;
    private List<String> authors;
    private Long viewCount;
    /**
     * 来源域名
     */
    private String source;
}
