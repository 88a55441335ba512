package com.example.hybridrec.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 按策略聚合的曝光/点击行
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class StrategyCtrRow {
    private String strategy;
    private Long impressions;
    private Long clicks;
}
