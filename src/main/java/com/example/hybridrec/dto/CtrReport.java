package com.example.hybridrec.dto;

import lombok.Builder;
import lombok.Data;

import java.util.Map;

/**
 * 点击率报告
 */
@Data
@Builder
public class CtrReport {
    private String userId;
    private int windowDays;
    private long impressions;
    private long clicks;
    private double ctr;
    /**
     * 策略标签 -> 点击率
     */
    private Map<String, Double> ctrByStrategy;
}
