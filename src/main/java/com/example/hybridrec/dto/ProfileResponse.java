package com.example.hybridrec.dto;

import lombok.Builder;
import lombok.Data;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

@Data
@Builder
public class ProfileResponse {
    private String userId;
    private double diversityPreference;
    private double noveltyPreference;
    private double recencyBias;
    private List<String> researchDomains;
    private String activeDomain;
    private List<String> excludedSources;
    private List<String> preferredAuthors;
    private Map<String, Double> rankingWeights;
    private int totalInteractions;
    private LocalDateTime lastActiveAt;
}
