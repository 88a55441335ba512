package com.example.hybridrec.dto;

import lombok.Builder;
import lombok.Data;

import java.util.List;

@Data
@Builder
public class RecommendationResponse {
    private List<RecommendationItem> recommendations;
    private RecommendationMetadata metadata;
}
