package com.example.hybridrec.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FeedbackRequest {

    @NotBlank
    private String userId;

    @NotBlank
    private String resourceId;

    private Boolean wasClicked;

    /**
     * 显式反馈（可选）
     */
    private Boolean wasUseful;

    @Size(max = 2000)
    private String notes;
}
