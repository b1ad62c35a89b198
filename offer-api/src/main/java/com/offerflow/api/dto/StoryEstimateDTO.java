package com.offerflow.api.dto;

import lombok.Data;

import java.time.LocalDateTime;

/**
 * 故事估算 DTO。
 */
@Data
public class StoryEstimateDTO {

    private Long id;
    private Long storyId;

    private Double estimateP10;
    private Double estimateP50;
    private Double estimateP90;
    private Double pertExpectedHours;

    private Integer riceReach;
    private Double riceImpact;
    private Double riceConfidence;
    private Double riceEffort;
    private Double riceScore;

    private Integer wsjfBusinessValue;
    private Integer wsjfTimeCriticality;
    private Integer wsjfRiskReduction;
    private Integer wsjfJobSize;
    private Double wsjfScore;

    private Double codWeekly;
    private String codUrgencyProfile;

    private Double aiEstimateP10;
    private Double aiEstimateP50;
    private Double aiEstimateP90;
    private Double aiConfidence;
    private String aiReasoning;

    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
}
