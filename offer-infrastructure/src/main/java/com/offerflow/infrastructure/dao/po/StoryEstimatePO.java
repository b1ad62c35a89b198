package com.offerflow.infrastructure.dao.po;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 故事估算 PO
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StoryEstimatePO {

    /**
     * 主键 ID
     */
    private Long id;

    /**
     * 故事 ID (关联 stories.id，唯一)
     */
    private Long storyId;

    /**
     * 三点估算 (小时)
     */
    private Double estimateP10;
    private Double estimateP50;
    private Double estimateP90;

    /**
     * RICE 输入与得分
     */
    private Integer riceReach;
    private Double riceImpact;
    private Double riceConfidence;
    private Double riceEffort;
    private Double riceScore;

    /**
     * WSJF 输入与得分
     */
    private Integer wsjfBusinessValue;
    private Integer wsjfTimeCriticality;
    private Integer wsjfRiskReduction;
    private Integer wsjfJobSize;
    private Double wsjfScore;

    /**
     * 延迟成本
     */
    private Double codWeekly;
    private String codUrgencyProfile;

    /**
     * 模型三点估算
     */
    private Double aiEstimateP10;
    private Double aiEstimateP50;
    private Double aiEstimateP90;
    private Double aiConfidence;
    private String aiReasoning;

    /**
     * 创建时间
     */
    private LocalDateTime createdAt;

    /**
     * 更新时间
     */
    private LocalDateTime updatedAt;
}
