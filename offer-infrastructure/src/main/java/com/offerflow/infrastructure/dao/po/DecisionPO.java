package com.offerflow.infrastructure.dao.po;

import com.offerflow.types.enums.DecisionStatusEnum;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 决策记录 PO
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DecisionPO {

    private Long id;

    /**
     * 项目 ID (关联 projects.id)
     */
    private Long projectId;

    private String title;

    private String context;

    private String decision;

    private String rationale;

    /**
     * 备选方案 JSON 数组文本
     */
    private String alternatives;

    private String consequences;

    private DecisionStatusEnum status;

    private String decisionMaker;

    private LocalDateTime decisionDate;

    private String extractedFrom;

    private Double extractionConfidence;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;
}
