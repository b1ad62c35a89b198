package com.offerflow.infrastructure.dao.po;

import com.offerflow.types.enums.AssumptionRiskEnum;
import com.offerflow.types.enums.AssumptionStatusEnum;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 项目假设 PO
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AssumptionPO {

    private Long id;

    /**
     * 项目 ID (关联 projects.id)
     */
    private Long projectId;

    private String assumption;

    private String context;

    private String impactIfWrong;

    private AssumptionStatusEnum status;

    private AssumptionRiskEnum riskLevel;

    private String validationMethod;

    private String validationOwner;

    private LocalDateTime validationDeadline;

    private String validationResult;

    private LocalDateTime validatedAt;

    private String extractedFrom;

    private Double extractionConfidence;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;
}
