package com.offerflow.api.dto;

import lombok.Data;

import java.time.LocalDateTime;

/**
 * 项目假设 DTO。
 */
@Data
public class AssumptionDTO {

    private Long id;
    private Long projectId;
    private String assumption;
    private String context;
    private String impactIfWrong;
    private String status;
    private String riskLevel;
    private String validationMethod;
    private String validationOwner;
    private LocalDateTime validationDeadline;
    private String validationResult;
    private LocalDateTime validatedAt;
    private String extractedFrom;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
}
