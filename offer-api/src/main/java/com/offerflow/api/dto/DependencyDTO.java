package com.offerflow.api.dto;

import lombok.Data;

import java.time.LocalDateTime;

/**
 * 依赖 DTO。
 */
@Data
public class DependencyDTO {

    private Long id;
    private Long projectId;
    private String sourceType;
    private Long sourceId;
    private String targetType;
    private Long targetId;
    private String dependencyType;
    private String status;
    private Boolean inferred;
    private Double confidence;
    private String inferenceReason;
    private String notes;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
}
