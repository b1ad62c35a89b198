package com.offerflow.api.dto;

import lombok.Data;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * 生命周期阶段 DTO。
 */
@Data
public class LifecyclePhaseDTO {

    private Long id;
    private Long projectId;
    private String phase;
    private String status;
    private Integer phaseOrder;
    private Boolean approvalRequired;
    private String approvedBy;
    private LocalDateTime approvedAt;
    private String approvalNotes;
    private Boolean sequenceOverridden;
    private String overrideReason;
    private String overriddenBy;
    private LocalDateTime overriddenAt;
    private LocalDate targetStartDate;
    private LocalDate targetEndDate;
    private LocalDate actualStartDate;
    private LocalDate actualEndDate;
    private Integer version;
    private Long taskCount;
    private Long completedTaskCount;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
}
