package com.offerflow.api.dto;

import lombok.Data;

import java.time.LocalDate;
import java.util.List;

/**
 * 生命周期概览 DTO。
 */
@Data
public class LifecycleSummaryDTO {

    private Long projectId;
    private List<LifecyclePhaseDTO> phases;
    private Long totalTasks;
    private Long completedTasks;
    private String currentPhase;
    private Double overallProgress;
    private LocalDate estimatedCompletionDate;
}
