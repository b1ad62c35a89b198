package com.offerflow.api.dto;

import lombok.Data;

import java.util.List;

/**
 * 生命周期生成结果 DTO。
 */
@Data
public class LifecycleGenerateResultDTO {

    private Long projectId;
    private String offerType;
    private String complexityAssessment;
    private Integer totalEstimatedDays;
    private List<String> keyRisks;
    private Integer phasesCreated;
    private Integer tasksCreated;
    private List<LifecyclePhaseDTO> phases;
}
