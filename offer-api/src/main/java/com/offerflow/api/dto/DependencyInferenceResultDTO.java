package com.offerflow.api.dto;

import lombok.Data;

import java.util.List;

/**
 * 依赖推断结果 DTO。
 */
@Data
public class DependencyInferenceResultDTO {

    private Long projectId;
    private Integer createdCount;
    private Integer skippedCount;
    private List<DependencyDTO> dependencies;
}
