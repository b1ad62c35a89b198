package com.offerflow.api.dto;

import lombok.Data;

/**
 * 新增依赖请求 DTO。类型字段取小写编码，如 story / depends_on。
 */
@Data
public class DependencyCreateRequestDTO {

    private String sourceType;
    private Long sourceId;
    private String targetType;
    private Long targetId;
    private String dependencyType;
    private Double confidence;
    private String inferenceReason;
    private String notes;
}
