package com.offerflow.api.dto;

import lombok.Data;

import java.time.LocalDateTime;

/**
 * 修改项目假设请求 DTO。为空的字段保持原值。
 */
@Data
public class AssumptionUpdateRequestDTO {

    private String assumption;
    private String context;
    private String impactIfWrong;
    private String status;
    private String riskLevel;
    private String validationMethod;
    private String validationOwner;
    private LocalDateTime validationDeadline;
    private String validationResult;
}
