package com.offerflow.api.dto;

import lombok.Data;

import java.time.LocalDateTime;

/**
 * 新增项目假设请求 DTO。riskLevel 缺省为 medium。
 */
@Data
public class AssumptionCreateRequestDTO {

    private String assumption;
    private String context;
    private String impactIfWrong;
    private String riskLevel;
    private String validationMethod;
    private String validationOwner;
    private LocalDateTime validationDeadline;
}
