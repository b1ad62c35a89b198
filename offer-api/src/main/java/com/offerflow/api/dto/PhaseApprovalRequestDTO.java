package com.offerflow.api.dto;

import lombok.Data;

/**
 * 阶段审批请求 DTO。
 */
@Data
public class PhaseApprovalRequestDTO {

    private String approvedBy;
    private String notes;
}
