package com.offerflow.api.dto;

import lombok.Data;

/**
 * 阶段审批结果 DTO。
 */
@Data
public class PhaseApprovalResultDTO {

    private LifecyclePhaseDTO approvedPhase;
    /** 级联启动的下一阶段，未发生级联时为 null */
    private LifecyclePhaseDTO startedNextPhase;
}
