package com.offerflow.domain.lifecycle.model.valobj;

import com.offerflow.domain.lifecycle.model.entity.LifecyclePhaseEntity;

/**
 * 审批结果：被审批阶段与级联启动的下一阶段（可空）。
 */
public record ApprovalOutcome(LifecyclePhaseEntity approvedPhase, LifecyclePhaseEntity startedNextPhase) {

    public boolean cascaded() {
        return startedNextPhase != null;
    }
}
