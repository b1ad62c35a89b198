package com.offerflow.domain.lifecycle.model.valobj;

import com.offerflow.domain.lifecycle.model.entity.LifecyclePhaseEntity;

/**
 * 阶段及其任务完成情况。
 */
public record PhaseProgress(LifecyclePhaseEntity phase, long taskCount, long completedTaskCount) {
}
