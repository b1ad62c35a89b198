package com.offerflow.domain.lifecycle.model.valobj;

import com.offerflow.types.enums.LifecyclePhaseEnum;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.List;

/**
 * 项目生命周期概览。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LifecycleSummary {

    private Long projectId;

    private List<PhaseProgress> phases;

    private long totalTasks;

    private long completedTasks;

    /**
     * 第一个进行中的阶段，无则为 null
     */
    private LifecyclePhaseEnum currentPhase;

    /**
     * 完成百分比 0..100，保留一位小数
     */
    private double overallProgress;

    /**
     * 最后一个阶段的计划结束日期
     */
    private LocalDate estimatedCompletionDate;
}
