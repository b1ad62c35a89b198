package com.offerflow.domain.lifecycle.service;

import com.offerflow.domain.lifecycle.model.entity.LifecyclePhaseEntity;
import com.offerflow.domain.lifecycle.model.valobj.ApprovalOutcome;
import com.offerflow.domain.lifecycle.model.valobj.LifecycleSummary;
import com.offerflow.domain.lifecycle.model.valobj.PhaseProgress;
import com.offerflow.domain.lifecycle.model.valobj.PhaseTaskStat;
import com.offerflow.types.enums.LifecyclePhaseEnum;
import com.offerflow.types.enums.PhaseStatusEnum;
import com.offerflow.types.enums.ResponseCode;
import com.offerflow.types.exception.AppException;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 阶段编排领域服务：阶段门禁、审批级联与进度汇总。
 */
@Service
public class PhaseSequencerDomainService {

    /**
     * 创建项目的六个阶段，全部 NOT_STARTED。
     */
    public List<LifecyclePhaseEntity> newLifecycle(Long projectId, LocalDateTime now) {
        List<LifecyclePhaseEntity> phases = new ArrayList<>();
        for (LifecyclePhaseEnum phase : LifecyclePhaseEnum.values()) {
            phases.add(LifecyclePhaseEntity.create(projectId, phase, now));
        }
        return phases;
    }

    /**
     * 开始阶段：除非已覆盖顺序或为第一阶段，前序阶段必须已审批。
     *
     * @param phase 目标阶段
     * @param projectPhases 同项目全部阶段
     * @return 是否发生状态变化
     */
    public boolean start(LifecyclePhaseEntity phase,
                         List<LifecyclePhaseEntity> projectPhases,
                         LocalDate today,
                         LocalDateTime now) {
        if (phase.getStatus() == PhaseStatusEnum.NOT_STARTED) {
            requirePredecessorApproved(phase, projectPhases);
        }
        return phase.start(today, now);
    }

    public void requirePredecessorApproved(LifecyclePhaseEntity phase, List<LifecyclePhaseEntity> projectPhases) {
        if (phase.isOverridden() || phase.getPhaseOrder() == null || phase.getPhaseOrder() <= 1) {
            return;
        }
        LifecyclePhaseEntity predecessor = findByOrder(projectPhases, phase.getPhaseOrder() - 1);
        if (predecessor == null || predecessor.getStatus() != PhaseStatusEnum.APPROVED) {
            String predecessorCode = predecessor == null ? "-" : predecessor.getPhase().getCode();
            throw new AppException(ResponseCode.SEQUENCE_VIOLATION,
                    "前序阶段 " + predecessorCode + " 尚未审批，不能开始 " + phase.getPhase().getCode());
        }
    }

    /**
     * 审批阶段并级联启动下一阶段（仅当其为 NOT_STARTED），两者使用同一日期。
     */
    public ApprovalOutcome approve(LifecyclePhaseEntity phase,
                                   List<LifecyclePhaseEntity> projectPhases,
                                   String approvedBy,
                                   String notes,
                                   LocalDate today,
                                   LocalDateTime now) {
        phase.approve(approvedBy, notes, today, now);
        LifecyclePhaseEntity next = findByOrder(projectPhases, phase.getPhaseOrder() + 1);
        if (next == null || next.getStatus() != PhaseStatusEnum.NOT_STARTED) {
            return new ApprovalOutcome(phase, null);
        }
        next.start(today, now);
        return new ApprovalOutcome(phase, next);
    }

    /**
     * 汇总项目生命周期进度。
     */
    public LifecycleSummary summarize(Long projectId,
                                      List<LifecyclePhaseEntity> projectPhases,
                                      List<PhaseTaskStat> taskStats) {
        Map<Long, PhaseTaskStat> statByPhase = new HashMap<>();
        if (taskStats != null) {
            for (PhaseTaskStat stat : taskStats) {
                statByPhase.put(stat.getPhaseId(), stat);
            }
        }
        List<LifecyclePhaseEntity> ordered = new ArrayList<>(projectPhases);
        ordered.sort(Comparator.comparing(LifecyclePhaseEntity::getPhaseOrder));

        List<PhaseProgress> progress = new ArrayList<>();
        long totalTasks = 0L;
        long completedTasks = 0L;
        LifecyclePhaseEnum currentPhase = null;
        for (LifecyclePhaseEntity phase : ordered) {
            PhaseTaskStat stat = statByPhase.get(phase.getId());
            long total = stat == null || stat.getTotal() == null ? 0L : stat.getTotal();
            long completed = stat == null || stat.getCompletedCount() == null ? 0L : stat.getCompletedCount();
            progress.add(new PhaseProgress(phase, total, completed));
            totalTasks += total;
            completedTasks += completed;
            if (currentPhase == null && phase.getStatus() == PhaseStatusEnum.IN_PROGRESS) {
                currentPhase = phase.getPhase();
            }
        }
        double overallProgress = totalTasks == 0L ? 0D
                : Math.round(completedTasks * 1000D / totalTasks) / 10D;
        LocalDate estimatedCompletion = ordered.isEmpty() ? null : ordered.get(ordered.size() - 1).getTargetEndDate();
        return LifecycleSummary.builder()
                .projectId(projectId)
                .phases(progress)
                .totalTasks(totalTasks)
                .completedTasks(completedTasks)
                .currentPhase(currentPhase)
                .overallProgress(overallProgress)
                .estimatedCompletionDate(estimatedCompletion)
                .build();
    }

    private LifecyclePhaseEntity findByOrder(List<LifecyclePhaseEntity> phases, int order) {
        if (phases == null) {
            return null;
        }
        for (LifecyclePhaseEntity candidate : phases) {
            if (candidate != null && Objects.equals(candidate.getPhaseOrder(), order)) {
                return candidate;
            }
        }
        return null;
    }
}
