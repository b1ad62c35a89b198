package com.offerflow.trigger.application.common;

import com.offerflow.api.dto.LifecyclePhaseDTO;
import com.offerflow.api.dto.LifecycleSummaryDTO;
import com.offerflow.api.dto.PhaseApprovalResultDTO;
import com.offerflow.api.dto.ServiceTaskDTO;
import com.offerflow.domain.lifecycle.model.entity.LifecyclePhaseEntity;
import com.offerflow.domain.lifecycle.model.entity.ServiceTaskEntity;
import com.offerflow.domain.lifecycle.model.valobj.ApprovalOutcome;
import com.offerflow.domain.lifecycle.model.valobj.LifecycleSummary;
import com.offerflow.domain.lifecycle.model.valobj.PhaseProgress;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * 生命周期阶段与服务任务视图组装器。
 */
@Component
public class LifecycleViewAssembler {

    public LifecyclePhaseDTO toPhaseDTO(LifecyclePhaseEntity phase) {
        return toPhaseDTO(phase, null, null);
    }

    public LifecyclePhaseDTO toPhaseDTO(LifecyclePhaseEntity phase, Long taskCount, Long completedTaskCount) {
        if (phase == null) {
            return null;
        }
        LifecyclePhaseDTO dto = new LifecyclePhaseDTO();
        dto.setId(phase.getId());
        dto.setProjectId(phase.getProjectId());
        dto.setPhase(phase.getPhase() == null ? null : phase.getPhase().getCode());
        dto.setStatus(phase.getStatus() == null ? null : phase.getStatus().getCode());
        dto.setPhaseOrder(phase.getPhaseOrder());
        dto.setApprovalRequired(phase.getApprovalRequired());
        dto.setApprovedBy(phase.getApprovedBy());
        dto.setApprovedAt(phase.getApprovedAt());
        dto.setApprovalNotes(phase.getApprovalNotes());
        dto.setSequenceOverridden(phase.getSequenceOverridden());
        dto.setOverrideReason(phase.getOverrideReason());
        dto.setOverriddenBy(phase.getOverriddenBy());
        dto.setOverriddenAt(phase.getOverriddenAt());
        dto.setTargetStartDate(phase.getTargetStartDate());
        dto.setTargetEndDate(phase.getTargetEndDate());
        dto.setActualStartDate(phase.getActualStartDate());
        dto.setActualEndDate(phase.getActualEndDate());
        dto.setVersion(phase.getVersion());
        dto.setTaskCount(taskCount);
        dto.setCompletedTaskCount(completedTaskCount);
        dto.setCreatedAt(phase.getCreatedAt());
        dto.setUpdatedAt(phase.getUpdatedAt());
        return dto;
    }

    public List<LifecyclePhaseDTO> toPhaseDTOs(List<LifecyclePhaseEntity> phases) {
        List<LifecyclePhaseDTO> result = new ArrayList<>();
        if (phases != null) {
            for (LifecyclePhaseEntity phase : phases) {
                result.add(toPhaseDTO(phase));
            }
        }
        return result;
    }

    public PhaseApprovalResultDTO toApprovalDTO(ApprovalOutcome outcome) {
        PhaseApprovalResultDTO dto = new PhaseApprovalResultDTO();
        dto.setApprovedPhase(toPhaseDTO(outcome.approvedPhase()));
        dto.setStartedNextPhase(toPhaseDTO(outcome.startedNextPhase()));
        return dto;
    }

    public LifecycleSummaryDTO toSummaryDTO(LifecycleSummary summary) {
        LifecycleSummaryDTO dto = new LifecycleSummaryDTO();
        dto.setProjectId(summary.getProjectId());
        List<LifecyclePhaseDTO> phases = new ArrayList<>();
        for (PhaseProgress progress : summary.getPhases()) {
            phases.add(toPhaseDTO(progress.phase(), progress.taskCount(), progress.completedTaskCount()));
        }
        dto.setPhases(phases);
        dto.setTotalTasks(summary.getTotalTasks());
        dto.setCompletedTasks(summary.getCompletedTasks());
        dto.setCurrentPhase(summary.getCurrentPhase() == null ? null : summary.getCurrentPhase().getCode());
        dto.setOverallProgress(summary.getOverallProgress());
        dto.setEstimatedCompletionDate(summary.getEstimatedCompletionDate());
        return dto;
    }

    public ServiceTaskDTO toTaskDTO(ServiceTaskEntity task) {
        if (task == null) {
            return null;
        }
        ServiceTaskDTO dto = new ServiceTaskDTO();
        dto.setId(task.getId());
        dto.setPhaseId(task.getPhaseId());
        dto.setTitle(task.getTitle());
        dto.setDescription(task.getDescription());
        dto.setDefinition(task.getDefinition());
        dto.setCategory(task.getCategory());
        dto.setSubcategory(task.getSubcategory());
        dto.setStatus(task.getStatus() == null ? null : task.getStatus().getCode());
        dto.setSource(task.getSource() == null ? null : task.getSource().getCode());
        dto.setTargetStartDate(task.getTargetStartDate());
        dto.setTargetCompleteDate(task.getTargetCompleteDate());
        dto.setDaysRequired(task.getDaysRequired());
        dto.setActualStartDate(task.getActualStartDate());
        dto.setActualCompleteDate(task.getActualCompleteDate());
        dto.setOwner(task.getOwner());
        dto.setTeam(task.getTeam());
        dto.setLinkedEpicId(task.getLinkedEpicId());
        dto.setLinkedStoryId(task.getLinkedStoryId());
        dto.setTaskOrder(task.getTaskOrder());
        dto.setRequired(task.getRequired());
        dto.setAiConfidence(task.getAiConfidence());
        dto.setAiReasoning(task.getAiReasoning());
        dto.setNotes(task.getNotes());
        dto.setCompletionNotes(task.getCompletionNotes());
        dto.setCompletedAt(task.getCompletedAt());
        dto.setCreatedAt(task.getCreatedAt());
        dto.setUpdatedAt(task.getUpdatedAt());
        return dto;
    }

    public List<ServiceTaskDTO> toTaskDTOs(List<ServiceTaskEntity> tasks) {
        List<ServiceTaskDTO> result = new ArrayList<>();
        if (tasks != null) {
            for (ServiceTaskEntity task : tasks) {
                result.add(toTaskDTO(task));
            }
        }
        return result;
    }
}
