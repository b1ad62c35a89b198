package com.offerflow.trigger.application.command;

import com.offerflow.api.dto.LifecycleDeleteResultDTO;
import com.offerflow.api.dto.LifecycleGenerateResultDTO;
import com.offerflow.api.dto.LifecyclePhaseDTO;
import com.offerflow.api.dto.PhaseApprovalRequestDTO;
import com.offerflow.api.dto.PhaseApprovalResultDTO;
import com.offerflow.api.dto.PhaseOverrideRequestDTO;
import com.offerflow.domain.lifecycle.adapter.repository.ILifecyclePhaseRepository;
import com.offerflow.domain.lifecycle.adapter.repository.IServiceTaskRepository;
import com.offerflow.domain.lifecycle.model.entity.LifecyclePhaseEntity;
import com.offerflow.domain.lifecycle.model.entity.ServiceTaskEntity;
import com.offerflow.domain.lifecycle.model.valobj.ApprovalOutcome;
import com.offerflow.domain.lifecycle.model.valobj.GeneratedLifecyclePlan;
import com.offerflow.domain.lifecycle.service.LifecyclePlanDomainService;
import com.offerflow.domain.lifecycle.service.PhaseSequencerDomainService;
import com.offerflow.domain.workitem.adapter.gateway.IWorkItemCatalog;
import com.offerflow.domain.workitem.model.valobj.CatalogProject;
import com.offerflow.trigger.application.common.LifecycleViewAssembler;
import com.offerflow.types.enums.ResponseCode;
import com.offerflow.types.exception.AppException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * 生命周期写用例：初始化、阶段推进、审批、顺序覆盖、删除与落库模型生成的方案。
 * <p>
 * 同一次操作内 today 与 now 只取一次，审批级联的两个阶段共用同一日期。
 * </p>
 */
@Slf4j
@Service
public class LifecycleCommandService {

    static final String NOTHING_DELETED = "No lifecycle phases to delete";

    private final ILifecyclePhaseRepository lifecyclePhaseRepository;
    private final IServiceTaskRepository serviceTaskRepository;
    private final IWorkItemCatalog workItemCatalog;
    private final PhaseSequencerDomainService phaseSequencerDomainService;
    private final LifecyclePlanDomainService lifecyclePlanDomainService;
    private final LifecycleViewAssembler lifecycleViewAssembler;
    private final Clock clock;

    public LifecycleCommandService(ILifecyclePhaseRepository lifecyclePhaseRepository,
                                   IServiceTaskRepository serviceTaskRepository,
                                   IWorkItemCatalog workItemCatalog,
                                   PhaseSequencerDomainService phaseSequencerDomainService,
                                   LifecyclePlanDomainService lifecyclePlanDomainService,
                                   LifecycleViewAssembler lifecycleViewAssembler,
                                   Clock clock) {
        this.lifecyclePhaseRepository = lifecyclePhaseRepository;
        this.serviceTaskRepository = serviceTaskRepository;
        this.workItemCatalog = workItemCatalog;
        this.phaseSequencerDomainService = phaseSequencerDomainService;
        this.lifecyclePlanDomainService = lifecyclePlanDomainService;
        this.lifecycleViewAssembler = lifecycleViewAssembler;
        this.clock = clock;
    }

    @Transactional(rollbackFor = Exception.class)
    public List<LifecyclePhaseDTO> initialize(Long projectId) {
        requireNoLifecycle(projectId);
        LocalDateTime now = LocalDateTime.now(clock);
        List<LifecyclePhaseEntity> saved = new ArrayList<>();
        for (LifecyclePhaseEntity phase : phaseSequencerDomainService.newLifecycle(projectId, now)) {
            saved.add(lifecyclePhaseRepository.save(phase));
        }
        log.info("Lifecycle initialized. projectId={}, phases={}", projectId, saved.size());
        return lifecycleViewAssembler.toPhaseDTOs(saved);
    }

    @Transactional(rollbackFor = Exception.class)
    public LifecyclePhaseDTO start(Long phaseId) {
        LifecyclePhaseEntity phase = requirePhase(phaseId);
        List<LifecyclePhaseEntity> projectPhases = lifecyclePhaseRepository.findByProjectId(phase.getProjectId());
        boolean changed = phaseSequencerDomainService.start(phase, projectPhases,
                LocalDate.now(clock), LocalDateTime.now(clock));
        if (!changed) {
            return lifecycleViewAssembler.toPhaseDTO(phase);
        }
        LifecyclePhaseEntity updated = lifecyclePhaseRepository.update(phase);
        log.info("Phase started. projectId={}, phaseId={}, phase={}",
                phase.getProjectId(), phaseId, phase.getPhase().getCode());
        return lifecycleViewAssembler.toPhaseDTO(updated);
    }

    @Transactional(rollbackFor = Exception.class)
    public LifecyclePhaseDTO submitForApproval(Long phaseId) {
        LifecyclePhaseEntity phase = requirePhase(phaseId);
        phase.submitForApproval(LocalDateTime.now(clock));
        LifecyclePhaseEntity updated = lifecyclePhaseRepository.update(phase);
        log.info("Phase submitted for approval. projectId={}, phaseId={}, phase={}",
                phase.getProjectId(), phaseId, phase.getPhase().getCode());
        return lifecycleViewAssembler.toPhaseDTO(updated);
    }

    /**
     * 审批阶段并级联启动下一阶段。两个阶段各自做版本比对，任一失败整体回滚。
     */
    @Transactional(rollbackFor = Exception.class)
    public PhaseApprovalResultDTO approve(Long phaseId, PhaseApprovalRequestDTO request) {
        if (request == null) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER, "请求体不能为空");
        }
        LifecyclePhaseEntity phase = requirePhase(phaseId);
        List<LifecyclePhaseEntity> projectPhases = lifecyclePhaseRepository.findByProjectId(phase.getProjectId());
        ApprovalOutcome outcome = phaseSequencerDomainService.approve(phase, projectPhases,
                request.getApprovedBy(), request.getNotes(), LocalDate.now(clock), LocalDateTime.now(clock));
        LifecyclePhaseEntity approved = lifecyclePhaseRepository.update(outcome.approvedPhase());
        LifecyclePhaseEntity next = outcome.cascaded()
                ? lifecyclePhaseRepository.update(outcome.startedNextPhase())
                : null;
        log.info("Phase approved. projectId={}, phaseId={}, phase={}, approvedBy={}, nextStarted={}",
                phase.getProjectId(), phaseId, phase.getPhase().getCode(), request.getApprovedBy(),
                next == null ? null : next.getPhase().getCode());
        return lifecycleViewAssembler.toApprovalDTO(new ApprovalOutcome(approved, next));
    }

    @Transactional(rollbackFor = Exception.class)
    public LifecyclePhaseDTO override(Long phaseId, PhaseOverrideRequestDTO request) {
        if (request == null) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER, "请求体不能为空");
        }
        LifecyclePhaseEntity phase = requirePhase(phaseId);
        phase.overrideSequence(request.getOverriddenBy(), request.getReason(),
                LocalDate.now(clock), LocalDateTime.now(clock));
        LifecyclePhaseEntity updated = lifecyclePhaseRepository.update(phase);
        log.info("Phase sequence overridden. projectId={}, phaseId={}, phase={}, overriddenBy={}",
                phase.getProjectId(), phaseId, phase.getPhase().getCode(), request.getOverriddenBy());
        return lifecycleViewAssembler.toPhaseDTO(updated);
    }

    @Transactional(rollbackFor = Exception.class)
    public LifecycleDeleteResultDTO delete(Long projectId) {
        List<LifecyclePhaseEntity> phases = lifecyclePhaseRepository.findByProjectId(projectId);
        LifecycleDeleteResultDTO result = new LifecycleDeleteResultDTO();
        result.setProjectId(projectId);
        if (phases.isEmpty()) {
            result.setDeletedPhases(0);
            result.setDeletedTasks(0);
            result.setMessage(NOTHING_DELETED);
            return result;
        }
        List<Long> phaseIds = new ArrayList<>();
        for (LifecyclePhaseEntity phase : phases) {
            phaseIds.add(phase.getId());
        }
        int deletedTasks = serviceTaskRepository.deleteByPhaseIds(phaseIds);
        int deletedPhases = lifecyclePhaseRepository.deleteByProjectId(projectId);
        log.info("Lifecycle deleted. projectId={}, deletedPhases={}, deletedTasks={}",
                projectId, deletedPhases, deletedTasks);
        result.setDeletedPhases(deletedPhases);
        result.setDeletedTasks(deletedTasks);
        result.setMessage("Deleted " + deletedPhases + " phases and " + deletedTasks + " tasks");
        return result;
    }

    /**
     * 按模型给出的生命周期方案建立阶段与服务任务。缺少的阶段使用默认时长。
     *
     * @param arguments {@code generate_offer_lifecycle_tasks} 工具参数，可为空（全部取默认）
     */
    @Transactional(rollbackFor = Exception.class)
    public LifecycleGenerateResultDTO applyGeneratedPlan(Long projectId, LocalDate startDate, Map<String, Object> arguments) {
        requireNoLifecycle(projectId);
        LocalDate effectiveStart = startDate == null ? LocalDate.now(clock) : startDate;
        GeneratedLifecyclePlan plan = lifecyclePlanDomainService.buildPlan(projectId,
                arguments == null ? Collections.emptyMap() : arguments,
                effectiveStart, LocalDateTime.now(clock));

        List<LifecyclePhaseEntity> savedPhases = new ArrayList<>();
        int tasksCreated = 0;
        for (GeneratedLifecyclePlan.PhasePlan phasePlan : plan.getPhases()) {
            LifecyclePhaseEntity savedPhase = lifecyclePhaseRepository.save(phasePlan.phase());
            savedPhases.add(savedPhase);
            for (ServiceTaskEntity task : phasePlan.tasks()) {
                task.setPhaseId(savedPhase.getId());
                serviceTaskRepository.save(task);
                tasksCreated++;
            }
        }
        log.info("Lifecycle generated. projectId={}, phases={}, tasks={}, startDate={}",
                projectId, savedPhases.size(), tasksCreated, effectiveStart);

        LifecycleGenerateResultDTO result = new LifecycleGenerateResultDTO();
        result.setProjectId(projectId);
        result.setOfferType(plan.getOfferType());
        result.setComplexityAssessment(plan.getComplexityAssessment());
        result.setTotalEstimatedDays(plan.getTotalEstimatedDays());
        result.setKeyRisks(plan.getKeyRisks());
        result.setPhasesCreated(savedPhases.size());
        result.setTasksCreated(tasksCreated);
        result.setPhases(lifecycleViewAssembler.toPhaseDTOs(savedPhases));
        return result;
    }

    private CatalogProject requireNoLifecycle(Long projectId) {
        CatalogProject project = projectId == null ? null : workItemCatalog.findProject(projectId);
        if (project == null) {
            throw new AppException(ResponseCode.NOT_FOUND, "项目不存在: " + projectId);
        }
        if (!lifecyclePhaseRepository.findByProjectId(projectId).isEmpty()) {
            throw new AppException(ResponseCode.ALREADY_EXISTS, "项目生命周期已存在: " + projectId);
        }
        return project;
    }

    private LifecyclePhaseEntity requirePhase(Long phaseId) {
        LifecyclePhaseEntity phase = phaseId == null ? null : lifecyclePhaseRepository.findById(phaseId);
        if (phase == null) {
            throw new AppException(ResponseCode.NOT_FOUND, "阶段不存在: " + phaseId);
        }
        return phase;
    }
}
