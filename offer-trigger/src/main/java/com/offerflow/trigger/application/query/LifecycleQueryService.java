package com.offerflow.trigger.application.query;

import com.offerflow.api.dto.LifecyclePhaseDTO;
import com.offerflow.api.dto.LifecycleSummaryDTO;
import com.offerflow.api.dto.ServiceTaskDTO;
import com.offerflow.domain.lifecycle.adapter.repository.ILifecyclePhaseRepository;
import com.offerflow.domain.lifecycle.adapter.repository.IServiceTaskRepository;
import com.offerflow.domain.lifecycle.model.entity.LifecyclePhaseEntity;
import com.offerflow.domain.lifecycle.model.entity.ServiceTaskEntity;
import com.offerflow.domain.lifecycle.model.valobj.PhaseTaskStat;
import com.offerflow.domain.lifecycle.service.PhaseSequencerDomainService;
import com.offerflow.trigger.application.common.EnumCodeParser;
import com.offerflow.trigger.application.common.LifecycleViewAssembler;
import com.offerflow.types.enums.ResponseCode;
import com.offerflow.types.enums.ServiceTaskStatusEnum;
import com.offerflow.types.exception.AppException;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * 生命周期读用例。
 */
@Service
public class LifecycleQueryService {

    private final ILifecyclePhaseRepository lifecyclePhaseRepository;
    private final IServiceTaskRepository serviceTaskRepository;
    private final PhaseSequencerDomainService phaseSequencerDomainService;
    private final LifecycleViewAssembler lifecycleViewAssembler;

    public LifecycleQueryService(ILifecyclePhaseRepository lifecyclePhaseRepository,
                                 IServiceTaskRepository serviceTaskRepository,
                                 PhaseSequencerDomainService phaseSequencerDomainService,
                                 LifecycleViewAssembler lifecycleViewAssembler) {
        this.lifecyclePhaseRepository = lifecyclePhaseRepository;
        this.serviceTaskRepository = serviceTaskRepository;
        this.phaseSequencerDomainService = phaseSequencerDomainService;
        this.lifecycleViewAssembler = lifecycleViewAssembler;
    }

    public LifecycleSummaryDTO summary(Long projectId) {
        List<LifecyclePhaseEntity> phases = lifecyclePhaseRepository.findByProjectId(projectId);
        if (phases.isEmpty()) {
            throw new AppException(ResponseCode.NOT_FOUND, "项目尚未初始化生命周期: " + projectId);
        }
        List<Long> phaseIds = new ArrayList<>();
        for (LifecyclePhaseEntity phase : phases) {
            phaseIds.add(phase.getId());
        }
        List<PhaseTaskStat> stats = serviceTaskRepository.summarizeByPhaseIds(phaseIds);
        return lifecycleViewAssembler.toSummaryDTO(phaseSequencerDomainService.summarize(projectId, phases, stats));
    }

    public LifecyclePhaseDTO getPhase(Long phaseId) {
        LifecyclePhaseEntity phase = phaseId == null ? null : lifecyclePhaseRepository.findById(phaseId);
        if (phase == null) {
            throw new AppException(ResponseCode.NOT_FOUND, "阶段不存在: " + phaseId);
        }
        long total = 0L;
        long completed = 0L;
        for (PhaseTaskStat stat : serviceTaskRepository.summarizeByPhaseIds(List.of(phaseId))) {
            total += stat.getTotal() == null ? 0L : stat.getTotal();
            completed += stat.getCompletedCount() == null ? 0L : stat.getCompletedCount();
        }
        return lifecycleViewAssembler.toPhaseDTO(phase, total, completed);
    }

    public List<ServiceTaskDTO> listTasks(Long phaseId, String statusCode, String category) {
        ServiceTaskStatusEnum status = EnumCodeParser.optional(statusCode, ServiceTaskStatusEnum::fromCode, "status");
        if (phaseId == null || lifecyclePhaseRepository.findById(phaseId) == null) {
            throw new AppException(ResponseCode.NOT_FOUND, "阶段不存在: " + phaseId);
        }
        List<ServiceTaskEntity> tasks = serviceTaskRepository.findByPhaseId(phaseId, status,
                StringUtils.trimToNull(category));
        return lifecycleViewAssembler.toTaskDTOs(tasks);
    }

    public ServiceTaskDTO getTask(Long taskId) {
        ServiceTaskEntity task = taskId == null ? null : serviceTaskRepository.findById(taskId);
        if (task == null) {
            throw new AppException(ResponseCode.NOT_FOUND, "任务不存在: " + taskId);
        }
        return lifecycleViewAssembler.toTaskDTO(task);
    }
}
