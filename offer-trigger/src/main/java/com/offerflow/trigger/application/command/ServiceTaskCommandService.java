package com.offerflow.trigger.application.command;

import com.offerflow.api.dto.BulkUpdateResultDTO;
import com.offerflow.api.dto.ServiceTaskBulkStatusRequestDTO;
import com.offerflow.api.dto.ServiceTaskCreateRequestDTO;
import com.offerflow.api.dto.ServiceTaskDTO;
import com.offerflow.api.dto.ServiceTaskLinkRequestDTO;
import com.offerflow.api.dto.ServiceTaskUpdateRequestDTO;
import com.offerflow.domain.lifecycle.adapter.repository.ILifecyclePhaseRepository;
import com.offerflow.domain.lifecycle.adapter.repository.IServiceTaskRepository;
import com.offerflow.domain.lifecycle.model.entity.ServiceTaskEntity;
import com.offerflow.domain.lifecycle.service.LifecyclePlanDomainService;
import com.offerflow.trigger.application.common.EnumCodeParser;
import com.offerflow.trigger.application.common.LifecycleViewAssembler;
import com.offerflow.types.enums.ResponseCode;
import com.offerflow.types.enums.ServiceTaskStatusEnum;
import com.offerflow.types.exception.AppException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * 阶段服务任务写用例。
 */
@Slf4j
@Service
public class ServiceTaskCommandService {

    private final IServiceTaskRepository serviceTaskRepository;
    private final ILifecyclePhaseRepository lifecyclePhaseRepository;
    private final LifecyclePlanDomainService lifecyclePlanDomainService;
    private final LifecycleViewAssembler lifecycleViewAssembler;
    private final Clock clock;

    public ServiceTaskCommandService(IServiceTaskRepository serviceTaskRepository,
                                     ILifecyclePhaseRepository lifecyclePhaseRepository,
                                     LifecyclePlanDomainService lifecyclePlanDomainService,
                                     LifecycleViewAssembler lifecycleViewAssembler,
                                     Clock clock) {
        this.serviceTaskRepository = serviceTaskRepository;
        this.lifecyclePhaseRepository = lifecyclePhaseRepository;
        this.lifecyclePlanDomainService = lifecyclePlanDomainService;
        this.lifecycleViewAssembler = lifecycleViewAssembler;
        this.clock = clock;
    }

    @Transactional(rollbackFor = Exception.class)
    public ServiceTaskDTO createTask(Long phaseId, ServiceTaskCreateRequestDTO request) {
        if (request == null || StringUtils.isBlank(request.getTitle())) {
            throw illegal("title 不能为空");
        }
        if (request.getDaysRequired() != null && request.getDaysRequired() < 0) {
            throw illegal("daysRequired 不能为负数: " + request.getDaysRequired());
        }
        requirePhase(phaseId);
        ServiceTaskEntity task = lifecyclePlanDomainService.newManualTask(phaseId,
                request.getTitle(),
                request.getDefinition(),
                request.getCategory(),
                request.getSubcategory(),
                request.getDaysRequired(),
                request.getTargetStartDate(),
                request.getOwner(),
                request.getTeam(),
                request.getRequired(),
                serviceTaskRepository.maxOrderByPhaseId(phaseId),
                LocalDateTime.now(clock));
        ServiceTaskEntity saved = serviceTaskRepository.save(task);
        log.info("Service task created. phaseId={}, taskId={}, order={}", phaseId, saved.getId(), saved.getTaskOrder());
        return lifecycleViewAssembler.toTaskDTO(saved);
    }

    /**
     * 局部更新任务，null 字段保持原值；状态变化同步实际开始与完成日期。
     */
    @Transactional(rollbackFor = Exception.class)
    public ServiceTaskDTO updateTask(Long taskId, ServiceTaskUpdateRequestDTO request) {
        if (request == null) {
            throw illegal("请求体不能为空");
        }
        ServiceTaskStatusEnum status = EnumCodeParser.optional(request.getStatus(),
                ServiceTaskStatusEnum::fromCode, "status");
        if (request.getTitle() != null && StringUtils.isBlank(request.getTitle())) {
            throw illegal("title 不能为空");
        }
        if (request.getDaysRequired() != null && request.getDaysRequired() < 0) {
            throw illegal("daysRequired 不能为负数: " + request.getDaysRequired());
        }
        ServiceTaskEntity task = requireTask(taskId);
        LocalDateTime now = LocalDateTime.now(clock);
        if (request.getTitle() != null) {
            task.setTitle(StringUtils.trim(request.getTitle()));
        }
        if (request.getDescription() != null) {
            task.setDescription(request.getDescription());
        }
        if (request.getDefinition() != null) {
            task.setDefinition(request.getDefinition());
        }
        if (request.getCategory() != null) {
            task.setCategory(request.getCategory());
        }
        if (request.getSubcategory() != null) {
            task.setSubcategory(request.getSubcategory());
        }
        if (request.getTargetStartDate() != null) {
            task.setTargetStartDate(request.getTargetStartDate());
        }
        if (request.getTargetCompleteDate() != null) {
            task.setTargetCompleteDate(request.getTargetCompleteDate());
        }
        if (request.getDaysRequired() != null) {
            task.setDaysRequired(request.getDaysRequired());
        }
        if (request.getOwner() != null) {
            task.setOwner(request.getOwner());
        }
        if (request.getTeam() != null) {
            task.setTeam(request.getTeam());
        }
        if (request.getRequired() != null) {
            task.setRequired(request.getRequired());
        }
        if (request.getNotes() != null) {
            task.setNotes(request.getNotes());
        }
        if (request.getCompletionNotes() != null) {
            task.setCompletionNotes(request.getCompletionNotes());
        }
        ServiceTaskStatusEnum previous = task.getStatus();
        task.changeStatus(status, LocalDate.now(clock), now);
        task.setUpdatedAt(now);
        ServiceTaskEntity updated = serviceTaskRepository.update(task);
        if (status != null && status != previous) {
            log.info("Service task status changed. taskId={}, from={}, to={}", taskId, previous, status);
        }
        return lifecycleViewAssembler.toTaskDTO(updated);
    }

    @Transactional(rollbackFor = Exception.class)
    public void deleteTask(Long taskId) {
        if (taskId == null || !serviceTaskRepository.deleteById(taskId)) {
            throw new AppException(ResponseCode.NOT_FOUND, "任务不存在: " + taskId);
        }
        log.info("Service task deleted. taskId={}", taskId);
    }

    @Transactional(rollbackFor = Exception.class)
    public ServiceTaskDTO linkDevWork(Long taskId, ServiceTaskLinkRequestDTO request) {
        if (request == null || (request.getEpicId() == null && request.getStoryId() == null)) {
            throw illegal("epicId 与 storyId 至少提供一个");
        }
        ServiceTaskEntity task = requireTask(taskId);
        task.linkDevWork(request.getEpicId(), request.getStoryId(), LocalDateTime.now(clock));
        ServiceTaskEntity updated = serviceTaskRepository.update(task);
        log.info("Service task linked. taskId={}, epicId={}, storyId={}",
                taskId, updated.getLinkedEpicId(), updated.getLinkedStoryId());
        return lifecycleViewAssembler.toTaskDTO(updated);
    }

    /**
     * 批量修改阶段内任务状态，不属于该阶段或不存在的任务被忽略。
     *
     * @return 实际更新条数
     */
    @Transactional(rollbackFor = Exception.class)
    public BulkUpdateResultDTO bulkUpdateStatus(Long phaseId, ServiceTaskBulkStatusRequestDTO request) {
        if (request == null) {
            throw illegal("请求体不能为空");
        }
        ServiceTaskStatusEnum status = EnumCodeParser.require(request.getStatus(),
                ServiceTaskStatusEnum::fromCode, "status");
        requirePhase(phaseId);
        LocalDate today = LocalDate.now(clock);
        LocalDateTime now = LocalDateTime.now(clock);
        Set<Long> taskIds = request.getTaskIds() == null ? Set.of() : new LinkedHashSet<>(request.getTaskIds());
        int updatedCount = 0;
        for (Long taskId : taskIds) {
            ServiceTaskEntity task = taskId == null ? null : serviceTaskRepository.findById(taskId);
            if (task == null || !Objects.equals(task.getPhaseId(), phaseId)) {
                log.debug("Skip task outside phase in bulk update. phaseId={}, taskId={}", phaseId, taskId);
                continue;
            }
            task.changeStatus(status, today, now);
            task.setUpdatedAt(now);
            serviceTaskRepository.update(task);
            updatedCount++;
        }
        log.info("Service task bulk status update. phaseId={}, status={}, requested={}, updated={}",
                phaseId, status, taskIds.size(), updatedCount);
        BulkUpdateResultDTO result = new BulkUpdateResultDTO();
        result.setUpdatedCount(updatedCount);
        return result;
    }

    private void requirePhase(Long phaseId) {
        if (phaseId == null || lifecyclePhaseRepository.findById(phaseId) == null) {
            throw new AppException(ResponseCode.NOT_FOUND, "阶段不存在: " + phaseId);
        }
    }

    private ServiceTaskEntity requireTask(Long taskId) {
        ServiceTaskEntity task = taskId == null ? null : serviceTaskRepository.findById(taskId);
        if (task == null) {
            throw new AppException(ResponseCode.NOT_FOUND, "任务不存在: " + taskId);
        }
        return task;
    }

    private AppException illegal(String message) {
        return new AppException(ResponseCode.ILLEGAL_PARAMETER, message);
    }
}
