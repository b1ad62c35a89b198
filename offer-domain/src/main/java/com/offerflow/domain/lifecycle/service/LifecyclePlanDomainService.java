package com.offerflow.domain.lifecycle.service;

import com.offerflow.domain.ai.service.ToolCallingDomainService;
import com.offerflow.domain.lifecycle.model.entity.LifecyclePhaseEntity;
import com.offerflow.domain.lifecycle.model.entity.ServiceTaskEntity;
import com.offerflow.domain.lifecycle.model.valobj.GeneratedLifecyclePlan;
import com.offerflow.types.common.Constants;
import com.offerflow.types.enums.LifecyclePhaseEnum;
import com.offerflow.types.enums.ServiceTaskStatusEnum;
import com.offerflow.types.enums.TaskSourceEnum;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * 生命周期计划领域服务：把模型输出转为阶段与任务，并排定计划日期。
 * <p>
 * 六个阶段按固定顺序首尾相接：阶段计划开始日为上一阶段结束日，缺省时长 30 天；
 * 阶段内任务均从阶段开始日起算，缺省工期 5 天。模型未给出的阶段只有日期、没有任务。
 * </p>
 */
@Slf4j
@Service
public class LifecyclePlanDomainService {

    public GeneratedLifecyclePlan buildPlan(Long projectId,
                                            Map<String, Object> toolArguments,
                                            LocalDate startDate,
                                            LocalDateTime now) {
        Map<LifecyclePhaseEnum, Map<String, Object>> phaseArgs = new EnumMap<>(LifecyclePhaseEnum.class);
        for (Map<String, Object> item : ToolCallingDomainService.getObjectList(toolArguments, "phases")) {
            LifecyclePhaseEnum phase = parsePhase(ToolCallingDomainService.getString(item, "phase"));
            if (phase == null) {
                continue;
            }
            if (phaseArgs.containsKey(phase)) {
                log.warn("Ignore duplicated generated phase. projectId={}, phase={}", projectId, phase.getCode());
                continue;
            }
            phaseArgs.put(phase, item);
        }

        List<GeneratedLifecyclePlan.PhasePlan> phasePlans = new ArrayList<>();
        LocalDate phaseStart = startDate;
        for (LifecyclePhaseEnum phaseEnum : LifecyclePhaseEnum.values()) {
            Map<String, Object> args = phaseArgs.get(phaseEnum);
            int duration = positiveOrDefault(ToolCallingDomainService.getInteger(args, "target_duration_days"),
                    Constants.DEFAULT_PHASE_DURATION_DAYS);
            LifecyclePhaseEntity phase = LifecyclePhaseEntity.create(projectId, phaseEnum, now);
            phase.schedule(phaseStart, phaseStart.plusDays(duration));

            List<ServiceTaskEntity> tasks = args == null ? Collections.emptyList() : buildTasks(args, phaseStart, now);
            phasePlans.add(new GeneratedLifecyclePlan.PhasePlan(phase, tasks));
            phaseStart = phaseStart.plusDays(duration);
        }

        Integer totalDays = ToolCallingDomainService.getInteger(toolArguments, "total_estimated_days");
        return GeneratedLifecyclePlan.builder()
                .phases(phasePlans)
                .offerType(ToolCallingDomainService.getString(toolArguments, "offer_type"))
                .complexityAssessment(ToolCallingDomainService.getString(toolArguments, "complexity_assessment"))
                .totalEstimatedDays(totalDays)
                .keyRisks(ToolCallingDomainService.getStringList(toolArguments, "key_risks"))
                .build();
    }

    /**
     * 创建手工任务：顺序排在阶段末尾，开始日期与工期齐全时推算计划完成日。
     */
    public ServiceTaskEntity newManualTask(Long phaseId,
                                           String title,
                                           String definition,
                                           String category,
                                           String subcategory,
                                           Integer daysRequired,
                                           LocalDate targetStartDate,
                                           String owner,
                                           String team,
                                           Boolean required,
                                           int currentMaxOrder,
                                           LocalDateTime now) {
        ServiceTaskEntity task = new ServiceTaskEntity();
        task.setPhaseId(phaseId);
        task.setTitle(StringUtils.trim(title));
        task.setDefinition(definition);
        task.setDescription(definition);
        task.setCategory(category);
        task.setSubcategory(subcategory);
        task.setDaysRequired(daysRequired);
        task.setTargetStartDate(targetStartDate);
        if (targetStartDate != null && daysRequired != null) {
            task.setTargetCompleteDate(targetStartDate.plusDays(daysRequired));
        }
        task.setOwner(owner);
        task.setTeam(team);
        task.setRequired(required == null ? Boolean.TRUE : required);
        task.setSource(TaskSourceEnum.MANUAL);
        task.setStatus(ServiceTaskStatusEnum.NOT_STARTED);
        task.setTaskOrder(currentMaxOrder + 1);
        task.setCreatedAt(now);
        task.setUpdatedAt(now);
        return task;
    }

    private List<ServiceTaskEntity> buildTasks(Map<String, Object> phaseArgs, LocalDate phaseStart, LocalDateTime now) {
        List<ServiceTaskEntity> tasks = new ArrayList<>();
        int order = 0;
        for (Map<String, Object> item : ToolCallingDomainService.getObjectList(phaseArgs, "tasks")) {
            String title = ToolCallingDomainService.getString(item, "title");
            if (StringUtils.isBlank(title)) {
                log.debug("Skip generated service task without title");
                continue;
            }
            Integer days = ToolCallingDomainService.getInteger(item, "days_required");
            int daysRequired = days == null || days < 0 ? Constants.DEFAULT_TASK_DURATION_DAYS : days;
            Boolean required = ToolCallingDomainService.getBoolean(item, "is_required");
            String definition = ToolCallingDomainService.getString(item, "definition");

            ServiceTaskEntity task = new ServiceTaskEntity();
            task.setTitle(title);
            task.setDefinition(definition);
            task.setDescription(definition);
            task.setCategory(ToolCallingDomainService.getString(item, "category"));
            task.setSubcategory(ToolCallingDomainService.getString(item, "subcategory"));
            task.setTeam(ToolCallingDomainService.getString(item, "owner_team"));
            task.setDaysRequired(daysRequired);
            task.setTargetStartDate(phaseStart);
            task.setTargetCompleteDate(phaseStart.plusDays(daysRequired));
            task.setStatus(ServiceTaskStatusEnum.NOT_STARTED);
            task.setSource(TaskSourceEnum.AI_GENERATED);
            task.setTaskOrder(order++);
            task.setRequired(required == null ? Boolean.TRUE : required);
            task.setAiConfidence(ToolCallingDomainService.getDouble(item, "confidence"));
            task.setAiReasoning(ToolCallingDomainService.getString(item, "reasoning"));
            task.setCreatedAt(now);
            task.setUpdatedAt(now);
            tasks.add(task);
        }
        return tasks;
    }

    private LifecyclePhaseEnum parsePhase(String code) {
        if (code == null) {
            return null;
        }
        try {
            return LifecyclePhaseEnum.fromCode(code);
        } catch (IllegalArgumentException ex) {
            log.warn("Ignore unknown generated phase: {}", code);
            return null;
        }
    }

    private int positiveOrDefault(Integer value, int defaultValue) {
        return value == null || value <= 0 ? defaultValue : value;
    }
}
