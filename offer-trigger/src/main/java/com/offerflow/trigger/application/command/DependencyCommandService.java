package com.offerflow.trigger.application.command;

import com.offerflow.api.dto.DependencyCreateRequestDTO;
import com.offerflow.api.dto.DependencyDTO;
import com.offerflow.api.dto.DependencyInferenceResultDTO;
import com.offerflow.api.dto.DependencyStatusUpdateRequestDTO;
import com.offerflow.domain.ai.service.ToolCallingDomainService;
import com.offerflow.domain.dependency.adapter.repository.IDependencyRepository;
import com.offerflow.domain.dependency.model.entity.DependencyEntity;
import com.offerflow.domain.dependency.service.DependencyGraphDomainService;
import com.offerflow.domain.workitem.adapter.gateway.IWorkItemCatalog;
import com.offerflow.domain.workitem.model.valobj.WorkItemRef;
import com.offerflow.trigger.application.common.EnumCodeParser;
import com.offerflow.trigger.application.common.PlanningViewAssembler;
import com.offerflow.types.enums.DependencyStatusEnum;
import com.offerflow.types.enums.DependencyTypeEnum;
import com.offerflow.types.enums.ResponseCode;
import com.offerflow.types.enums.WorkItemTypeEnum;
import com.offerflow.types.exception.AppException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * 依赖关系写用例：手工维护依赖边，写入模型推断出的依赖。
 */
@Slf4j
@Service
public class DependencyCommandService {

    private final IDependencyRepository dependencyRepository;
    private final IWorkItemCatalog workItemCatalog;
    private final DependencyGraphDomainService dependencyGraphDomainService;
    private final PlanningViewAssembler planningViewAssembler;
    private final Clock clock;

    public DependencyCommandService(IDependencyRepository dependencyRepository,
                                    IWorkItemCatalog workItemCatalog,
                                    DependencyGraphDomainService dependencyGraphDomainService,
                                    PlanningViewAssembler planningViewAssembler,
                                    Clock clock) {
        this.dependencyRepository = dependencyRepository;
        this.workItemCatalog = workItemCatalog;
        this.dependencyGraphDomainService = dependencyGraphDomainService;
        this.planningViewAssembler = planningViewAssembler;
        this.clock = clock;
    }

    @Transactional(rollbackFor = Exception.class)
    public DependencyDTO addDependency(Long projectId, DependencyCreateRequestDTO request) {
        if (request == null) {
            throw illegal("请求体不能为空");
        }
        if (request.getSourceId() == null) {
            throw illegal("sourceId 不能为空");
        }
        if (request.getTargetId() == null) {
            throw illegal("targetId 不能为空");
        }
        WorkItemRef source = WorkItemRef.of(
                EnumCodeParser.require(request.getSourceType(), WorkItemTypeEnum::fromCode, "sourceType"),
                request.getSourceId());
        WorkItemRef target = WorkItemRef.of(
                EnumCodeParser.require(request.getTargetType(), WorkItemTypeEnum::fromCode, "targetType"),
                request.getTargetId());
        DependencyTypeEnum type = EnumCodeParser.optional(request.getDependencyType(),
                DependencyTypeEnum::fromCode, "dependencyType");
        DependencyEntity candidate = DependencyEntity.create(projectId, source, target,
                type == null ? DependencyTypeEnum.BLOCKS : type,
                false,
                request.getConfidence(),
                request.getInferenceReason(),
                request.getNotes(),
                LocalDateTime.now(clock));
        dependencyGraphDomainService.validateNewEdge(candidate);
        DependencyEntity saved = dependencyRepository.save(candidate);
        log.info("Dependency created. projectId={}, dependencyId={}, source={}, target={}, type={}",
                projectId, saved.getId(), source, target, saved.getDependencyType().getCode());
        return planningViewAssembler.toDependencyDTO(saved);
    }

    @Transactional(rollbackFor = Exception.class)
    public void removeDependency(Long dependencyId) {
        if (!dependencyRepository.deleteById(dependencyId)) {
            throw new AppException(ResponseCode.NOT_FOUND, "依赖不存在: " + dependencyId);
        }
        log.info("Dependency removed. dependencyId={}", dependencyId);
    }

    @Transactional(rollbackFor = Exception.class)
    public DependencyDTO updateStatus(Long dependencyId, DependencyStatusUpdateRequestDTO request) {
        if (request == null) {
            throw illegal("请求体不能为空");
        }
        DependencyStatusEnum status = EnumCodeParser.require(request.getStatus(),
                DependencyStatusEnum::fromCode, "status");
        DependencyEntity dependency = requireDependency(dependencyId);
        DependencyStatusEnum previous = dependency.getStatus();
        dependency.changeStatus(status, request.getNotes(), LocalDateTime.now(clock));
        DependencyEntity updated = dependencyRepository.update(dependency);
        log.info("Dependency status changed. dependencyId={}, from={}, to={}", dependencyId, previous, status);
        return planningViewAssembler.toDependencyDTO(updated);
    }

    /**
     * 写入模型推断出的依赖建议。非法、重复与自指的建议被跳过。
     *
     * @param invocations {@code record_dependencies} 工具调用参数，模型调用已在事务外完成
     */
    @Transactional(rollbackFor = Exception.class)
    public DependencyInferenceResultDTO applyInferredDependencies(Long projectId, List<Map<String, Object>> invocations) {
        if (!workItemCatalog.projectExists(projectId)) {
            throw new AppException(ResponseCode.NOT_FOUND, "项目不存在: " + projectId);
        }
        LocalDateTime now = LocalDateTime.now(clock);
        List<DependencyEntity> created = new ArrayList<>();
        int skipped = 0;
        for (Map<String, Object> arguments : invocations == null ? List.<Map<String, Object>>of() : invocations) {
            for (Map<String, Object> proposal : ToolCallingDomainService.getObjectList(arguments, "dependencies")) {
                DependencyEntity candidate = toInferredCandidate(projectId, proposal, now);
                if (candidate == null) {
                    skipped++;
                    continue;
                }
                try {
                    dependencyGraphDomainService.validateNewEdge(candidate);
                } catch (AppException ex) {
                    log.warn("Skip inferred dependency. projectId={}, source={}, target={}, code={}, info={}",
                            projectId, candidate.getSource(), candidate.getTarget(), ex.getCode(), ex.getInfo());
                    skipped++;
                    continue;
                }
                created.add(dependencyRepository.save(candidate));
            }
        }
        log.info("Inferred dependencies saved. projectId={}, created={}, skipped={}", projectId, created.size(), skipped);
        DependencyInferenceResultDTO result = new DependencyInferenceResultDTO();
        result.setProjectId(projectId);
        result.setCreatedCount(created.size());
        result.setSkippedCount(skipped);
        result.setDependencies(planningViewAssembler.toDependencyDTOs(created));
        return result;
    }

    private DependencyEntity toInferredCandidate(Long projectId, Map<String, Object> proposal, LocalDateTime now) {
        Long sourceId = ToolCallingDomainService.getLong(proposal, "source_id");
        Long targetId = ToolCallingDomainService.getLong(proposal, "target_id");
        if (sourceId == null || targetId == null) {
            log.warn("Skip inferred dependency without item ids. projectId={}, proposal={}", projectId, proposal);
            return null;
        }
        WorkItemTypeEnum sourceType;
        WorkItemTypeEnum targetType;
        DependencyTypeEnum type;
        try {
            sourceType = codeOrDefault(ToolCallingDomainService.getString(proposal, "source_type"),
                    WorkItemTypeEnum.STORY, WorkItemTypeEnum::fromCode);
            targetType = codeOrDefault(ToolCallingDomainService.getString(proposal, "target_type"),
                    WorkItemTypeEnum.STORY, WorkItemTypeEnum::fromCode);
            type = codeOrDefault(ToolCallingDomainService.getString(proposal, "dependency_type"),
                    DependencyTypeEnum.DEPENDS_ON, DependencyTypeEnum::fromCode);
        } catch (IllegalArgumentException ex) {
            log.warn("Skip inferred dependency with unknown code. projectId={}, proposal={}", projectId, proposal);
            return null;
        }
        return DependencyEntity.create(projectId,
                WorkItemRef.of(sourceType, sourceId),
                WorkItemRef.of(targetType, targetId),
                type,
                true,
                ToolCallingDomainService.getDouble(proposal, "confidence"),
                ToolCallingDomainService.getString(proposal, "reasoning"),
                null,
                now);
    }

    private static <E> E codeOrDefault(String code, E defaultValue, Function<String, E> parser) {
        return code == null ? defaultValue : parser.apply(code);
    }

    private DependencyEntity requireDependency(Long dependencyId) {
        DependencyEntity dependency = dependencyRepository.findById(dependencyId);
        if (dependency == null) {
            throw new AppException(ResponseCode.NOT_FOUND, "依赖不存在: " + dependencyId);
        }
        return dependency;
    }

    private AppException illegal(String message) {
        return new AppException(ResponseCode.ILLEGAL_PARAMETER, message);
    }
}
