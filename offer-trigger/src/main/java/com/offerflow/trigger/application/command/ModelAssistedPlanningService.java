package com.offerflow.trigger.application.command;

import com.offerflow.api.dto.DependencyInferenceResultDTO;
import com.offerflow.api.dto.LifecycleGenerateResultDTO;
import com.offerflow.api.dto.StoryEstimateDTO;
import com.offerflow.domain.ai.model.valobj.LlmProviderConfig;
import com.offerflow.domain.ai.service.PlanningPromptDomainService;
import com.offerflow.domain.ai.service.ToolCallingDomainService;
import com.offerflow.domain.lifecycle.adapter.repository.ILifecyclePhaseRepository;
import com.offerflow.domain.workitem.adapter.gateway.IWorkItemCatalog;
import com.offerflow.domain.workitem.model.valobj.CatalogProject;
import com.offerflow.domain.workitem.model.valobj.CatalogStory;
import com.offerflow.types.enums.ResponseCode;
import com.offerflow.types.exception.AppException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 模型辅助规划用例：依赖推断、区间估算与生命周期生成。
 * <p>
 * 本类不开启事务。先做只读前置校验并完成模型调用，再把工具参数交给对应命令服务的事务方法落库；
 * 模型失败时不会进入任何写事务。
 * </p>
 */
@Slf4j
@Service
public class ModelAssistedPlanningService {

    private final IWorkItemCatalog workItemCatalog;
    private final ILifecyclePhaseRepository lifecyclePhaseRepository;
    private final PlanningPromptDomainService planningPromptDomainService;
    private final ToolCallingDomainService toolCallingDomainService;
    private final DependencyCommandService dependencyCommandService;
    private final EstimationCommandService estimationCommandService;
    private final LifecycleCommandService lifecycleCommandService;

    public ModelAssistedPlanningService(IWorkItemCatalog workItemCatalog,
                                        ILifecyclePhaseRepository lifecyclePhaseRepository,
                                        PlanningPromptDomainService planningPromptDomainService,
                                        ToolCallingDomainService toolCallingDomainService,
                                        DependencyCommandService dependencyCommandService,
                                        EstimationCommandService estimationCommandService,
                                        LifecycleCommandService lifecycleCommandService) {
        this.workItemCatalog = workItemCatalog;
        this.lifecyclePhaseRepository = lifecyclePhaseRepository;
        this.planningPromptDomainService = planningPromptDomainService;
        this.toolCallingDomainService = toolCallingDomainService;
        this.dependencyCommandService = dependencyCommandService;
        this.estimationCommandService = estimationCommandService;
        this.lifecycleCommandService = lifecycleCommandService;
    }

    /**
     * 推断项目内故事间依赖。项目没有故事时不调用模型。
     */
    public DependencyInferenceResultDTO inferDependencies(Long projectId, LlmProviderConfig config) {
        if (projectId == null || !workItemCatalog.projectExists(projectId)) {
            throw new AppException(ResponseCode.NOT_FOUND, "项目不存在: " + projectId);
        }
        List<CatalogStory> stories = workItemCatalog.findStoriesByProject(projectId);
        if (stories == null || stories.isEmpty()) {
            log.info("Skip dependency inference, project has no stories. projectId={}", projectId);
            DependencyInferenceResultDTO result = new DependencyInferenceResultDTO();
            result.setProjectId(projectId);
            result.setCreatedCount(0);
            result.setSkippedCount(0);
            result.setDependencies(new ArrayList<>());
            return result;
        }
        List<Map<String, Object>> invocations = toolCallingDomainService.invokeTool(config,
                planningPromptDomainService.buildDependencyInferenceMessages(stories),
                planningPromptDomainService.dependencyInferenceTool());
        log.info("Dependency inference answered. projectId={}, provider={}, stories={}, invocations={}",
                projectId, providerOf(config), stories.size(), invocations.size());
        return dependencyCommandService.applyInferredDependencies(projectId, invocations);
    }

    /**
     * 生成故事的三点估算；模型未给出工具调用视为上游失败。
     */
    public StoryEstimateDTO generateRangeEstimate(Long storyId, LlmProviderConfig config) {
        CatalogStory story = storyId == null ? null : workItemCatalog.findStory(storyId);
        if (story == null) {
            throw new AppException(ResponseCode.NOT_FOUND, "故事不存在: " + storyId);
        }
        List<String> taskTitles = workItemCatalog.findTaskTitlesByStory(storyId);
        List<Map<String, Object>> invocations = toolCallingDomainService.invokeTool(config,
                planningPromptDomainService.buildRangeEstimateMessages(story, taskTitles),
                planningPromptDomainService.rangeEstimateTool());
        if (invocations.isEmpty()) {
            throw new AppException(ResponseCode.UPSTREAM_FAILURE, "模型未返回估算结果: storyId=" + storyId);
        }
        log.info("Range estimate answered. storyId={}, provider={}", storyId, providerOf(config));
        return estimationCommandService.applyAiEstimate(storyId, invocations.get(0));
    }

    /**
     * 生成完整生命周期。已存在生命周期时不调用模型；模型未给出方案时全部阶段取默认时长。
     */
    public LifecycleGenerateResultDTO generateLifecycle(Long projectId, LocalDate startDate, LlmProviderConfig config) {
        CatalogProject project = projectId == null ? null : workItemCatalog.findProject(projectId);
        if (project == null) {
            throw new AppException(ResponseCode.NOT_FOUND, "项目不存在: " + projectId);
        }
        if (!lifecyclePhaseRepository.findByProjectId(projectId).isEmpty()) {
            throw new AppException(ResponseCode.ALREADY_EXISTS, "项目生命周期已存在: " + projectId);
        }
        List<Map<String, Object>> invocations = toolCallingDomainService.invokeTool(config,
                planningPromptDomainService.buildLifecycleMessages(project),
                planningPromptDomainService.lifecycleTool());
        if (invocations.isEmpty()) {
            log.warn("Model returned no lifecycle plan, fall back to default phases. projectId={}, provider={}",
                    projectId, providerOf(config));
            return lifecycleCommandService.applyGeneratedPlan(projectId, startDate, null);
        }
        log.info("Lifecycle plan answered. projectId={}, provider={}", projectId, providerOf(config));
        return lifecycleCommandService.applyGeneratedPlan(projectId, startDate, invocations.get(0));
    }

    private Object providerOf(LlmProviderConfig config) {
        return config == null ? null : config.providerOrDefault();
    }
}
