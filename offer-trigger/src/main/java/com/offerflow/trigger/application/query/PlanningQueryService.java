package com.offerflow.trigger.application.query;

import com.offerflow.api.dto.BacklogItemDTO;
import com.offerflow.api.dto.CriticalPathDTO;
import com.offerflow.api.dto.DependencyDTO;
import com.offerflow.api.dto.StoryEstimateDTO;
import com.offerflow.domain.dependency.adapter.repository.IDependencyRepository;
import com.offerflow.domain.dependency.model.entity.DependencyEntity;
import com.offerflow.domain.dependency.model.valobj.CriticalPathResult;
import com.offerflow.domain.dependency.service.DependencyGraphDomainService;
import com.offerflow.domain.dependency.service.StoryDurationResolver;
import com.offerflow.domain.estimation.adapter.repository.IStoryEstimateRepository;
import com.offerflow.domain.estimation.model.entity.StoryEstimateEntity;
import com.offerflow.domain.estimation.service.BacklogRankingDomainService;
import com.offerflow.domain.workitem.adapter.gateway.IWorkItemCatalog;
import com.offerflow.domain.workitem.model.valobj.CatalogStory;
import com.offerflow.trigger.application.common.EnumCodeParser;
import com.offerflow.trigger.application.common.PlanningProperties;
import com.offerflow.trigger.application.common.PlanningViewAssembler;
import com.offerflow.types.enums.DependencyStatusEnum;
import com.offerflow.types.enums.PrioritizationModelEnum;
import com.offerflow.types.enums.ResponseCode;
import com.offerflow.types.exception.AppException;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 依赖、关键路径、估算与待办排序读用例。
 */
@Service
public class PlanningQueryService {

    private final IDependencyRepository dependencyRepository;
    private final IStoryEstimateRepository storyEstimateRepository;
    private final IWorkItemCatalog workItemCatalog;
    private final DependencyGraphDomainService dependencyGraphDomainService;
    private final BacklogRankingDomainService backlogRankingDomainService;
    private final PlanningViewAssembler planningViewAssembler;
    private final PlanningProperties planningProperties;

    public PlanningQueryService(IDependencyRepository dependencyRepository,
                                IStoryEstimateRepository storyEstimateRepository,
                                IWorkItemCatalog workItemCatalog,
                                DependencyGraphDomainService dependencyGraphDomainService,
                                BacklogRankingDomainService backlogRankingDomainService,
                                PlanningViewAssembler planningViewAssembler,
                                PlanningProperties planningProperties) {
        this.dependencyRepository = dependencyRepository;
        this.storyEstimateRepository = storyEstimateRepository;
        this.workItemCatalog = workItemCatalog;
        this.dependencyGraphDomainService = dependencyGraphDomainService;
        this.backlogRankingDomainService = backlogRankingDomainService;
        this.planningViewAssembler = planningViewAssembler;
        this.planningProperties = planningProperties;
    }

    public List<DependencyDTO> listDependencies(Long projectId, String statusCode) {
        DependencyStatusEnum status = EnumCodeParser.optional(statusCode, DependencyStatusEnum::fromCode, "status");
        List<DependencyEntity> dependencies = status == null
                ? dependencyRepository.findByProjectId(projectId)
                : dependencyRepository.findByProjectIdAndStatus(projectId, status);
        return planningViewAssembler.toDependencyDTOs(dependencies);
    }

    /**
     * 关键路径。故事节点优先取 P50 估算，其次故事粗估工时，其余节点取默认时长。
     */
    public CriticalPathDTO criticalPath(Long projectId) {
        requireProject(projectId);
        List<DependencyEntity> dependencies = dependencyRepository.findByProjectId(projectId);
        List<CatalogStory> stories = workItemCatalog.findStoriesByProject(projectId);
        Map<Long, Double> estimatedHours = new HashMap<>();
        List<Long> storyIds = new ArrayList<>();
        for (CatalogStory story : stories) {
            storyIds.add(story.getId());
            if (story.getEstimatedHours() != null) {
                estimatedHours.put(story.getId(), story.getEstimatedHours());
            }
        }
        Map<Long, Double> p50 = new HashMap<>();
        for (StoryEstimateEntity estimate : storyEstimateRepository.findByStoryIds(storyIds)) {
            if (estimate.getEstimateP50() != null) {
                p50.put(estimate.getStoryId(), estimate.getEstimateP50());
            }
        }
        StoryDurationResolver resolver = new StoryDurationResolver(p50, estimatedHours,
                planningProperties.getDefaultNodeDurationHours());
        CriticalPathResult result = dependencyGraphDomainService.computeCriticalPath(dependencies, resolver);
        return planningViewAssembler.toCriticalPathDTO(projectId, result);
    }

    public List<BacklogItemDTO> backlog(Long projectId, String modelCode) {
        requireProject(projectId);
        PrioritizationModelEnum model = EnumCodeParser.optional(modelCode, PrioritizationModelEnum::fromCode, "model");
        List<CatalogStory> stories = workItemCatalog.findStoriesByProject(projectId);
        List<Long> storyIds = new ArrayList<>();
        for (CatalogStory story : stories) {
            storyIds.add(story.getId());
        }
        Map<Long, StoryEstimateEntity> estimates = new HashMap<>();
        for (StoryEstimateEntity estimate : storyEstimateRepository.findByStoryIds(storyIds)) {
            estimates.put(estimate.getStoryId(), estimate);
        }
        return planningViewAssembler.toBacklogDTOs(
                backlogRankingDomainService.rank(stories, estimates,
                        model == null ? PrioritizationModelEnum.RICE : model));
    }

    public StoryEstimateDTO getEstimate(Long storyId) {
        StoryEstimateEntity estimate = storyId == null ? null : storyEstimateRepository.findByStoryId(storyId);
        if (estimate == null) {
            throw new AppException(ResponseCode.NOT_FOUND, "故事估算不存在: " + storyId);
        }
        return planningViewAssembler.toEstimateDTO(estimate);
    }

    private void requireProject(Long projectId) {
        if (!workItemCatalog.projectExists(projectId)) {
            throw new AppException(ResponseCode.NOT_FOUND, "项目不存在: " + projectId);
        }
    }
}
