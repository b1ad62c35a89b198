package com.offerflow.trigger.http;

import com.offerflow.api.dto.AiGenerateRequestDTO;
import com.offerflow.api.dto.BacklogItemDTO;
import com.offerflow.api.dto.CostOfDelayRequestDTO;
import com.offerflow.api.dto.CriticalPathDTO;
import com.offerflow.api.dto.DependencyCreateRequestDTO;
import com.offerflow.api.dto.DependencyDTO;
import com.offerflow.api.dto.DependencyInferenceResultDTO;
import com.offerflow.api.dto.DependencyStatusUpdateRequestDTO;
import com.offerflow.api.dto.RangeEstimateRequestDTO;
import com.offerflow.api.dto.RiceInputRequestDTO;
import com.offerflow.api.dto.StoryEstimateDTO;
import com.offerflow.api.dto.WsjfInputRequestDTO;
import com.offerflow.api.response.Response;
import com.offerflow.trigger.application.command.DependencyCommandService;
import com.offerflow.trigger.application.command.EstimationCommandService;
import com.offerflow.trigger.application.command.ModelAssistedPlanningService;
import com.offerflow.trigger.application.common.LlmProviderConfigResolver;
import com.offerflow.trigger.application.query.PlanningQueryService;
import com.offerflow.types.enums.ResponseCode;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * 依赖、关键路径、估算与待办排序 API。
 */
@RestController
@RequestMapping("/api/planning")
public class PlanningController {

    private final DependencyCommandService dependencyCommandService;
    private final EstimationCommandService estimationCommandService;
    private final PlanningQueryService planningQueryService;
    private final ModelAssistedPlanningService modelAssistedPlanningService;
    private final LlmProviderConfigResolver llmProviderConfigResolver;

    public PlanningController(DependencyCommandService dependencyCommandService,
                              EstimationCommandService estimationCommandService,
                              PlanningQueryService planningQueryService,
                              ModelAssistedPlanningService modelAssistedPlanningService,
                              LlmProviderConfigResolver llmProviderConfigResolver) {
        this.dependencyCommandService = dependencyCommandService;
        this.estimationCommandService = estimationCommandService;
        this.planningQueryService = planningQueryService;
        this.modelAssistedPlanningService = modelAssistedPlanningService;
        this.llmProviderConfigResolver = llmProviderConfigResolver;
    }

    @GetMapping("/projects/{projectId}/dependencies")
    public Response<List<DependencyDTO>> listDependencies(@PathVariable("projectId") Long projectId,
                                                          @RequestParam(value = "status", required = false) String status) {
        return success(planningQueryService.listDependencies(projectId, status));
    }

    @PostMapping("/projects/{projectId}/dependencies")
    public Response<DependencyDTO> addDependency(@PathVariable("projectId") Long projectId,
                                                 @RequestBody DependencyCreateRequestDTO request) {
        return success(dependencyCommandService.addDependency(projectId, request));
    }

    @PutMapping("/dependencies/{dependencyId}")
    public Response<DependencyDTO> updateDependencyStatus(@PathVariable("dependencyId") Long dependencyId,
                                                          @RequestBody DependencyStatusUpdateRequestDTO request) {
        return success(dependencyCommandService.updateStatus(dependencyId, request));
    }

    @DeleteMapping("/dependencies/{dependencyId}")
    public Response<Boolean> removeDependency(@PathVariable("dependencyId") Long dependencyId) {
        dependencyCommandService.removeDependency(dependencyId);
        return success(Boolean.TRUE);
    }

    @PostMapping("/projects/{projectId}/dependencies/infer")
    public Response<DependencyInferenceResultDTO> inferDependencies(@PathVariable("projectId") Long projectId,
                                                                    @RequestBody(required = false) AiGenerateRequestDTO request) {
        return success(modelAssistedPlanningService.inferDependencies(projectId,
                llmProviderConfigResolver.resolve(request == null ? null : request.getProvider(),
                        request == null ? null : request.getModel())));
    }

    @GetMapping("/projects/{projectId}/critical-path")
    public Response<CriticalPathDTO> criticalPath(@PathVariable("projectId") Long projectId) {
        return success(planningQueryService.criticalPath(projectId));
    }

    @GetMapping("/projects/{projectId}/prioritized-backlog")
    public Response<List<BacklogItemDTO>> backlog(@PathVariable("projectId") Long projectId,
                                                  @RequestParam(value = "model", required = false) String model) {
        return success(planningQueryService.backlog(projectId, model));
    }

    @GetMapping("/stories/{storyId}/estimate")
    public Response<StoryEstimateDTO> getEstimate(@PathVariable("storyId") Long storyId) {
        return success(planningQueryService.getEstimate(storyId));
    }

    @PostMapping("/stories/{storyId}/estimate/generate")
    public Response<StoryEstimateDTO> generateEstimate(@PathVariable("storyId") Long storyId,
                                                       @RequestBody(required = false) AiGenerateRequestDTO request) {
        return success(modelAssistedPlanningService.generateRangeEstimate(storyId,
                llmProviderConfigResolver.resolve(request == null ? null : request.getProvider(),
                        request == null ? null : request.getModel())));
    }

    @PutMapping("/stories/{storyId}/estimate/rice")
    public Response<StoryEstimateDTO> setRice(@PathVariable("storyId") Long storyId,
                                              @RequestBody RiceInputRequestDTO request) {
        return success(estimationCommandService.setRiceInputs(storyId, request));
    }

    @PutMapping("/stories/{storyId}/estimate/wsjf")
    public Response<StoryEstimateDTO> setWsjf(@PathVariable("storyId") Long storyId,
                                              @RequestBody WsjfInputRequestDTO request) {
        return success(estimationCommandService.setWsjfInputs(storyId, request));
    }

    @PutMapping("/stories/{storyId}/estimate/range")
    public Response<StoryEstimateDTO> setRange(@PathVariable("storyId") Long storyId,
                                               @RequestBody RangeEstimateRequestDTO request) {
        return success(estimationCommandService.setRangeEstimate(storyId, request));
    }

    @PutMapping("/stories/{storyId}/estimate/cost-of-delay")
    public Response<StoryEstimateDTO> setCostOfDelay(@PathVariable("storyId") Long storyId,
                                                     @RequestBody CostOfDelayRequestDTO request) {
        return success(estimationCommandService.setCostOfDelay(storyId, request));
    }

    private <T> Response<T> success(T data) {
        return Response.<T>builder()
                .code(ResponseCode.SUCCESS.getCode())
                .info(ResponseCode.SUCCESS.getInfo())
                .data(data)
                .build();
    }
}
