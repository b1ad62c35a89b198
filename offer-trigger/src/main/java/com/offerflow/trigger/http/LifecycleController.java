package com.offerflow.trigger.http;

import com.offerflow.api.dto.AiGenerateRequestDTO;
import com.offerflow.api.dto.LifecycleDeleteResultDTO;
import com.offerflow.api.dto.LifecycleGenerateResultDTO;
import com.offerflow.api.dto.LifecyclePhaseDTO;
import com.offerflow.api.dto.LifecycleSummaryDTO;
import com.offerflow.api.dto.PhaseApprovalRequestDTO;
import com.offerflow.api.dto.PhaseApprovalResultDTO;
import com.offerflow.api.dto.PhaseOverrideRequestDTO;
import com.offerflow.api.response.Response;
import com.offerflow.trigger.application.command.LifecycleCommandService;
import com.offerflow.trigger.application.command.ModelAssistedPlanningService;
import com.offerflow.trigger.application.common.LlmProviderConfigResolver;
import com.offerflow.trigger.application.query.LifecycleQueryService;
import com.offerflow.types.enums.ResponseCode;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * 生命周期阶段 API。
 */
@RestController
@RequestMapping("/api/lifecycle")
public class LifecycleController {

    private final LifecycleCommandService lifecycleCommandService;
    private final LifecycleQueryService lifecycleQueryService;
    private final ModelAssistedPlanningService modelAssistedPlanningService;
    private final LlmProviderConfigResolver llmProviderConfigResolver;

    public LifecycleController(LifecycleCommandService lifecycleCommandService,
                               LifecycleQueryService lifecycleQueryService,
                               ModelAssistedPlanningService modelAssistedPlanningService,
                               LlmProviderConfigResolver llmProviderConfigResolver) {
        this.lifecycleCommandService = lifecycleCommandService;
        this.lifecycleQueryService = lifecycleQueryService;
        this.modelAssistedPlanningService = modelAssistedPlanningService;
        this.llmProviderConfigResolver = llmProviderConfigResolver;
    }

    @PostMapping("/projects/{projectId}/initialize")
    public Response<List<LifecyclePhaseDTO>> initialize(@PathVariable("projectId") Long projectId) {
        return success(lifecycleCommandService.initialize(projectId));
    }

    @PostMapping("/projects/{projectId}/generate")
    public Response<LifecycleGenerateResultDTO> generate(@PathVariable("projectId") Long projectId,
                                                         @RequestBody(required = false) AiGenerateRequestDTO request) {
        return success(modelAssistedPlanningService.generateLifecycle(projectId,
                request == null ? null : request.getStartDate(),
                llmProviderConfigResolver.resolve(request == null ? null : request.getProvider(),
                        request == null ? null : request.getModel())));
    }

    @GetMapping("/projects/{projectId}")
    public Response<LifecycleSummaryDTO> summary(@PathVariable("projectId") Long projectId) {
        return success(lifecycleQueryService.summary(projectId));
    }

    @DeleteMapping("/projects/{projectId}")
    public Response<LifecycleDeleteResultDTO> delete(@PathVariable("projectId") Long projectId) {
        return success(lifecycleCommandService.delete(projectId));
    }

    @GetMapping("/phases/{phaseId}")
    public Response<LifecyclePhaseDTO> getPhase(@PathVariable("phaseId") Long phaseId) {
        return success(lifecycleQueryService.getPhase(phaseId));
    }

    @PostMapping("/phases/{phaseId}/start")
    public Response<LifecyclePhaseDTO> start(@PathVariable("phaseId") Long phaseId) {
        return success(lifecycleCommandService.start(phaseId));
    }

    @PostMapping("/phases/{phaseId}/submit-for-approval")
    public Response<LifecyclePhaseDTO> submitForApproval(@PathVariable("phaseId") Long phaseId) {
        return success(lifecycleCommandService.submitForApproval(phaseId));
    }

    @PostMapping("/phases/{phaseId}/approve")
    public Response<PhaseApprovalResultDTO> approve(@PathVariable("phaseId") Long phaseId,
                                                    @RequestBody PhaseApprovalRequestDTO request) {
        return success(lifecycleCommandService.approve(phaseId, request));
    }

    @PostMapping("/phases/{phaseId}/override")
    public Response<LifecyclePhaseDTO> override(@PathVariable("phaseId") Long phaseId,
                                                @RequestBody PhaseOverrideRequestDTO request) {
        return success(lifecycleCommandService.override(phaseId, request));
    }

    private <T> Response<T> success(T data) {
        return Response.<T>builder()
                .code(ResponseCode.SUCCESS.getCode())
                .info(ResponseCode.SUCCESS.getInfo())
                .data(data)
                .build();
    }
}
