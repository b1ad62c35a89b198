package com.offerflow.trigger.http;

import com.offerflow.api.dto.AssumptionCreateRequestDTO;
import com.offerflow.api.dto.AssumptionDTO;
import com.offerflow.api.dto.AssumptionUpdateRequestDTO;
import com.offerflow.api.dto.DecisionCreateRequestDTO;
import com.offerflow.api.dto.DecisionDTO;
import com.offerflow.api.dto.DecisionUpdateRequestDTO;
import com.offerflow.api.response.Response;
import com.offerflow.trigger.application.command.AssumptionCommandService;
import com.offerflow.trigger.application.command.DecisionCommandService;
import com.offerflow.trigger.application.query.DecisionLogQueryService;
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
 * 项目决策记录与假设登记 API。
 */
@RestController
@RequestMapping("/api/planning")
public class DecisionLogController {

    private final DecisionCommandService decisionCommandService;
    private final AssumptionCommandService assumptionCommandService;
    private final DecisionLogQueryService decisionLogQueryService;

    public DecisionLogController(DecisionCommandService decisionCommandService,
                                 AssumptionCommandService assumptionCommandService,
                                 DecisionLogQueryService decisionLogQueryService) {
        this.decisionCommandService = decisionCommandService;
        this.assumptionCommandService = assumptionCommandService;
        this.decisionLogQueryService = decisionLogQueryService;
    }

    @GetMapping("/projects/{projectId}/decisions")
    public Response<List<DecisionDTO>> listDecisions(@PathVariable("projectId") Long projectId,
                                                     @RequestParam(value = "status", required = false) String status) {
        return success(decisionLogQueryService.listDecisions(projectId, status));
    }

    @PostMapping("/projects/{projectId}/decisions")
    public Response<DecisionDTO> createDecision(@PathVariable("projectId") Long projectId,
                                                @RequestBody DecisionCreateRequestDTO request) {
        return success(decisionCommandService.createDecision(projectId, request));
    }

    @PutMapping("/decisions/{decisionId}")
    public Response<DecisionDTO> updateDecision(@PathVariable("decisionId") Long decisionId,
                                                @RequestBody DecisionUpdateRequestDTO request) {
        return success(decisionCommandService.updateDecision(decisionId, request));
    }

    @DeleteMapping("/decisions/{decisionId}")
    public Response<Boolean> deleteDecision(@PathVariable("decisionId") Long decisionId) {
        decisionCommandService.deleteDecision(decisionId);
        return success(Boolean.TRUE);
    }

    @GetMapping("/projects/{projectId}/assumptions")
    public Response<List<AssumptionDTO>> listAssumptions(@PathVariable("projectId") Long projectId,
                                                         @RequestParam(value = "status", required = false) String status,
                                                         @RequestParam(value = "riskLevel", required = false) String riskLevel) {
        return success(decisionLogQueryService.listAssumptions(projectId, status, riskLevel));
    }

    @PostMapping("/projects/{projectId}/assumptions")
    public Response<AssumptionDTO> createAssumption(@PathVariable("projectId") Long projectId,
                                                    @RequestBody AssumptionCreateRequestDTO request) {
        return success(assumptionCommandService.createAssumption(projectId, request));
    }

    @PutMapping("/assumptions/{assumptionId}")
    public Response<AssumptionDTO> updateAssumption(@PathVariable("assumptionId") Long assumptionId,
                                                    @RequestBody AssumptionUpdateRequestDTO request) {
        return success(assumptionCommandService.updateAssumption(assumptionId, request));
    }

    @DeleteMapping("/assumptions/{assumptionId}")
    public Response<Boolean> deleteAssumption(@PathVariable("assumptionId") Long assumptionId) {
        assumptionCommandService.deleteAssumption(assumptionId);
        return success(Boolean.TRUE);
    }

    private <T> Response<T> success(T data) {
        return Response.<T>builder()
                .code(ResponseCode.SUCCESS.getCode())
                .info(ResponseCode.SUCCESS.getInfo())
                .data(data)
                .build();
    }
}
