package com.offerflow.trigger.application.command;

import com.offerflow.api.dto.AssumptionCreateRequestDTO;
import com.offerflow.api.dto.AssumptionDTO;
import com.offerflow.api.dto.AssumptionUpdateRequestDTO;
import com.offerflow.domain.decisionlog.adapter.repository.IAssumptionRepository;
import com.offerflow.domain.decisionlog.model.entity.AssumptionEntity;
import com.offerflow.domain.workitem.adapter.gateway.IWorkItemCatalog;
import com.offerflow.trigger.application.common.DecisionLogViewAssembler;
import com.offerflow.trigger.application.common.EnumCodeParser;
import com.offerflow.types.enums.AssumptionRiskEnum;
import com.offerflow.types.enums.AssumptionStatusEnum;
import com.offerflow.types.enums.ResponseCode;
import com.offerflow.types.exception.AppException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * 项目假设写用例。状态切到 validated / invalidated 时记录结论时间。
 */
@Slf4j
@Service
public class AssumptionCommandService {

    private final IAssumptionRepository assumptionRepository;
    private final IWorkItemCatalog workItemCatalog;
    private final DecisionLogViewAssembler decisionLogViewAssembler;
    private final Clock clock;

    public AssumptionCommandService(IAssumptionRepository assumptionRepository,
                                    IWorkItemCatalog workItemCatalog,
                                    DecisionLogViewAssembler decisionLogViewAssembler,
                                    Clock clock) {
        this.assumptionRepository = assumptionRepository;
        this.workItemCatalog = workItemCatalog;
        this.decisionLogViewAssembler = decisionLogViewAssembler;
        this.clock = clock;
    }

    @Transactional(rollbackFor = Exception.class)
    public AssumptionDTO createAssumption(Long projectId, AssumptionCreateRequestDTO request) {
        if (request == null) {
            throw illegal("请求体不能为空");
        }
        if (StringUtils.isBlank(request.getAssumption())) {
            throw illegal("assumption 不能为空");
        }
        AssumptionRiskEnum riskLevel = EnumCodeParser.optional(request.getRiskLevel(),
                AssumptionRiskEnum::fromCode, "riskLevel");
        if (projectId == null || !workItemCatalog.projectExists(projectId)) {
            throw new AppException(ResponseCode.NOT_FOUND, "项目不存在: " + projectId);
        }
        AssumptionEntity saved = assumptionRepository.save(AssumptionEntity.create(projectId,
                request.getAssumption(),
                request.getContext(),
                request.getImpactIfWrong(),
                riskLevel,
                request.getValidationMethod(),
                request.getValidationOwner(),
                request.getValidationDeadline(),
                LocalDateTime.now(clock)));
        log.info("Assumption recorded. projectId={}, assumptionId={}, risk={}",
                projectId, saved.getId(), saved.getRiskLevel());
        return decisionLogViewAssembler.toAssumptionDTO(saved);
    }

    @Transactional(rollbackFor = Exception.class)
    public AssumptionDTO updateAssumption(Long assumptionId, AssumptionUpdateRequestDTO request) {
        if (request == null) {
            throw illegal("请求体不能为空");
        }
        AssumptionStatusEnum status = EnumCodeParser.optional(request.getStatus(),
                AssumptionStatusEnum::fromCode, "status");
        AssumptionRiskEnum riskLevel = EnumCodeParser.optional(request.getRiskLevel(),
                AssumptionRiskEnum::fromCode, "riskLevel");
        AssumptionEntity assumption = requireAssumption(assumptionId);
        LocalDateTime now = LocalDateTime.now(clock);
        AssumptionStatusEnum previous = assumption.getStatus();
        if (StringUtils.isNotBlank(request.getAssumption())) {
            assumption.setAssumption(request.getAssumption());
        }
        if (request.getContext() != null) {
            assumption.setContext(request.getContext());
        }
        if (request.getImpactIfWrong() != null) {
            assumption.setImpactIfWrong(request.getImpactIfWrong());
        }
        if (riskLevel != null) {
            assumption.setRiskLevel(riskLevel);
        }
        if (request.getValidationMethod() != null) {
            assumption.setValidationMethod(request.getValidationMethod());
        }
        if (request.getValidationOwner() != null) {
            assumption.setValidationOwner(request.getValidationOwner());
        }
        if (request.getValidationDeadline() != null) {
            assumption.setValidationDeadline(request.getValidationDeadline());
        }
        if (request.getValidationResult() != null) {
            assumption.setValidationResult(request.getValidationResult());
        }
        assumption.setUpdatedAt(now);
        assumption.changeStatus(status, now);
        AssumptionEntity updated = assumptionRepository.update(assumption);
        if (status != null && status != previous) {
            log.info("Assumption status changed. assumptionId={}, from={}, to={}", assumptionId, previous, status);
        }
        return decisionLogViewAssembler.toAssumptionDTO(updated);
    }

    @Transactional(rollbackFor = Exception.class)
    public void deleteAssumption(Long assumptionId) {
        if (assumptionId == null || !assumptionRepository.deleteById(assumptionId)) {
            throw new AppException(ResponseCode.NOT_FOUND, "假设不存在: " + assumptionId);
        }
        log.info("Assumption deleted. assumptionId={}", assumptionId);
    }

    private AssumptionEntity requireAssumption(Long assumptionId) {
        AssumptionEntity assumption = assumptionId == null ? null : assumptionRepository.findById(assumptionId);
        if (assumption == null) {
            throw new AppException(ResponseCode.NOT_FOUND, "假设不存在: " + assumptionId);
        }
        return assumption;
    }

    private AppException illegal(String message) {
        return new AppException(ResponseCode.ILLEGAL_PARAMETER, message);
    }
}
