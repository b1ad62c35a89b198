package com.offerflow.trigger.application.command;

import com.offerflow.api.dto.DecisionCreateRequestDTO;
import com.offerflow.api.dto.DecisionDTO;
import com.offerflow.api.dto.DecisionUpdateRequestDTO;
import com.offerflow.domain.decisionlog.adapter.repository.IDecisionRepository;
import com.offerflow.domain.decisionlog.model.entity.DecisionEntity;
import com.offerflow.domain.workitem.adapter.gateway.IWorkItemCatalog;
import com.offerflow.trigger.application.common.DecisionLogViewAssembler;
import com.offerflow.trigger.application.common.EnumCodeParser;
import com.offerflow.types.enums.DecisionStatusEnum;
import com.offerflow.types.enums.ResponseCode;
import com.offerflow.types.exception.AppException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;

/**
 * 决策记录写用例。
 * <p>
 * 修改时 title 与 decision 传空白视为不修改，其余文本字段传空串即清空。
 * </p>
 */
@Slf4j
@Service
public class DecisionCommandService {

    private final IDecisionRepository decisionRepository;
    private final IWorkItemCatalog workItemCatalog;
    private final DecisionLogViewAssembler decisionLogViewAssembler;
    private final Clock clock;

    public DecisionCommandService(IDecisionRepository decisionRepository,
                                  IWorkItemCatalog workItemCatalog,
                                  DecisionLogViewAssembler decisionLogViewAssembler,
                                  Clock clock) {
        this.decisionRepository = decisionRepository;
        this.workItemCatalog = workItemCatalog;
        this.decisionLogViewAssembler = decisionLogViewAssembler;
        this.clock = clock;
    }

    @Transactional(rollbackFor = Exception.class)
    public DecisionDTO createDecision(Long projectId, DecisionCreateRequestDTO request) {
        if (request == null) {
            throw illegal("请求体不能为空");
        }
        if (StringUtils.isBlank(request.getTitle())) {
            throw illegal("title 不能为空");
        }
        if (StringUtils.isBlank(request.getDecision())) {
            throw illegal("decision 不能为空");
        }
        if (projectId == null || !workItemCatalog.projectExists(projectId)) {
            throw new AppException(ResponseCode.NOT_FOUND, "项目不存在: " + projectId);
        }
        DecisionEntity saved = decisionRepository.save(DecisionEntity.create(projectId,
                StringUtils.trim(request.getTitle()),
                request.getContext(),
                request.getDecision(),
                request.getRationale(),
                request.getAlternatives(),
                request.getConsequences(),
                request.getDecisionMaker(),
                LocalDateTime.now(clock)));
        log.info("Decision recorded. projectId={}, decisionId={}", projectId, saved.getId());
        return decisionLogViewAssembler.toDecisionDTO(saved);
    }

    @Transactional(rollbackFor = Exception.class)
    public DecisionDTO updateDecision(Long decisionId, DecisionUpdateRequestDTO request) {
        if (request == null) {
            throw illegal("请求体不能为空");
        }
        DecisionStatusEnum status = EnumCodeParser.optional(request.getStatus(), DecisionStatusEnum::fromCode, "status");
        DecisionEntity decision = requireDecision(decisionId);
        LocalDateTime now = LocalDateTime.now(clock);
        DecisionStatusEnum previous = decision.getStatus();
        if (StringUtils.isNotBlank(request.getTitle())) {
            decision.setTitle(StringUtils.trim(request.getTitle()));
        }
        if (request.getContext() != null) {
            decision.setContext(request.getContext());
        }
        if (StringUtils.isNotBlank(request.getDecision())) {
            decision.setDecision(request.getDecision());
        }
        if (request.getRationale() != null) {
            decision.setRationale(request.getRationale());
        }
        if (request.getAlternatives() != null) {
            decision.setAlternatives(new ArrayList<>(request.getAlternatives()));
        }
        if (request.getConsequences() != null) {
            decision.setConsequences(request.getConsequences());
        }
        if (request.getDecisionMaker() != null) {
            decision.setDecisionMaker(request.getDecisionMaker());
        }
        decision.setUpdatedAt(now);
        decision.changeStatus(status, now);
        DecisionEntity updated = decisionRepository.update(decision);
        if (status != null && status != previous) {
            log.info("Decision status changed. decisionId={}, from={}, to={}", decisionId, previous, status);
        }
        return decisionLogViewAssembler.toDecisionDTO(updated);
    }

    @Transactional(rollbackFor = Exception.class)
    public void deleteDecision(Long decisionId) {
        if (decisionId == null || !decisionRepository.deleteById(decisionId)) {
            throw new AppException(ResponseCode.NOT_FOUND, "决策不存在: " + decisionId);
        }
        log.info("Decision deleted. decisionId={}", decisionId);
    }

    private DecisionEntity requireDecision(Long decisionId) {
        DecisionEntity decision = decisionId == null ? null : decisionRepository.findById(decisionId);
        if (decision == null) {
            throw new AppException(ResponseCode.NOT_FOUND, "决策不存在: " + decisionId);
        }
        return decision;
    }

    private AppException illegal(String message) {
        return new AppException(ResponseCode.ILLEGAL_PARAMETER, message);
    }
}
