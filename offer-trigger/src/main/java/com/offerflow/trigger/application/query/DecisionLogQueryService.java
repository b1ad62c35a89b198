package com.offerflow.trigger.application.query;

import com.offerflow.api.dto.AssumptionDTO;
import com.offerflow.api.dto.DecisionDTO;
import com.offerflow.domain.decisionlog.adapter.repository.IAssumptionRepository;
import com.offerflow.domain.decisionlog.adapter.repository.IDecisionRepository;
import com.offerflow.trigger.application.common.DecisionLogViewAssembler;
import com.offerflow.trigger.application.common.EnumCodeParser;
import com.offerflow.types.enums.AssumptionRiskEnum;
import com.offerflow.types.enums.AssumptionStatusEnum;
import com.offerflow.types.enums.DecisionStatusEnum;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * 决策与假设读用例。项目不存在时返回空列表。
 */
@Service
public class DecisionLogQueryService {

    private final IDecisionRepository decisionRepository;
    private final IAssumptionRepository assumptionRepository;
    private final DecisionLogViewAssembler decisionLogViewAssembler;

    public DecisionLogQueryService(IDecisionRepository decisionRepository,
                                   IAssumptionRepository assumptionRepository,
                                   DecisionLogViewAssembler decisionLogViewAssembler) {
        this.decisionRepository = decisionRepository;
        this.assumptionRepository = assumptionRepository;
        this.decisionLogViewAssembler = decisionLogViewAssembler;
    }

    public List<DecisionDTO> listDecisions(Long projectId, String statusCode) {
        DecisionStatusEnum status = EnumCodeParser.optional(statusCode, DecisionStatusEnum::fromCode, "status");
        return decisionLogViewAssembler.toDecisionDTOs(decisionRepository.findByProjectId(projectId, status));
    }

    public List<AssumptionDTO> listAssumptions(Long projectId, String statusCode, String riskLevelCode) {
        AssumptionStatusEnum status = EnumCodeParser.optional(statusCode, AssumptionStatusEnum::fromCode, "status");
        AssumptionRiskEnum riskLevel = EnumCodeParser.optional(riskLevelCode, AssumptionRiskEnum::fromCode,
                "riskLevel");
        return decisionLogViewAssembler.toAssumptionDTOs(
                assumptionRepository.findByProjectId(projectId, status, riskLevel));
    }
}
