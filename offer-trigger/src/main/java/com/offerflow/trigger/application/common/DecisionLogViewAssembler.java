package com.offerflow.trigger.application.common;

import com.offerflow.api.dto.AssumptionDTO;
import com.offerflow.api.dto.DecisionDTO;
import com.offerflow.domain.decisionlog.model.entity.AssumptionEntity;
import com.offerflow.domain.decisionlog.model.entity.DecisionEntity;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * 决策与假设视图组装器
 */
@Component
public class DecisionLogViewAssembler {

    public DecisionDTO toDecisionDTO(DecisionEntity entity) {
        if (entity == null) {
            return null;
        }
        DecisionDTO dto = new DecisionDTO();
        dto.setId(entity.getId());
        dto.setProjectId(entity.getProjectId());
        dto.setTitle(entity.getTitle());
        dto.setContext(entity.getContext());
        dto.setDecision(entity.getDecision());
        dto.setRationale(entity.getRationale());
        dto.setAlternatives(entity.getAlternatives() == null ? null : new ArrayList<>(entity.getAlternatives()));
        dto.setConsequences(entity.getConsequences());
        dto.setStatus(entity.getStatus() == null ? null : entity.getStatus().getCode());
        dto.setDecisionMaker(entity.getDecisionMaker());
        dto.setDecisionDate(entity.getDecisionDate());
        dto.setExtractedFrom(entity.getExtractedFrom());
        dto.setCreatedAt(entity.getCreatedAt());
        dto.setUpdatedAt(entity.getUpdatedAt());
        return dto;
    }

    public List<DecisionDTO> toDecisionDTOs(List<DecisionEntity> entities) {
        List<DecisionDTO> result = new ArrayList<>();
        if (entities != null) {
            for (DecisionEntity entity : entities) {
                result.add(toDecisionDTO(entity));
            }
        }
        return result;
    }

    public AssumptionDTO toAssumptionDTO(AssumptionEntity entity) {
        if (entity == null) {
            return null;
        }
        AssumptionDTO dto = new AssumptionDTO();
        dto.setId(entity.getId());
        dto.setProjectId(entity.getProjectId());
        dto.setAssumption(entity.getAssumption());
        dto.setContext(entity.getContext());
        dto.setImpactIfWrong(entity.getImpactIfWrong());
        dto.setStatus(entity.getStatus() == null ? null : entity.getStatus().getCode());
        dto.setRiskLevel(entity.getRiskLevel() == null ? null : entity.getRiskLevel().getCode());
        dto.setValidationMethod(entity.getValidationMethod());
        dto.setValidationOwner(entity.getValidationOwner());
        dto.setValidationDeadline(entity.getValidationDeadline());
        dto.setValidationResult(entity.getValidationResult());
        dto.setValidatedAt(entity.getValidatedAt());
        dto.setExtractedFrom(entity.getExtractedFrom());
        dto.setCreatedAt(entity.getCreatedAt());
        dto.setUpdatedAt(entity.getUpdatedAt());
        return dto;
    }

    public List<AssumptionDTO> toAssumptionDTOs(List<AssumptionEntity> entities) {
        List<AssumptionDTO> result = new ArrayList<>();
        if (entities != null) {
            for (AssumptionEntity entity : entities) {
                result.add(toAssumptionDTO(entity));
            }
        }
        return result;
    }
}
