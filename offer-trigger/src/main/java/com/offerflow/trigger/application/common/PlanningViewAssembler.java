package com.offerflow.trigger.application.common;

import com.offerflow.api.dto.BacklogItemDTO;
import com.offerflow.api.dto.CriticalPathDTO;
import com.offerflow.api.dto.CriticalPathItemDTO;
import com.offerflow.api.dto.DependencyDTO;
import com.offerflow.api.dto.StoryEstimateDTO;
import com.offerflow.domain.dependency.model.entity.DependencyEntity;
import com.offerflow.domain.dependency.model.valobj.CriticalPathNode;
import com.offerflow.domain.dependency.model.valobj.CriticalPathResult;
import com.offerflow.domain.estimation.model.entity.StoryEstimateEntity;
import com.offerflow.domain.estimation.model.valobj.BacklogRankItem;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * 依赖、关键路径、估算与待办视图组装器。枚举统一输出小写编码。
 */
@Component
public class PlanningViewAssembler {

    public DependencyDTO toDependencyDTO(DependencyEntity entity) {
        if (entity == null) {
            return null;
        }
        DependencyDTO dto = new DependencyDTO();
        dto.setId(entity.getId());
        dto.setProjectId(entity.getProjectId());
        dto.setSourceType(entity.getSourceType() == null ? null : entity.getSourceType().getCode());
        dto.setSourceId(entity.getSourceId());
        dto.setTargetType(entity.getTargetType() == null ? null : entity.getTargetType().getCode());
        dto.setTargetId(entity.getTargetId());
        dto.setDependencyType(entity.getDependencyType() == null ? null : entity.getDependencyType().getCode());
        dto.setStatus(entity.getStatus() == null ? null : entity.getStatus().getCode());
        dto.setInferred(entity.getInferred());
        dto.setConfidence(entity.getConfidence());
        dto.setInferenceReason(entity.getInferenceReason());
        dto.setNotes(entity.getNotes());
        dto.setCreatedAt(entity.getCreatedAt());
        dto.setUpdatedAt(entity.getUpdatedAt());
        return dto;
    }

    public List<DependencyDTO> toDependencyDTOs(List<DependencyEntity> entities) {
        List<DependencyDTO> result = new ArrayList<>();
        if (entities != null) {
            for (DependencyEntity entity : entities) {
                result.add(toDependencyDTO(entity));
            }
        }
        return result;
    }

    public CriticalPathDTO toCriticalPathDTO(Long projectId, CriticalPathResult result) {
        CriticalPathDTO dto = new CriticalPathDTO();
        dto.setProjectId(projectId);
        List<CriticalPathItemDTO> items = new ArrayList<>();
        for (CriticalPathNode node : result.items()) {
            CriticalPathItemDTO item = new CriticalPathItemDTO();
            item.setItemType(node.item().type().getCode());
            item.setItemId(node.item().id());
            item.setDuration(node.duration());
            items.add(item);
        }
        dto.setItems(items);
        dto.setTotalDuration(result.totalDuration());
        dto.setCyclic(result.cyclic());
        return dto;
    }

    public StoryEstimateDTO toEstimateDTO(StoryEstimateEntity entity) {
        if (entity == null) {
            return null;
        }
        StoryEstimateDTO dto = new StoryEstimateDTO();
        dto.setId(entity.getId());
        dto.setStoryId(entity.getStoryId());
        dto.setEstimateP10(entity.getEstimateP10());
        dto.setEstimateP50(entity.getEstimateP50());
        dto.setEstimateP90(entity.getEstimateP90());
        dto.setPertExpectedHours(entity.pertExpectedHours());
        dto.setRiceReach(entity.getRiceReach());
        dto.setRiceImpact(entity.getRiceImpact());
        dto.setRiceConfidence(entity.getRiceConfidence());
        dto.setRiceEffort(entity.getRiceEffort());
        dto.setRiceScore(entity.getRiceScore());
        dto.setWsjfBusinessValue(entity.getWsjfBusinessValue());
        dto.setWsjfTimeCriticality(entity.getWsjfTimeCriticality());
        dto.setWsjfRiskReduction(entity.getWsjfRiskReduction());
        dto.setWsjfJobSize(entity.getWsjfJobSize());
        dto.setWsjfScore(entity.getWsjfScore());
        dto.setCodWeekly(entity.getCodWeekly());
        dto.setCodUrgencyProfile(entity.getCodUrgencyProfile());
        dto.setAiEstimateP10(entity.getAiEstimateP10());
        dto.setAiEstimateP50(entity.getAiEstimateP50());
        dto.setAiEstimateP90(entity.getAiEstimateP90());
        dto.setAiConfidence(entity.getAiConfidence());
        dto.setAiReasoning(entity.getAiReasoning());
        dto.setCreatedAt(entity.getCreatedAt());
        dto.setUpdatedAt(entity.getUpdatedAt());
        return dto;
    }

    public List<BacklogItemDTO> toBacklogDTOs(List<BacklogRankItem> items) {
        List<BacklogItemDTO> result = new ArrayList<>();
        if (items == null) {
            return result;
        }
        for (BacklogRankItem item : items) {
            BacklogItemDTO dto = new BacklogItemDTO();
            dto.setStoryId(item.getStoryId());
            dto.setEpicId(item.getEpicId());
            dto.setTitle(item.getTitle());
            dto.setStoryPoints(item.getStoryPoints());
            dto.setEstimatedHours(item.getEstimatedHours());
            dto.setScore(item.getScore());
            dto.setRiceScore(item.getRiceScore());
            dto.setWsjfScore(item.getWsjfScore());
            dto.setEstimateP50(item.getEstimateP50());
            dto.setPertExpectedHours(item.getPertExpectedHours());
            result.add(dto);
        }
        return result;
    }
}
