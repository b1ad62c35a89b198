package com.offerflow.infrastructure.repository.estimation;

import com.offerflow.domain.estimation.adapter.repository.IStoryEstimateRepository;
import com.offerflow.domain.estimation.model.entity.StoryEstimateEntity;
import com.offerflow.infrastructure.dao.StoryEstimateDao;
import com.offerflow.infrastructure.dao.po.StoryEstimatePO;
import com.offerflow.types.enums.ResponseCode;
import com.offerflow.types.exception.AppException;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 故事估算仓储实现类。
 */
@Repository
public class StoryEstimateRepositoryImpl implements IStoryEstimateRepository {

    private final StoryEstimateDao storyEstimateDao;

    public StoryEstimateRepositoryImpl(StoryEstimateDao storyEstimateDao) {
        this.storyEstimateDao = storyEstimateDao;
    }

    @Override
    public StoryEstimateEntity save(StoryEstimateEntity entity) {
        entity.validate();
        StoryEstimatePO po = toPO(entity);
        storyEstimateDao.insert(po);
        return toEntity(po);
    }

    @Override
    public StoryEstimateEntity update(StoryEstimateEntity entity) {
        entity.validate();
        StoryEstimatePO po = toPO(entity);
        if (storyEstimateDao.update(po) == 0) {
            throw new AppException(ResponseCode.NOT_FOUND, "估算不存在: storyId=" + entity.getStoryId());
        }
        return toEntity(po);
    }

    @Override
    public StoryEstimateEntity findByStoryId(Long storyId) {
        return toEntity(storyEstimateDao.selectByStoryId(storyId));
    }

    @Override
    public List<StoryEstimateEntity> findByStoryIds(Collection<Long> storyIds) {
        if (storyIds == null || storyIds.isEmpty()) {
            return Collections.emptyList();
        }
        return storyEstimateDao.selectByStoryIds(storyIds).stream()
                .map(this::toEntity)
                .collect(Collectors.toList());
    }

    private StoryEstimateEntity toEntity(StoryEstimatePO po) {
        if (po == null) {
            return null;
        }
        StoryEstimateEntity entity = new StoryEstimateEntity();
        entity.setId(po.getId());
        entity.setStoryId(po.getStoryId());
        entity.setEstimateP10(po.getEstimateP10());
        entity.setEstimateP50(po.getEstimateP50());
        entity.setEstimateP90(po.getEstimateP90());
        entity.setRiceReach(po.getRiceReach());
        entity.setRiceImpact(po.getRiceImpact());
        entity.setRiceConfidence(po.getRiceConfidence());
        entity.setRiceEffort(po.getRiceEffort());
        entity.setRiceScore(po.getRiceScore());
        entity.setWsjfBusinessValue(po.getWsjfBusinessValue());
        entity.setWsjfTimeCriticality(po.getWsjfTimeCriticality());
        entity.setWsjfRiskReduction(po.getWsjfRiskReduction());
        entity.setWsjfJobSize(po.getWsjfJobSize());
        entity.setWsjfScore(po.getWsjfScore());
        entity.setCodWeekly(po.getCodWeekly());
        entity.setCodUrgencyProfile(po.getCodUrgencyProfile());
        entity.setAiEstimateP10(po.getAiEstimateP10());
        entity.setAiEstimateP50(po.getAiEstimateP50());
        entity.setAiEstimateP90(po.getAiEstimateP90());
        entity.setAiConfidence(po.getAiConfidence());
        entity.setAiReasoning(po.getAiReasoning());
        entity.setCreatedAt(po.getCreatedAt());
        entity.setUpdatedAt(po.getUpdatedAt());
        return entity;
    }

    private StoryEstimatePO toPO(StoryEstimateEntity entity) {
        return StoryEstimatePO.builder()
                .id(entity.getId())
                .storyId(entity.getStoryId())
                .estimateP10(entity.getEstimateP10())
                .estimateP50(entity.getEstimateP50())
                .estimateP90(entity.getEstimateP90())
                .riceReach(entity.getRiceReach())
                .riceImpact(entity.getRiceImpact())
                .riceConfidence(entity.getRiceConfidence())
                .riceEffort(entity.getRiceEffort())
                .riceScore(entity.getRiceScore())
                .wsjfBusinessValue(entity.getWsjfBusinessValue())
                .wsjfTimeCriticality(entity.getWsjfTimeCriticality())
                .wsjfRiskReduction(entity.getWsjfRiskReduction())
                .wsjfJobSize(entity.getWsjfJobSize())
                .wsjfScore(entity.getWsjfScore())
                .codWeekly(entity.getCodWeekly())
                .codUrgencyProfile(entity.getCodUrgencyProfile())
                .aiEstimateP10(entity.getAiEstimateP10())
                .aiEstimateP50(entity.getAiEstimateP50())
                .aiEstimateP90(entity.getAiEstimateP90())
                .aiConfidence(entity.getAiConfidence())
                .aiReasoning(entity.getAiReasoning())
                .createdAt(entity.getCreatedAt())
                .updatedAt(entity.getUpdatedAt())
                .build();
    }
}
