package com.offerflow.domain.estimation.adapter.repository;

import com.offerflow.domain.estimation.model.entity.StoryEstimateEntity;

import java.util.Collection;
import java.util.List;

/**
 * 故事估算仓储接口
 */
public interface IStoryEstimateRepository {

    StoryEstimateEntity save(StoryEstimateEntity entity);

    StoryEstimateEntity update(StoryEstimateEntity entity);

    StoryEstimateEntity findByStoryId(Long storyId);

    List<StoryEstimateEntity> findByStoryIds(Collection<Long> storyIds);
}
