package com.offerflow.test.support;

import com.offerflow.domain.estimation.adapter.repository.IStoryEstimateRepository;
import com.offerflow.domain.estimation.model.entity.StoryEstimateEntity;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 内存故事估算仓储，以 storyId 为唯一键。
 */
public class InMemoryStoryEstimateRepository implements IStoryEstimateRepository {

    private final Map<Long, StoryEstimateEntity> byStoryId = new LinkedHashMap<>();
    private long nextId = 1;

    @Override
    public StoryEstimateEntity save(StoryEstimateEntity entity) {
        if (byStoryId.containsKey(entity.getStoryId())) {
            throw new IllegalStateException("duplicate story estimate: " + entity.getStoryId());
        }
        entity.setId(nextId++);
        byStoryId.put(entity.getStoryId(), entity);
        return entity;
    }

    @Override
    public StoryEstimateEntity update(StoryEstimateEntity entity) {
        byStoryId.put(entity.getStoryId(), entity);
        return entity;
    }

    @Override
    public StoryEstimateEntity findByStoryId(Long storyId) {
        return byStoryId.get(storyId);
    }

    @Override
    public List<StoryEstimateEntity> findByStoryIds(Collection<Long> storyIds) {
        List<StoryEstimateEntity> result = new ArrayList<>();
        for (Long storyId : storyIds) {
            StoryEstimateEntity estimate = byStoryId.get(storyId);
            if (estimate != null) {
                result.add(estimate);
            }
        }
        return result;
    }

    public int size() {
        return byStoryId.size();
    }
}
