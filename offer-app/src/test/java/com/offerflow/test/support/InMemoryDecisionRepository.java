package com.offerflow.test.support;

import com.offerflow.domain.decisionlog.adapter.repository.IDecisionRepository;
import com.offerflow.domain.decisionlog.model.entity.DecisionEntity;
import com.offerflow.types.enums.DecisionStatusEnum;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * 内存决策仓储，按创建时间倒序返回。
 */
public class InMemoryDecisionRepository implements IDecisionRepository {

    private final Map<Long, DecisionEntity> store = new TreeMap<>();
    private long nextId = 1;

    @Override
    public DecisionEntity save(DecisionEntity entity) {
        entity.validate();
        if (entity.getId() == null) {
            entity.setId(nextId++);
        }
        store.put(entity.getId(), entity);
        return entity;
    }

    @Override
    public DecisionEntity update(DecisionEntity entity) {
        entity.validate();
        store.put(entity.getId(), entity);
        return entity;
    }

    @Override
    public boolean deleteById(Long id) {
        return store.remove(id) != null;
    }

    @Override
    public DecisionEntity findById(Long id) {
        return store.get(id);
    }

    @Override
    public List<DecisionEntity> findByProjectId(Long projectId, DecisionStatusEnum status) {
        return store.values().stream()
                .filter(item -> Objects.equals(projectId, item.getProjectId()))
                .filter(item -> status == null || item.getStatus() == status)
                .sorted(Comparator.comparing(DecisionEntity::getCreatedAt)
                        .thenComparing(DecisionEntity::getId)
                        .reversed())
                .collect(Collectors.toList());
    }

    public int size() {
        return store.size();
    }
}
