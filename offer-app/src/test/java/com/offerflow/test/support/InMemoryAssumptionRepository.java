package com.offerflow.test.support;

import com.offerflow.domain.decisionlog.adapter.repository.IAssumptionRepository;
import com.offerflow.domain.decisionlog.model.entity.AssumptionEntity;
import com.offerflow.types.enums.AssumptionRiskEnum;
import com.offerflow.types.enums.AssumptionStatusEnum;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * 内存假设仓储，风险等级从高到低、创建时间倒序返回。
 */
public class InMemoryAssumptionRepository implements IAssumptionRepository {

    private final Map<Long, AssumptionEntity> store = new TreeMap<>();
    private long nextId = 1;

    @Override
    public AssumptionEntity save(AssumptionEntity entity) {
        entity.validate();
        if (entity.getId() == null) {
            entity.setId(nextId++);
        }
        store.put(entity.getId(), entity);
        return entity;
    }

    @Override
    public AssumptionEntity update(AssumptionEntity entity) {
        entity.validate();
        store.put(entity.getId(), entity);
        return entity;
    }

    @Override
    public boolean deleteById(Long id) {
        return store.remove(id) != null;
    }

    @Override
    public AssumptionEntity findById(Long id) {
        return store.get(id);
    }

    @Override
    public List<AssumptionEntity> findByProjectId(Long projectId, AssumptionStatusEnum status,
                                                  AssumptionRiskEnum riskLevel) {
        return store.values().stream()
                .filter(item -> Objects.equals(projectId, item.getProjectId()))
                .filter(item -> status == null || item.getStatus() == status)
                .filter(item -> riskLevel == null || item.getRiskLevel() == riskLevel)
                .sorted(Comparator.comparing(AssumptionEntity::getRiskLevel)
                        .thenComparing(AssumptionEntity::getCreatedAt)
                        .thenComparing(AssumptionEntity::getId)
                        .reversed())
                .collect(Collectors.toList());
    }
}
