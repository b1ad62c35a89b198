package com.offerflow.test.support;

import com.offerflow.domain.lifecycle.adapter.repository.ILifecyclePhaseRepository;
import com.offerflow.domain.lifecycle.model.entity.LifecyclePhaseEntity;
import com.offerflow.types.enums.ResponseCode;
import com.offerflow.types.exception.AppException;

import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * 内存阶段仓储。单独记录已提交版本，用于模拟版本比对更新。
 */
public class InMemoryLifecyclePhaseRepository implements ILifecyclePhaseRepository {

    private final Map<Long, LifecyclePhaseEntity> store = new TreeMap<>();
    private final Map<Long, Integer> committedVersions = new HashMap<>();
    private long nextId = 1;

    @Override
    public LifecyclePhaseEntity save(LifecyclePhaseEntity entity) {
        if (entity.getId() == null) {
            entity.setId(nextId++);
        }
        if (entity.getVersion() == null) {
            entity.setVersion(0);
        }
        store.put(entity.getId(), entity);
        committedVersions.put(entity.getId(), entity.getVersion());
        return entity;
    }

    @Override
    public LifecyclePhaseEntity update(LifecyclePhaseEntity entity) {
        Integer committed = committedVersions.get(entity.getId());
        if (committed == null || !Objects.equals(committed, entity.getVersion())) {
            throw new AppException(ResponseCode.CONCURRENT_MODIFICATION, "阶段已被并发修改");
        }
        entity.setVersion(committed + 1);
        committedVersions.put(entity.getId(), entity.getVersion());
        store.put(entity.getId(), entity);
        return entity;
    }

    @Override
    public LifecyclePhaseEntity findById(Long id) {
        return store.get(id);
    }

    @Override
    public List<LifecyclePhaseEntity> findByProjectId(Long projectId) {
        return store.values().stream()
                .filter(item -> Objects.equals(projectId, item.getProjectId()))
                .sorted(Comparator.comparing(LifecyclePhaseEntity::getPhaseOrder))
                .collect(Collectors.toList());
    }

    @Override
    public int deleteByProjectId(Long projectId) {
        List<LifecyclePhaseEntity> phases = findByProjectId(projectId);
        for (LifecyclePhaseEntity phase : phases) {
            store.remove(phase.getId());
            committedVersions.remove(phase.getId());
        }
        return phases.size();
    }

    /**
     * 模拟另一事务已提交的修改。
     */
    public void bumpCommittedVersion(Long phaseId) {
        committedVersions.computeIfPresent(phaseId, (id, version) -> version + 1);
    }
}
