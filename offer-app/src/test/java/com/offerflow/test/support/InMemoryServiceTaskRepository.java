package com.offerflow.test.support;

import com.offerflow.domain.lifecycle.adapter.repository.IServiceTaskRepository;
import com.offerflow.domain.lifecycle.model.entity.ServiceTaskEntity;
import com.offerflow.domain.lifecycle.model.valobj.PhaseTaskStat;
import com.offerflow.types.enums.ServiceTaskStatusEnum;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * 内存服务任务仓储。
 */
public class InMemoryServiceTaskRepository implements IServiceTaskRepository {

    private final Map<Long, ServiceTaskEntity> store = new TreeMap<>();
    private long nextId = 1;

    @Override
    public ServiceTaskEntity save(ServiceTaskEntity entity) {
        if (entity.getId() == null) {
            entity.setId(nextId++);
        }
        store.put(entity.getId(), entity);
        return entity;
    }

    @Override
    public ServiceTaskEntity update(ServiceTaskEntity entity) {
        store.put(entity.getId(), entity);
        return entity;
    }

    @Override
    public boolean deleteById(Long id) {
        return store.remove(id) != null;
    }

    @Override
    public ServiceTaskEntity findById(Long id) {
        return store.get(id);
    }

    @Override
    public List<ServiceTaskEntity> findByPhaseId(Long phaseId, ServiceTaskStatusEnum status, String category) {
        return store.values().stream()
                .filter(item -> Objects.equals(phaseId, item.getPhaseId()))
                .filter(item -> status == null || item.getStatus() == status)
                .filter(item -> category == null || Objects.equals(category, item.getCategory()))
                .sorted(Comparator.comparing(ServiceTaskEntity::getTaskOrder)
                        .thenComparing(ServiceTaskEntity::getId))
                .collect(Collectors.toList());
    }

    @Override
    public int maxOrderByPhaseId(Long phaseId) {
        return findByPhaseId(phaseId, null, null).stream()
                .mapToInt(ServiceTaskEntity::getTaskOrder)
                .max()
                .orElse(-1);
    }

    @Override
    public int deleteByPhaseIds(Collection<Long> phaseIds) {
        List<Long> ids = store.values().stream()
                .filter(item -> phaseIds.contains(item.getPhaseId()))
                .map(ServiceTaskEntity::getId)
                .collect(Collectors.toList());
        ids.forEach(store::remove);
        return ids.size();
    }

    @Override
    public List<PhaseTaskStat> summarizeByPhaseIds(Collection<Long> phaseIds) {
        List<PhaseTaskStat> stats = new ArrayList<>();
        for (Long phaseId : phaseIds) {
            List<ServiceTaskEntity> tasks = findByPhaseId(phaseId, null, null);
            if (tasks.isEmpty()) {
                continue;
            }
            long completed = tasks.stream().filter(ServiceTaskEntity::isCompleted).count();
            stats.add(new PhaseTaskStat(phaseId, (long) tasks.size(), completed));
        }
        return stats;
    }

    public List<ServiceTaskEntity> findAll() {
        return new ArrayList<>(store.values());
    }
}
