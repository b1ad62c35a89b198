package com.offerflow.domain.lifecycle.adapter.repository;

import com.offerflow.domain.lifecycle.model.entity.ServiceTaskEntity;
import com.offerflow.domain.lifecycle.model.valobj.PhaseTaskStat;
import com.offerflow.types.enums.ServiceTaskStatusEnum;

import java.util.Collection;
import java.util.List;

/**
 * 服务任务仓储接口
 */
public interface IServiceTaskRepository {

    ServiceTaskEntity save(ServiceTaskEntity entity);

    ServiceTaskEntity update(ServiceTaskEntity entity);

    boolean deleteById(Long id);

    ServiceTaskEntity findById(Long id);

    /**
     * 按任务顺序查询阶段下任务，status/category 为 null 时不过滤
     */
    List<ServiceTaskEntity> findByPhaseId(Long phaseId, ServiceTaskStatusEnum status, String category);

    /**
     * 阶段下最大任务顺序，无任务时返回 0
     */
    int maxOrderByPhaseId(Long phaseId);

    int deleteByPhaseIds(Collection<Long> phaseIds);

    /**
     * 按阶段聚合任务数与完成数
     */
    List<PhaseTaskStat> summarizeByPhaseIds(Collection<Long> phaseIds);
}
