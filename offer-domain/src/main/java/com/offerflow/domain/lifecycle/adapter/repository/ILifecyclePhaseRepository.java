package com.offerflow.domain.lifecycle.adapter.repository;

import com.offerflow.domain.lifecycle.model.entity.LifecyclePhaseEntity;

import java.util.List;

/**
 * 生命周期阶段仓储接口
 */
public interface ILifecyclePhaseRepository {

    /**
     * 保存阶段
     */
    LifecyclePhaseEntity save(LifecyclePhaseEntity entity);

    /**
     * 更新阶段 (带乐观锁)，版本冲突抛出 CONCURRENT_MODIFICATION
     */
    LifecyclePhaseEntity update(LifecyclePhaseEntity entity);

    LifecyclePhaseEntity findById(Long id);

    /**
     * 按阶段顺序查询项目全部阶段
     */
    List<LifecyclePhaseEntity> findByProjectId(Long projectId);

    /**
     * 删除项目全部阶段
     *
     * @return 删除行数
     */
    int deleteByProjectId(Long projectId);
}
