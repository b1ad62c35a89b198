package com.offerflow.domain.dependency.adapter.repository;

import com.offerflow.domain.dependency.model.entity.DependencyEntity;
import com.offerflow.domain.workitem.model.valobj.WorkItemRef;
import com.offerflow.types.enums.DependencyStatusEnum;
import com.offerflow.types.enums.DependencyTypeEnum;

import java.util.List;

/**
 * 依赖边仓储接口
 */
public interface IDependencyRepository {

    DependencyEntity save(DependencyEntity entity);

    DependencyEntity update(DependencyEntity entity);

    boolean deleteById(Long id);

    DependencyEntity findById(Long id);

    /**
     * 按 ID 升序（插入顺序）查询项目依赖
     */
    List<DependencyEntity> findByProjectId(Long projectId);

    List<DependencyEntity> findByProjectIdAndStatus(Long projectId, DependencyStatusEnum status);

    boolean existsEdge(Long projectId, WorkItemRef source, WorkItemRef target, DependencyTypeEnum dependencyType);
}
