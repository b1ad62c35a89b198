package com.offerflow.domain.decisionlog.adapter.repository;

import com.offerflow.domain.decisionlog.model.entity.DecisionEntity;
import com.offerflow.types.enums.DecisionStatusEnum;

import java.util.List;

/**
 * 决策记录仓储接口
 */
public interface IDecisionRepository {

    DecisionEntity save(DecisionEntity entity);

    DecisionEntity update(DecisionEntity entity);

    boolean deleteById(Long id);

    DecisionEntity findById(Long id);

    /**
     * 按创建时间倒序查询；status 为空时不过滤
     */
    List<DecisionEntity> findByProjectId(Long projectId, DecisionStatusEnum status);
}
