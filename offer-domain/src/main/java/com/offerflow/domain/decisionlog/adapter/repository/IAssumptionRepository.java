package com.offerflow.domain.decisionlog.adapter.repository;

import com.offerflow.domain.decisionlog.model.entity.AssumptionEntity;
import com.offerflow.types.enums.AssumptionRiskEnum;
import com.offerflow.types.enums.AssumptionStatusEnum;

import java.util.List;

/**
 * 项目假设仓储接口
 */
public interface IAssumptionRepository {

    AssumptionEntity save(AssumptionEntity entity);

    AssumptionEntity update(AssumptionEntity entity);

    boolean deleteById(Long id);

    AssumptionEntity findById(Long id);

    /**
     * 风险等级从高到低，同等级按创建时间倒序；过滤条件为空时不过滤
     */
    List<AssumptionEntity> findByProjectId(Long projectId, AssumptionStatusEnum status, AssumptionRiskEnum riskLevel);
}
