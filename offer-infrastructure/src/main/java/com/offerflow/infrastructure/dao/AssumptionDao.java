package com.offerflow.infrastructure.dao;

import com.offerflow.infrastructure.dao.po.AssumptionPO;
import com.offerflow.types.enums.AssumptionRiskEnum;
import com.offerflow.types.enums.AssumptionStatusEnum;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.List;

/**
 * 项目假设 DAO
 */
@Mapper
public interface AssumptionDao {

    int insert(AssumptionPO po);

    int update(AssumptionPO po);

    int deleteById(@Param("id") Long id);

    AssumptionPO selectById(@Param("id") Long id);

    /**
     * 风险等级从高到低、创建时间倒序；过滤条件为空时不过滤
     */
    List<AssumptionPO> selectByProjectId(@Param("projectId") Long projectId,
                                         @Param("status") AssumptionStatusEnum status,
                                         @Param("riskLevel") AssumptionRiskEnum riskLevel);
}
