package com.offerflow.infrastructure.dao;

import com.offerflow.infrastructure.dao.po.DecisionPO;
import com.offerflow.types.enums.DecisionStatusEnum;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.List;

/**
 * 决策记录 DAO
 */
@Mapper
public interface DecisionDao {

    int insert(DecisionPO po);

    /**
     * 按 ID 更新可编辑字段
     */
    int update(DecisionPO po);

    int deleteById(@Param("id") Long id);

    DecisionPO selectById(@Param("id") Long id);

    /**
     * 按创建时间倒序；status 为空时不过滤
     */
    List<DecisionPO> selectByProjectId(@Param("projectId") Long projectId,
                                       @Param("status") DecisionStatusEnum status);
}
