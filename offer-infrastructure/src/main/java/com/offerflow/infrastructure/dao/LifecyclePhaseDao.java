package com.offerflow.infrastructure.dao;

import com.offerflow.infrastructure.dao.po.LifecyclePhasePO;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.List;

/**
 * 生命周期阶段 DAO
 */
@Mapper
public interface LifecyclePhaseDao {

    /**
     * 插入阶段
     */
    int insert(LifecyclePhasePO po);

    /**
     * 根据 ID 更新 (带乐观锁)
     */
    int updateWithVersion(LifecyclePhasePO po);

    /**
     * 根据 ID 查询
     */
    LifecyclePhasePO selectById(@Param("id") Long id);

    /**
     * 根据项目查询，按阶段顺序
     */
    List<LifecyclePhasePO> selectByProjectId(@Param("projectId") Long projectId);

    /**
     * 删除项目全部阶段
     */
    int deleteByProjectId(@Param("projectId") Long projectId);
}
