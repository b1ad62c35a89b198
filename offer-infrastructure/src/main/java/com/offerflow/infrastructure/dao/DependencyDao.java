package com.offerflow.infrastructure.dao;

import com.offerflow.infrastructure.dao.po.DependencyPO;
import com.offerflow.types.enums.DependencyStatusEnum;
import com.offerflow.types.enums.DependencyTypeEnum;
import com.offerflow.types.enums.WorkItemTypeEnum;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.List;

/**
 * 工作项依赖 DAO
 */
@Mapper
public interface DependencyDao {

    /**
     * 插入依赖
     */
    int insert(DependencyPO po);

    /**
     * 更新状态与备注
     */
    int updateStatus(DependencyPO po);

    /**
     * 根据 ID 删除
     */
    int deleteById(@Param("id") Long id);

    /**
     * 根据 ID 查询
     */
    DependencyPO selectById(@Param("id") Long id);

    /**
     * 根据项目查询，按 ID 升序；status 为空时不过滤
     */
    List<DependencyPO> selectByProjectId(@Param("projectId") Long projectId,
                                         @Param("status") DependencyStatusEnum status);

    /**
     * 统计同项目下相同 (源, 目标, 类型) 的依赖数
     */
    int countEdge(@Param("projectId") Long projectId,
                  @Param("sourceType") WorkItemTypeEnum sourceType,
                  @Param("sourceId") Long sourceId,
                  @Param("targetType") WorkItemTypeEnum targetType,
                  @Param("targetId") Long targetId,
                  @Param("dependencyType") DependencyTypeEnum dependencyType);
}
