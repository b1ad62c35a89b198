package com.offerflow.infrastructure.dao;

import com.offerflow.infrastructure.dao.po.PhaseTaskStatPO;
import com.offerflow.infrastructure.dao.po.ServiceTaskPO;
import com.offerflow.types.enums.ServiceTaskStatusEnum;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.Collection;
import java.util.List;

/**
 * 服务任务 DAO
 */
@Mapper
public interface ServiceTaskDao {

    int insert(ServiceTaskPO po);

    int update(ServiceTaskPO po);

    int deleteById(@Param("id") Long id);

    ServiceTaskPO selectById(@Param("id") Long id);

    /**
     * 按阶段查询，可选状态/类别过滤，按任务顺序
     */
    List<ServiceTaskPO> selectByPhaseId(@Param("phaseId") Long phaseId,
                                        @Param("status") ServiceTaskStatusEnum status,
                                        @Param("category") String category);

    /**
     * 阶段内最大任务顺序，无任务返回 null
     */
    Integer selectMaxOrderByPhaseId(@Param("phaseId") Long phaseId);

    int deleteByPhaseIds(@Param("phaseIds") Collection<Long> phaseIds);

    /**
     * 按阶段聚合任务总数与完成数
     */
    List<PhaseTaskStatPO> selectStatsByPhaseIds(@Param("phaseIds") Collection<Long> phaseIds);
}
