package com.offerflow.domain.lifecycle.model.valobj;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 阶段下服务任务聚合统计。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PhaseTaskStat {

    /**
     * 阶段 ID
     */
    private Long phaseId;

    /**
     * 任务总数
     */
    private Long total;

    /**
     * COMPLETED 数量
     */
    private Long completedCount;
}
