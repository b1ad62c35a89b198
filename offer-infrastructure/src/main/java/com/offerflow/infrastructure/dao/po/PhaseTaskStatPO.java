package com.offerflow.infrastructure.dao.po;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 阶段任务聚合统计 PO。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PhaseTaskStatPO {

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
