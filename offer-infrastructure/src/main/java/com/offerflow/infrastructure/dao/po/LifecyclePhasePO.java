package com.offerflow.infrastructure.dao.po;

import com.offerflow.types.enums.LifecyclePhaseEnum;
import com.offerflow.types.enums.PhaseStatusEnum;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * 生命周期阶段 PO
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LifecyclePhasePO {

    /**
     * 主键 ID
     */
    private Long id;

    /**
     * 项目 ID
     */
    private Long projectId;

    /**
     * 阶段
     */
    private LifecyclePhaseEnum phase;

    /**
     * 状态
     */
    private PhaseStatusEnum status;

    /**
     * 阶段顺序 (1-6)
     */
    private Integer phaseOrder;

    /**
     * 是否需要审批
     */
    private Boolean approvalRequired;

    /**
     * 审批信息
     */
    private String approvedBy;
    private LocalDateTime approvedAt;
    private String approvalNotes;

    /**
     * 顺序覆盖信息
     */
    private Boolean sequenceOverridden;
    private String overrideReason;
    private String overriddenBy;
    private LocalDateTime overriddenAt;

    /**
     * 计划/实际日期
     */
    private LocalDate targetStartDate;
    private LocalDate targetEndDate;
    private LocalDate actualStartDate;
    private LocalDate actualEndDate;

    /**
     * 版本号 (乐观锁)
     */
    private Integer version;

    /**
     * 创建时间
     */
    private LocalDateTime createdAt;

    /**
     * 更新时间
     */
    private LocalDateTime updatedAt;
}
