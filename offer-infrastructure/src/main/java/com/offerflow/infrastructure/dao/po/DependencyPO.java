package com.offerflow.infrastructure.dao.po;

import com.offerflow.types.enums.DependencyStatusEnum;
import com.offerflow.types.enums.DependencyTypeEnum;
import com.offerflow.types.enums.WorkItemTypeEnum;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 工作项依赖 PO
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DependencyPO {

    /**
     * 主键 ID
     */
    private Long id;

    /**
     * 项目 ID (关联 projects.id)
     */
    private Long projectId;

    /**
     * 源工作项类型
     */
    private WorkItemTypeEnum sourceType;

    /**
     * 源工作项 ID
     */
    private Long sourceId;

    /**
     * 目标工作项类型
     */
    private WorkItemTypeEnum targetType;

    /**
     * 目标工作项 ID
     */
    private Long targetId;

    /**
     * 依赖类型
     */
    private DependencyTypeEnum dependencyType;

    /**
     * 状态
     */
    private DependencyStatusEnum status;

    /**
     * 是否模型推断
     */
    private Boolean isInferred;

    /**
     * 推断置信度 (0-1)
     */
    private Double confidence;

    /**
     * 推断理由
     */
    private String inferenceReason;

    /**
     * 备注
     */
    private String notes;

    /**
     * 创建时间
     */
    private LocalDateTime createdAt;

    /**
     * 更新时间
     */
    private LocalDateTime updatedAt;
}
