package com.offerflow.domain.dependency.model.entity;

import com.offerflow.domain.workitem.model.valobj.WorkItemRef;
import com.offerflow.types.enums.DependencyStatusEnum;
import com.offerflow.types.enums.DependencyTypeEnum;
import com.offerflow.types.enums.WorkItemTypeEnum;
import lombok.Data;

import java.time.LocalDateTime;
import java.util.Objects;

/**
 * 工作项依赖边领域实体。
 *
 * @author offerflow
 * @since 2026-10-19
 */
@Data
public class DependencyEntity {

    /**
     * 主键 ID
     */
    private Long id;

    /**
     * 项目 ID
     */
    private Long projectId;

    /**
     * 源工作项（依赖方）
     */
    private WorkItemTypeEnum sourceType;
    private Long sourceId;

    /**
     * 目标工作项（被依赖方）
     */
    private WorkItemTypeEnum targetType;
    private Long targetId;

    private DependencyTypeEnum dependencyType;

    private DependencyStatusEnum status;

    /**
     * 是否由模型推断
     */
    private Boolean inferred;

    /**
     * 推断置信度 [0,1]
     */
    private Double confidence;

    private String inferenceReason;

    private String notes;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;

    public static DependencyEntity create(Long projectId,
                                          WorkItemRef source,
                                          WorkItemRef target,
                                          DependencyTypeEnum dependencyType,
                                          boolean inferred,
                                          Double confidence,
                                          String inferenceReason,
                                          String notes,
                                          LocalDateTime now) {
        DependencyEntity entity = new DependencyEntity();
        entity.setProjectId(projectId);
        entity.setSourceType(source == null ? null : source.type());
        entity.setSourceId(source == null ? null : source.id());
        entity.setTargetType(target == null ? null : target.type());
        entity.setTargetId(target == null ? null : target.id());
        entity.setDependencyType(dependencyType);
        entity.setStatus(DependencyStatusEnum.PENDING);
        entity.setInferred(inferred);
        entity.setConfidence(confidence);
        entity.setInferenceReason(inferenceReason);
        entity.setNotes(notes);
        entity.setCreatedAt(now);
        entity.setUpdatedAt(now);
        return entity;
    }

    /**
     * 校验必填字段
     */
    public void validate() {
        if (projectId == null) {
            throw new IllegalStateException("Project ID cannot be null");
        }
        if (sourceType == null || sourceId == null) {
            throw new IllegalStateException("Dependency source cannot be null");
        }
        if (targetType == null || targetId == null) {
            throw new IllegalStateException("Dependency target cannot be null");
        }
        if (dependencyType == null) {
            throw new IllegalStateException("Dependency type cannot be null");
        }
        if (status == null) {
            throw new IllegalStateException("Dependency status cannot be null");
        }
    }

    public WorkItemRef getSource() {
        return WorkItemRef.of(sourceType, sourceId);
    }

    public WorkItemRef getTarget() {
        return WorkItemRef.of(targetType, targetId);
    }

    public boolean isSelfReference() {
        return sourceType == targetType && Objects.equals(sourceId, targetId);
    }

    /**
     * 状态可在任意值之间切换；备注为空时保留原值。
     */
    public void changeStatus(DependencyStatusEnum newStatus, String newNotes, LocalDateTime now) {
        if (newStatus == null) {
            throw new IllegalArgumentException("Dependency status cannot be null");
        }
        this.status = newStatus;
        if (newNotes != null) {
            this.notes = newNotes;
        }
        this.updatedAt = now;
    }

    /**
     * 未解除的依赖参与关键路径
     */
    public boolean isActive() {
        return status != DependencyStatusEnum.RESOLVED;
    }
}
