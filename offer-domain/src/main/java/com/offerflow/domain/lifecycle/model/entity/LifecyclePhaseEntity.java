package com.offerflow.domain.lifecycle.model.entity;

import com.offerflow.types.enums.LifecyclePhaseEnum;
import com.offerflow.types.enums.PhaseStatusEnum;
import com.offerflow.types.enums.ResponseCode;
import com.offerflow.types.exception.AppException;
import lombok.Data;
import org.apache.commons.lang3.StringUtils;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * 生命周期阶段领域实体。
 * <p>
 * 状态机：NOT_STARTED → IN_PROGRESS → PENDING_APPROVAL → APPROVED；override 可把任意状态拉回 IN_PROGRESS。
 * 前序阶段门禁由 {@code PhaseSequencerDomainService} 判定，实体只负责自身状态。
 * </p>
 *
 * @author offerflow
 * @since 2026-10-19
 */
@Data
public class LifecyclePhaseEntity {

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
     * 顺序 1..6，创建后不可变
     */
    private Integer phaseOrder;

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
     * 计划与实际日期
     */
    private LocalDate targetStartDate;
    private LocalDate targetEndDate;
    private LocalDate actualStartDate;
    private LocalDate actualEndDate;

    /**
     * 版本号 (乐观锁)
     */
    private Integer version;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;

    public static LifecyclePhaseEntity create(Long projectId, LifecyclePhaseEnum phase, LocalDateTime now) {
        LifecyclePhaseEntity entity = new LifecyclePhaseEntity();
        entity.setProjectId(projectId);
        entity.setPhase(phase);
        entity.setPhaseOrder(phase.getOrder());
        entity.setStatus(PhaseStatusEnum.NOT_STARTED);
        entity.setApprovalRequired(Boolean.TRUE);
        entity.setSequenceOverridden(Boolean.FALSE);
        entity.setVersion(0);
        entity.setCreatedAt(now);
        entity.setUpdatedAt(now);
        return entity;
    }

    public void validate() {
        if (projectId == null) {
            throw new IllegalStateException("Project ID cannot be null");
        }
        if (phase == null) {
            throw new IllegalStateException("Phase cannot be null");
        }
        if (phaseOrder == null || phaseOrder != phase.getOrder()) {
            throw new IllegalStateException("Phase order must match phase " + phase.getCode());
        }
        if (status == null) {
            throw new IllegalStateException("Status cannot be null");
        }
    }

    /**
     * 开始阶段。
     *
     * @return 是否发生状态变化；已在进行中时为 false
     */
    public boolean start(LocalDate today, LocalDateTime now) {
        if (this.status == PhaseStatusEnum.IN_PROGRESS) {
            return false;
        }
        if (this.status != PhaseStatusEnum.NOT_STARTED) {
            throw new AppException(ResponseCode.INVALID_TRANSITION,
                    "阶段 " + phase.getCode() + " 当前状态 " + status.getCode() + " 不能开始");
        }
        this.status = PhaseStatusEnum.IN_PROGRESS;
        this.actualStartDate = today;
        this.updatedAt = now;
        return true;
    }

    /**
     * 提交审批
     */
    public void submitForApproval(LocalDateTime now) {
        if (this.status != PhaseStatusEnum.IN_PROGRESS) {
            throw new AppException(ResponseCode.INVALID_TRANSITION,
                    "只有进行中的阶段可以提交审批，当前状态: " + status.getCode());
        }
        this.status = PhaseStatusEnum.PENDING_APPROVAL;
        this.updatedAt = now;
    }

    /**
     * 审批通过
     */
    public void approve(String approver, String notes, LocalDate today, LocalDateTime now) {
        if (this.status != PhaseStatusEnum.PENDING_APPROVAL) {
            throw new AppException(ResponseCode.INVALID_TRANSITION,
                    "只有待审批的阶段可以审批，当前状态: " + status.getCode());
        }
        if (StringUtils.isBlank(approver)) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER, "approvedBy 不能为空");
        }
        this.status = PhaseStatusEnum.APPROVED;
        this.approvedBy = approver.trim();
        this.approvedAt = now;
        this.approvalNotes = notes;
        this.actualEndDate = today;
        this.updatedAt = now;
    }

    /**
     * 覆盖顺序门禁，任意状态直接进入 IN_PROGRESS。
     */
    public void overrideSequence(String operator, String reason, LocalDate today, LocalDateTime now) {
        if (StringUtils.isBlank(operator)) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER, "overriddenBy 不能为空");
        }
        if (StringUtils.isBlank(reason)) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER, "override reason 不能为空");
        }
        this.status = PhaseStatusEnum.IN_PROGRESS;
        this.sequenceOverridden = Boolean.TRUE;
        this.overriddenBy = operator.trim();
        this.overrideReason = reason;
        this.overriddenAt = now;
        this.actualStartDate = today;
        this.updatedAt = now;
    }

    public void schedule(LocalDate targetStart, LocalDate targetEnd) {
        this.targetStartDate = targetStart;
        this.targetEndDate = targetEnd;
    }

    public boolean isOverridden() {
        return Boolean.TRUE.equals(sequenceOverridden);
    }
}
