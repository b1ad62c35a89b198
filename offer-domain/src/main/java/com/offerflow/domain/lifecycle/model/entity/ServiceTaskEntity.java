package com.offerflow.domain.lifecycle.model.entity;

import com.offerflow.types.enums.ServiceTaskStatusEnum;
import com.offerflow.types.enums.TaskSourceEnum;
import lombok.Data;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * 阶段下的服务任务领域实体。
 *
 * @author offerflow
 * @since 2026-10-19
 */
@Data
public class ServiceTaskEntity {

    private Long id;

    /**
     * 所属阶段 ID
     */
    private Long phaseId;

    private String title;

    private String description;

    private String definition;

    private String category;

    private String subcategory;

    private ServiceTaskStatusEnum status;

    private TaskSourceEnum source;

    private LocalDate targetStartDate;

    private LocalDate targetCompleteDate;

    private Integer daysRequired;

    private LocalDate actualStartDate;

    private LocalDate actualCompleteDate;

    private String owner;

    private String team;

    /**
     * 追溯到开发工作项，仅作关联
     */
    private Long linkedEpicId;
    private Long linkedStoryId;

    private Integer taskOrder;

    private Boolean required;

    private Double aiConfidence;

    private String aiReasoning;

    private String notes;

    private String completionNotes;

    private LocalDateTime completedAt;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;

    public void validate() {
        if (phaseId == null) {
            throw new IllegalStateException("Phase ID cannot be null");
        }
        if (title == null || title.trim().isEmpty()) {
            throw new IllegalStateException("Task title cannot be empty");
        }
        if (status == null) {
            throw new IllegalStateException("Status cannot be null");
        }
        if (source == null) {
            throw new IllegalStateException("Source cannot be null");
        }
        if (daysRequired != null && daysRequired < 0) {
            throw new IllegalStateException("Days required cannot be negative");
        }
    }

    /**
     * 切换状态：完成时记录完成时间，开工时记录实际开始日期，重新打开已完成任务时清空完成时间。
     */
    public void changeStatus(ServiceTaskStatusEnum newStatus, LocalDate today, LocalDateTime now) {
        if (newStatus == null || newStatus == this.status) {
            return;
        }
        if (newStatus == ServiceTaskStatusEnum.COMPLETED) {
            this.completedAt = now;
            if (this.actualCompleteDate == null) {
                this.actualCompleteDate = today;
            }
        } else if (this.status == ServiceTaskStatusEnum.COMPLETED) {
            this.completedAt = null;
        }
        if (newStatus == ServiceTaskStatusEnum.IN_PROGRESS
                && this.status == ServiceTaskStatusEnum.NOT_STARTED
                && this.actualStartDate == null) {
            this.actualStartDate = today;
        }
        this.status = newStatus;
        this.updatedAt = now;
    }

    /**
     * 关联开发工作，参数为 null 时保留原值
     */
    public void linkDevWork(Long epicId, Long storyId, LocalDateTime now) {
        if (epicId != null) {
            this.linkedEpicId = epicId;
        }
        if (storyId != null) {
            this.linkedStoryId = storyId;
        }
        this.updatedAt = now;
    }

    public boolean isCompleted() {
        return status == ServiceTaskStatusEnum.COMPLETED;
    }
}
