package com.offerflow.infrastructure.dao.po;

import com.offerflow.types.enums.ServiceTaskStatusEnum;
import com.offerflow.types.enums.TaskSourceEnum;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * 服务任务 PO
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ServiceTaskPO {

    private Long id;

    /**
     * 阶段 ID (关联 offer_lifecycle_phases.id)
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
     * 关联研发工作项 (仅追溯)
     */
    private Long linkedEpicId;
    private Long linkedStoryId;

    private Integer taskOrder;
    private Boolean isRequired;

    private Double aiConfidence;
    private String aiReasoning;

    private String notes;
    private String completionNotes;
    private LocalDateTime completedAt;

    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
}
