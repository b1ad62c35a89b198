package com.offerflow.api.dto;

import lombok.Data;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * 服务任务 DTO。
 */
@Data
public class ServiceTaskDTO {

    private Long id;
    private Long phaseId;
    private String title;
    private String description;
    private String definition;
    private String category;
    private String subcategory;
    private String status;
    private String source;
    private LocalDate targetStartDate;
    private LocalDate targetCompleteDate;
    private Integer daysRequired;
    private LocalDate actualStartDate;
    private LocalDate actualCompleteDate;
    private String owner;
    private String team;
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
}
