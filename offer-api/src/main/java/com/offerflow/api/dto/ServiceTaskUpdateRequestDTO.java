package com.offerflow.api.dto;

import lombok.Data;

import java.time.LocalDate;

/**
 * 服务任务局部更新请求 DTO，null 字段保持不变。
 */
@Data
public class ServiceTaskUpdateRequestDTO {

    private String title;
    private String description;
    private String definition;
    private String category;
    private String subcategory;
    private String status;
    private LocalDate targetStartDate;
    private LocalDate targetCompleteDate;
    private Integer daysRequired;
    private String owner;
    private String team;
    private Boolean required;
    private String notes;
    private String completionNotes;
}
