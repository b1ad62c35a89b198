package com.offerflow.api.dto;

import lombok.Data;

import java.time.LocalDate;

/**
 * 手工创建服务任务请求 DTO。
 */
@Data
public class ServiceTaskCreateRequestDTO {

    private String title;
    private String definition;
    private String category;
    private String subcategory;
    private Integer daysRequired;
    private LocalDate targetStartDate;
    private String owner;
    private String team;
    private Boolean required;
}
