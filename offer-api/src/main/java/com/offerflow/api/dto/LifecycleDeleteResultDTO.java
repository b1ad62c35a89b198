package com.offerflow.api.dto;

import lombok.Data;

/**
 * 生命周期删除结果 DTO。
 */
@Data
public class LifecycleDeleteResultDTO {

    private Long projectId;
    private Integer deletedPhases;
    private Integer deletedTasks;
    private String message;
}
