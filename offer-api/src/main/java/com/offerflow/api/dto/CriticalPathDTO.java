package com.offerflow.api.dto;

import lombok.Data;

import java.util.List;

/**
 * 关键路径 DTO。
 */
@Data
public class CriticalPathDTO {

    private Long projectId;
    private List<CriticalPathItemDTO> items;
    private Double totalDuration;
    /** 活动依赖图中是否存在环 */
    private Boolean cyclic;
}
