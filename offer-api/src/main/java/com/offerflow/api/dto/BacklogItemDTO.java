package com.offerflow.api.dto;

import lombok.Data;

/**
 * 优先级待办条目 DTO。
 */
@Data
public class BacklogItemDTO {

    private Long storyId;
    private Long epicId;
    private String title;
    private Integer storyPoints;
    private Double estimatedHours;
    /** 当前排序模型下的得分，无估算或无得分时为 null */
    private Double score;
    private Double riceScore;
    private Double wsjfScore;
    private Double estimateP50;
    private Double pertExpectedHours;
}
