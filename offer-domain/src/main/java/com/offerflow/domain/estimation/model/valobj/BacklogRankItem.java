package com.offerflow.domain.estimation.model.valobj;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 排序后的待办项：故事快照与其评分。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BacklogRankItem {

    private Long storyId;

    private Long epicId;

    private String title;

    private Integer storyPoints;

    private Double estimatedHours;

    /**
     * 当前排序模型的分数，无估算或输入不全时为 null
     */
    private Double score;

    private Double riceScore;

    private Double wsjfScore;

    private Double estimateP50;

    private Double pertExpectedHours;
}
