package com.offerflow.domain.workitem.model.valobj;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 用户故事目录快照（只读），附带所属 Epic 与项目。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CatalogStory {

    private Long id;

    private Long epicId;

    private String epicTitle;

    private Long projectId;

    private String title;

    private String description;

    private String acceptanceCriteria;

    private Integer storyPoints;

    /**
     * 故事自身的粗估工时，三点估算缺失时作为关键路径时长
     */
    private Double estimatedHours;
}
