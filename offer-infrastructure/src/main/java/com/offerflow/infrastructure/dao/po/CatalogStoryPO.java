package com.offerflow.infrastructure.dao.po;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 故事只读视图 PO (stories join epics)
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CatalogStoryPO {

    private Long id;

    private Long epicId;

    private String epicTitle;

    private Long projectId;

    private String title;

    private String description;

    private String acceptanceCriteria;

    private Integer storyPoints;

    private Double estimatedHours;
}
