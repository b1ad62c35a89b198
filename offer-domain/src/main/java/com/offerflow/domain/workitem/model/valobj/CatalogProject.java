package com.offerflow.domain.workitem.model.valobj;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 项目目录快照（只读）。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CatalogProject {

    private Long id;

    private String name;

    private String description;

    /**
     * 产品需求文档正文，生命周期生成时作为模型输入
     */
    private String prdContent;
}
