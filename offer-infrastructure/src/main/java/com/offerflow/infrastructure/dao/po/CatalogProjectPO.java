package com.offerflow.infrastructure.dao.po;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 项目只读视图 PO (projects 表)
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CatalogProjectPO {

    private Long id;

    private String name;

    private String description;

    private String prdContent;
}
