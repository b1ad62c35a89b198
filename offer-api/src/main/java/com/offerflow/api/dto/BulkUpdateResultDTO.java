package com.offerflow.api.dto;

import lombok.Data;

/**
 * 批量更新结果 DTO。
 */
@Data
public class BulkUpdateResultDTO {

    private Integer updatedCount;
}
