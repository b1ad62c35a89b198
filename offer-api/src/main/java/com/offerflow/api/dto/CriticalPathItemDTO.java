package com.offerflow.api.dto;

import lombok.Data;

/**
 * 关键路径节点 DTO。
 */
@Data
public class CriticalPathItemDTO {

    private String itemType;
    private Long itemId;
    private Double duration;
}
