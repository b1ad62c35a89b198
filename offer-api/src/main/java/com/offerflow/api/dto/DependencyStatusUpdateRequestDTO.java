package com.offerflow.api.dto;

import lombok.Data;

/**
 * 依赖状态更新请求 DTO。
 */
@Data
public class DependencyStatusUpdateRequestDTO {

    private String status;
    private String notes;
}
