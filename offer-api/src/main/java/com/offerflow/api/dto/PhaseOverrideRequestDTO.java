package com.offerflow.api.dto;

import lombok.Data;

/**
 * 阶段顺序覆盖请求 DTO。
 */
@Data
public class PhaseOverrideRequestDTO {

    private String overriddenBy;
    private String reason;
}
