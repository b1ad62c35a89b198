package com.offerflow.api.dto;

import lombok.Data;

/**
 * 延迟成本请求 DTO。
 */
@Data
public class CostOfDelayRequestDTO {

    private Double weekly;
    private String urgencyProfile;
}
