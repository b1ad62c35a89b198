package com.offerflow.api.dto;

import lombok.Data;

/**
 * 三点估算请求 DTO（小时）。
 */
@Data
public class RangeEstimateRequestDTO {

    private Double p10;
    private Double p50;
    private Double p90;
}
