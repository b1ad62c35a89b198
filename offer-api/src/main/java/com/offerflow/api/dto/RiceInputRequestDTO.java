package com.offerflow.api.dto;

import lombok.Data;

/**
 * RICE 输入请求 DTO。
 */
@Data
public class RiceInputRequestDTO {

    private Integer reach;
    /** 0.25 / 0.5 / 1 / 2 / 3 */
    private Double impact;
    /** (0, 1] */
    private Double confidence;
    private Double effort;
}
