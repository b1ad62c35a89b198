package com.offerflow.api.dto;

import lombok.Data;

/**
 * WSJF 输入请求 DTO，各项取斐波那契刻度 1/2/3/5/8/13/21。
 */
@Data
public class WsjfInputRequestDTO {

    private Integer businessValue;
    private Integer timeCriticality;
    private Integer riskReduction;
    private Integer jobSize;
}
