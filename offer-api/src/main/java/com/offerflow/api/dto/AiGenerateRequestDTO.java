package com.offerflow.api.dto;

import lombok.Data;

import java.time.LocalDate;

/**
 * 模型生成类请求 DTO。provider/model 为空时使用服务端配置。
 */
@Data
public class AiGenerateRequestDTO {

    private String provider;
    private String model;
    /** 仅生命周期生成使用，缺省为当天 */
    private LocalDate startDate;
}
