package com.offerflow.api.dto;

import lombok.Data;

import java.util.List;

/**
 * 修改决策记录请求 DTO。为空的字段保持原值，状态取小写编码。
 */
@Data
public class DecisionUpdateRequestDTO {

    private String title;
    private String context;
    private String decision;
    private String rationale;
    private List<String> alternatives;
    private String consequences;
    private String status;
    private String decisionMaker;
}
