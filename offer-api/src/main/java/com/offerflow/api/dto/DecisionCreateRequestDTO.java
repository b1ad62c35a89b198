package com.offerflow.api.dto;

import lombok.Data;

import java.util.List;

/**
 * 新增决策记录请求 DTO。title 与 decision 必填。
 */
@Data
public class DecisionCreateRequestDTO {

    private String title;
    private String context;
    private String decision;
    private String rationale;
    private List<String> alternatives;
    private String consequences;
    private String decisionMaker;
}
