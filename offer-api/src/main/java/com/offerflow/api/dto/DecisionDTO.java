package com.offerflow.api.dto;

import lombok.Data;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 决策记录 DTO。
 */
@Data
public class DecisionDTO {

    private Long id;
    private Long projectId;
    private String title;
    private String context;
    private String decision;
    private String rationale;
    private List<String> alternatives;
    private String consequences;
    private String status;
    private String decisionMaker;
    private LocalDateTime decisionDate;
    private String extractedFrom;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
}
