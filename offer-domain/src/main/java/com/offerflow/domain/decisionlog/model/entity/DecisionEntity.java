package com.offerflow.domain.decisionlog.model.entity;

import com.offerflow.types.enums.DecisionStatusEnum;
import lombok.Data;
import org.apache.commons.lang3.StringUtils;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * 项目决策记录（ADR）领域实体。
 *
 * @author offerflow
 * @since 2026-10-19
 */
@Data
public class DecisionEntity {

    private Long id;

    private Long projectId;

    private String title;

    /**
     * 背景与问题陈述
     */
    private String context;

    /**
     * 决策内容
     */
    private String decision;

    private String rationale;

    /**
     * 备选方案，按提交顺序保存
     */
    private List<String> alternatives;

    private String consequences;

    private DecisionStatusEnum status;

    private String decisionMaker;

    /**
     * 最近一次被标记为采纳的时间
     */
    private LocalDateTime decisionDate;

    /**
     * 抽取来源，如 intake / meeting / prd；手工录入为空
     */
    private String extractedFrom;

    private Double extractionConfidence;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;

    public static DecisionEntity create(Long projectId,
                                        String title,
                                        String context,
                                        String decision,
                                        String rationale,
                                        List<String> alternatives,
                                        String consequences,
                                        String decisionMaker,
                                        LocalDateTime now) {
        DecisionEntity entity = new DecisionEntity();
        entity.setProjectId(projectId);
        entity.setTitle(title);
        entity.setContext(context);
        entity.setDecision(decision);
        entity.setRationale(rationale);
        entity.setAlternatives(alternatives == null ? null : new ArrayList<>(alternatives));
        entity.setConsequences(consequences);
        entity.setDecisionMaker(decisionMaker);
        entity.setStatus(DecisionStatusEnum.PROPOSED);
        entity.setCreatedAt(now);
        entity.setUpdatedAt(now);
        return entity;
    }

    public void validate() {
        if (projectId == null) {
            throw new IllegalStateException("Project ID cannot be null");
        }
        if (StringUtils.isBlank(title)) {
            throw new IllegalStateException("Decision title cannot be blank");
        }
        if (StringUtils.isBlank(decision)) {
            throw new IllegalStateException("Decision content cannot be blank");
        }
        if (status == null) {
            throw new IllegalStateException("Decision status cannot be null");
        }
    }

    /**
     * 切换状态。每次标记为采纳都会刷新决策日期。
     */
    public void changeStatus(DecisionStatusEnum newStatus, LocalDateTime now) {
        if (newStatus == null) {
            return;
        }
        this.status = newStatus;
        if (newStatus == DecisionStatusEnum.ACCEPTED) {
            this.decisionDate = now;
        }
        this.updatedAt = now;
    }
}
