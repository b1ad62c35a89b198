package com.offerflow.domain.estimation.model.entity;

import com.offerflow.domain.estimation.service.PrioritizationScoringPolicy;
import com.offerflow.types.enums.PrioritizationModelEnum;
import com.offerflow.types.enums.ResponseCode;
import com.offerflow.types.exception.AppException;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * 故事估算领域实体：三点估算、RICE/WSJF 输入与派生分数，每个故事至多一条。
 * <p>
 * 派生分数仅在对应模型四个输入齐全时计算，否则为 null。
 * </p>
 *
 * @author offerflow
 * @since 2026-10-19
 */
@Data
public class StoryEstimateEntity {

    private Long id;

    /**
     * 故事 ID（唯一）
     */
    private Long storyId;

    /**
     * 三点估算（小时）
     */
    private Double estimateP10;
    private Double estimateP50;
    private Double estimateP90;

    /**
     * RICE 输入
     */
    private Integer riceReach;
    private Double riceImpact;
    private Double riceConfidence;
    private Double riceEffort;
    private Double riceScore;

    /**
     * WSJF 输入（修正斐波那契 1..21）
     */
    private Integer wsjfBusinessValue;
    private Integer wsjfTimeCriticality;
    private Integer wsjfRiskReduction;
    private Integer wsjfJobSize;
    private Double wsjfScore;

    /**
     * 每周延迟成本
     */
    private Double codWeekly;

    /**
     * 延迟成本紧迫曲线，如 standard / urgent / fixed_date / intangible
     */
    private String codUrgencyProfile;

    /**
     * 模型给出的三点估算
     */
    private Double aiEstimateP10;
    private Double aiEstimateP50;
    private Double aiEstimateP90;
    private Double aiConfidence;
    private String aiReasoning;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;

    public static StoryEstimateEntity create(Long storyId, LocalDateTime now) {
        StoryEstimateEntity entity = new StoryEstimateEntity();
        entity.setStoryId(storyId);
        entity.setCreatedAt(now);
        entity.setUpdatedAt(now);
        return entity;
    }

    public void validate() {
        if (storyId == null) {
            throw new IllegalStateException("Story ID cannot be null");
        }
    }

    /**
     * 写入 RICE 输入并重算分数；为 null 的输入视为未提供。
     */
    public void applyRiceInputs(Integer reach, Double impact, Double confidence, Double effort, LocalDateTime now) {
        if (reach != null && reach < 0) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER, "reach 不能为负数: " + reach);
        }
        if (impact != null && !PrioritizationScoringPolicy.isValidRiceImpact(impact)) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER, "impact 仅支持 0.25/0.5/1/2/3: " + impact);
        }
        if (confidence != null && !PrioritizationScoringPolicy.isValidRiceConfidence(confidence)) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER, "confidence 必须位于 (0,1]: " + confidence);
        }
        if (effort != null && effort <= 0D) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER, "effort 必须大于 0: " + effort);
        }
        this.riceReach = reach;
        this.riceImpact = impact;
        this.riceConfidence = confidence;
        this.riceEffort = effort;
        recomputeScores();
        this.updatedAt = now;
    }

    /**
     * 写入 WSJF 输入并重算分数。
     */
    public void applyWsjfInputs(Integer businessValue,
                                Integer timeCriticality,
                                Integer riskReduction,
                                Integer jobSize,
                                LocalDateTime now) {
        requireWsjfValue("businessValue", businessValue);
        requireWsjfValue("timeCriticality", timeCriticality);
        requireWsjfValue("riskReduction", riskReduction);
        requireWsjfValue("jobSize", jobSize);
        this.wsjfBusinessValue = businessValue;
        this.wsjfTimeCriticality = timeCriticality;
        this.wsjfRiskReduction = riskReduction;
        this.wsjfJobSize = jobSize;
        recomputeScores();
        this.updatedAt = now;
    }

    private void requireWsjfValue(String name, Integer value) {
        if (value != null && !PrioritizationScoringPolicy.isValidWsjfValue(value)) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER, name + " 仅支持 1/2/3/5/8/13/21: " + value);
        }
    }

    public void applyCostOfDelay(Double weekly, String urgencyProfile, LocalDateTime now) {
        if (weekly != null && weekly < 0D) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER, "codWeekly 不能为负数: " + weekly);
        }
        this.codWeekly = weekly;
        this.codUrgencyProfile = urgencyProfile;
        this.updatedAt = now;
    }

    /**
     * 写入人工三点估算，要求非负且有序。
     */
    public void applyRange(Double p10, Double p50, Double p90, LocalDateTime now) {
        if (!PrioritizationScoringPolicy.isOrderedRange(p10, p50, p90)) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER,
                    "三点估算必须非负且满足 p10 <= p50 <= p90: " + p10 + "/" + p50 + "/" + p90);
        }
        this.estimateP10 = p10;
        this.estimateP50 = p50;
        this.estimateP90 = p90;
        this.updatedAt = now;
    }

    /**
     * 记录模型估算；人工估算缺失的点用模型值补齐，补齐后无序则保持人工估算不变。
     *
     * @return 是否补齐了人工估算
     */
    public boolean applyAiEstimate(Double p10, Double p50, Double p90,
                                   Double confidence, String reasoning, LocalDateTime now) {
        this.aiEstimateP10 = p10;
        this.aiEstimateP50 = p50;
        this.aiEstimateP90 = p90;
        this.aiConfidence = confidence;
        this.aiReasoning = reasoning;
        this.updatedAt = now;

        boolean fillable = (estimateP10 == null && p10 != null)
                || (estimateP50 == null && p50 != null)
                || (estimateP90 == null && p90 != null);
        Double mergedP10 = estimateP10 != null ? estimateP10 : p10;
        Double mergedP50 = estimateP50 != null ? estimateP50 : p50;
        Double mergedP90 = estimateP90 != null ? estimateP90 : p90;
        if (!fillable || !PrioritizationScoringPolicy.isOrderedRange(mergedP10, mergedP50, mergedP90)) {
            return false;
        }
        this.estimateP10 = mergedP10;
        this.estimateP50 = mergedP50;
        this.estimateP90 = mergedP90;
        return true;
    }

    /**
     * 按当前输入重算派生分数。
     */
    public void recomputeScores() {
        if (riceReach != null && riceImpact != null && riceConfidence != null && riceEffort != null) {
            this.riceScore = PrioritizationScoringPolicy.rice(riceReach, riceImpact, riceConfidence, riceEffort);
        } else {
            this.riceScore = null;
        }
        if (wsjfBusinessValue != null && wsjfTimeCriticality != null && wsjfRiskReduction != null && wsjfJobSize != null) {
            this.wsjfScore = PrioritizationScoringPolicy.wsjf(
                    wsjfBusinessValue, wsjfTimeCriticality, wsjfRiskReduction, wsjfJobSize);
        } else {
            this.wsjfScore = null;
        }
    }

    public Double scoreOf(PrioritizationModelEnum model) {
        if (model == PrioritizationModelEnum.WSJF) {
            return wsjfScore;
        }
        return riceScore;
    }

    /**
     * 三点估算齐全时返回 PERT 期望工期，否则 null
     */
    public Double pertExpectedHours() {
        if (estimateP10 == null || estimateP50 == null || estimateP90 == null) {
            return null;
        }
        return PrioritizationScoringPolicy.pertExpected(estimateP10, estimateP50, estimateP90);
    }
}
