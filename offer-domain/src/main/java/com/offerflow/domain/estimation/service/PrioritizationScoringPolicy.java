package com.offerflow.domain.estimation.service;

import com.offerflow.types.common.Constants;

import java.math.BigDecimal;

/**
 * 评分引擎：RICE、WSJF 与 PERT 三点估算的纯函数。
 */
public final class PrioritizationScoringPolicy {

    private PrioritizationScoringPolicy() {
    }

    /**
     * RICE = reach * impact * confidence / effort，effort 非正时为 0。
     */
    public static double rice(double reach, double impact, double confidence, double effort) {
        if (effort <= 0D) {
            return 0D;
        }
        return reach * impact * confidence / effort;
    }

    /**
     * WSJF = (businessValue + timeCriticality + riskReduction) / jobSize，jobSize 非正时为 0。
     */
    public static double wsjf(double businessValue, double timeCriticality, double riskReduction, double jobSize) {
        if (jobSize <= 0D) {
            return 0D;
        }
        return (businessValue + timeCriticality + riskReduction) / jobSize;
    }

    /**
     * PERT 期望工期 = (p10 + 4 * p50 + p90) / 6，不做校验。
     */
    public static double pertExpected(double p10, double p50, double p90) {
        return (p10 + 4D * p50 + p90) / 6D;
    }

    public static boolean isValidRiceImpact(Double impact) {
        if (impact == null) {
            return false;
        }
        BigDecimal value = BigDecimal.valueOf(impact);
        for (BigDecimal allowed : Constants.RICE_IMPACT_SCALE) {
            if (allowed.compareTo(value) == 0) {
                return true;
            }
        }
        return false;
    }

    public static boolean isValidRiceConfidence(Double confidence) {
        return confidence != null && confidence > 0D && confidence <= 1D;
    }

    public static boolean isValidWsjfValue(Integer value) {
        return value != null && Constants.WSJF_FIBONACCI_SCALE.contains(value);
    }

    /**
     * 三点估算必须非负且 p10 ≤ p50 ≤ p90。
     */
    public static boolean isOrderedRange(Double p10, Double p50, Double p90) {
        if (p10 == null || p50 == null || p90 == null) {
            return false;
        }
        if (p10 < 0D || p50 < 0D || p90 < 0D) {
            return false;
        }
        return p10 <= p50 && p50 <= p90;
    }
}
