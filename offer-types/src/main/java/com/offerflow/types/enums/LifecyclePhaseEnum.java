package com.offerflow.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 产品/服务上市生命周期阶段枚举。
 * <p>
 * 顺序固定为 1..6，阶段门禁按 {@link #getOrder()} 判定前序阶段。
 * </p>
 *
 * @author offerflow
 * @since 2026-10-19
 */
public enum LifecyclePhaseEnum {

    /** 概念 */
    CONCEPT("concept", 1),

    /** 定义 */
    DEFINE("define", 2),

    /** 规划 */
    PLAN("plan", 3),

    /** 开发 */
    DEVELOP("develop", 4),

    /** 上市 */
    LAUNCH("launch", 5),

    /** 持续运营 */
    SUSTAIN("sustain", 6);

    private final String code;
    private final int order;

    LifecyclePhaseEnum(String code, int order) {
        this.code = code;
        this.order = order;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public int getOrder() {
        return order;
    }

    public static LifecyclePhaseEnum fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (LifecyclePhaseEnum phase : LifecyclePhaseEnum.values()) {
            if (phase.code.equalsIgnoreCase(code.trim())) {
                return phase;
            }
        }
        throw new IllegalArgumentException("Unknown lifecycle phase code: " + code);
    }

    public static LifecyclePhaseEnum fromOrder(int order) {
        for (LifecyclePhaseEnum phase : LifecyclePhaseEnum.values()) {
            if (phase.order == order) {
                return phase;
            }
        }
        return null;
    }
}
