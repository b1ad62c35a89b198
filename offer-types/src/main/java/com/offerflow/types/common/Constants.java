package com.offerflow.types.common;

import java.math.BigDecimal;
import java.util.List;

/**
 * 全局常量定义类。
 *
 * @author offerflow
 * @since 2026-10-19
 */
public final class Constants {

    /** 节点缺少估算时使用的默认工时（小时） */
    public static final double DEFAULT_NODE_DURATION_HOURS = 8.0D;

    /** 生成生命周期时阶段的默认时长（天） */
    public static final int DEFAULT_PHASE_DURATION_DAYS = 30;

    /** 生成服务任务时的默认工期（天） */
    public static final int DEFAULT_TASK_DURATION_DAYS = 5;

    /** RICE impact 允许取值 */
    public static final List<BigDecimal> RICE_IMPACT_SCALE = List.of(
            new BigDecimal("0.25"), new BigDecimal("0.5"), BigDecimal.ONE, new BigDecimal("2"), new BigDecimal("3"));

    /** WSJF 各输入允许取值（修正斐波那契） */
    public static final List<Integer> WSJF_FIBONACCI_SCALE = List.of(1, 2, 3, 5, 8, 13, 21);

    private Constants() {
    }

}
