package com.offerflow.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.util.PathMatcher;

import java.util.Arrays;
import java.util.List;

/**
 * HTTP 入口日志配置（observability.http-log）。
 * <p>
 * 依赖推断、区间估算与生命周期生成按 modelCallSlowThresholdMs 判定慢请求，其余路径按 slowRequestThresholdMs。
 * </p>
 */
@Data
@Component
@ConfigurationProperties(prefix = "observability.http-log", ignoreInvalidFields = true)
public class ObservabilityHttpLogProperties {

    private boolean enabled = true;

    /** 记录日志的路径，为空时记录全部 */
    private List<String> includePathPatterns = Arrays.asList("/api/**");

    private List<String> excludePathPatterns = Arrays.asList("/actuator/**");

    /** 超过该耗时即使未采样也输出 HTTP_OUT */
    private long slowRequestThresholdMs = 1000L;

    /** 调用模型的接口路径 */
    private List<String> modelCallPathPatterns = Arrays.asList(
            "/api/planning/projects/*/dependencies/infer",
            "/api/planning/stories/*/estimate/generate",
            "/api/lifecycle/projects/*/generate");

    private long modelCallSlowThresholdMs = 20000L;

    /** 采样比例（0~1） */
    private double sampleRate = 1.0D;

    /**
     * 按路径取慢请求阈值，负数按 0 处理。
     */
    public long slowThresholdFor(String path, PathMatcher pathMatcher) {
        if (path != null && modelCallPathPatterns != null) {
            for (String pattern : modelCallPathPatterns) {
                if (pattern != null && !pattern.isBlank() && pathMatcher.match(pattern.trim(), path)) {
                    return Math.max(modelCallSlowThresholdMs, 0L);
                }
            }
        }
        return Math.max(slowRequestThresholdMs, 0L);
    }
}
