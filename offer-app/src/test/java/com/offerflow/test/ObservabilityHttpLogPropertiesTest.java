package com.offerflow.test;

import com.offerflow.config.ObservabilityHttpLogProperties;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.springframework.util.AntPathMatcher;

import java.util.List;

public class ObservabilityHttpLogPropertiesTest {

    private final AntPathMatcher pathMatcher = new AntPathMatcher();

    @Test
    public void shouldUseModelThresholdForModelCallPaths() {
        ObservabilityHttpLogProperties properties = new ObservabilityHttpLogProperties();

        Assertions.assertEquals(20000L,
                properties.slowThresholdFor("/api/planning/projects/3/dependencies/infer", pathMatcher));
        Assertions.assertEquals(20000L,
                properties.slowThresholdFor("/api/lifecycle/projects/3/generate", pathMatcher));
        Assertions.assertEquals(1000L,
                properties.slowThresholdFor("/api/planning/projects/3/dependencies", pathMatcher));
        Assertions.assertEquals(1000L, properties.slowThresholdFor(null, pathMatcher));
    }

    @Test
    public void shouldClampNegativeThresholdsAndHonourOverrides() {
        ObservabilityHttpLogProperties properties = new ObservabilityHttpLogProperties();
        properties.setSlowRequestThresholdMs(-5L);
        properties.setModelCallPathPatterns(List.of("/api/planning/decisions/*"));
        properties.setModelCallSlowThresholdMs(3000L);

        Assertions.assertEquals(0L, properties.slowThresholdFor("/api/planning/stories/1/estimate/generate", pathMatcher));
        Assertions.assertEquals(3000L, properties.slowThresholdFor("/api/planning/decisions/4", pathMatcher));
    }
}
