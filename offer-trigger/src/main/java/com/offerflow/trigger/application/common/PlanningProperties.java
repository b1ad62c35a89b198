package com.offerflow.trigger.application.common;

import com.offerflow.types.common.Constants;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * 规划计算配置。
 */
@Data
@Component
@ConfigurationProperties(prefix = "offerflow.planning", ignoreInvalidFields = true)
public class PlanningProperties {

    /** 无估算节点的默认时长（小时）。 */
    private double defaultNodeDurationHours = Constants.DEFAULT_NODE_DURATION_HOURS;
}
