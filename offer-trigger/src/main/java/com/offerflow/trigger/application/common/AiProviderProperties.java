package com.offerflow.trigger.application.common;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * 模型提供方配置。
 */
@Data
@Component
@ConfigurationProperties(prefix = "offerflow.ai", ignoreInvalidFields = true)
public class AiProviderProperties {

    /** 提供方编码：stub / openai。 */
    private String provider = "stub";

    /** 模型名，空则使用提供方默认模型。 */
    private String model;
}
