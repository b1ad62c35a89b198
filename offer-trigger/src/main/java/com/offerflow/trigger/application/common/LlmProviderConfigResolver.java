package com.offerflow.trigger.application.common;

import com.offerflow.domain.ai.model.valobj.LlmProviderConfig;
import com.offerflow.types.enums.LlmProviderEnum;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

/**
 * 由服务端配置与单次请求覆盖项合成模型提供方配置。
 */
@Component
public class LlmProviderConfigResolver {

    private final AiProviderProperties properties;

    public LlmProviderConfigResolver(AiProviderProperties properties) {
        this.properties = properties;
    }

    public LlmProviderConfig resolve(String providerOverride, String modelOverride) {
        String providerCode = StringUtils.defaultIfBlank(providerOverride, properties.getProvider());
        LlmProviderEnum provider = EnumCodeParser.optional(providerCode, LlmProviderEnum::fromCode, "provider");
        String model = StringUtils.defaultIfBlank(modelOverride, properties.getModel());
        return new LlmProviderConfig(provider == null ? LlmProviderEnum.STUB : provider, StringUtils.trimToNull(model));
    }
}
