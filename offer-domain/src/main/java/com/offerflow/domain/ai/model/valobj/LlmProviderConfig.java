package com.offerflow.domain.ai.model.valobj;

import com.offerflow.types.enums.LlmProviderEnum;

/**
 * 模型提供方配置，作为显式参数传入每一次模型调用。
 *
 * @param provider 提供方
 * @param model 模型名，可空（使用提供方默认模型）
 */
public record LlmProviderConfig(LlmProviderEnum provider, String model) {

    public static LlmProviderConfig stub() {
        return new LlmProviderConfig(LlmProviderEnum.STUB, null);
    }

    public LlmProviderEnum providerOrDefault() {
        return provider == null ? LlmProviderEnum.STUB : provider;
    }
}
