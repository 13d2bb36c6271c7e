package com.vcc.traingateway.service;

import com.vcc.traingateway.config.GwProperties;
import com.vcc.traingateway.model.Provider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;

/**
 * Rewrites logical model ids for the provider an account calls.
 * Direct API accounts take the id unchanged; Bedrock ids come from a static table merged with
 * {@code gw.routing.model-overrides}. Unknown ids pass through so new model releases keep working.
 */
@Component
public class ModelMapping {
    private static final Logger log = LoggerFactory.getLogger(ModelMapping.class);

    private static final Map<String, String> BEDROCK_MODELS = Map.ofEntries(
            // Claude 4.5
            Map.entry("claude-opus-4-5", "global.anthropic.claude-opus-4-5-20251101-v1:0"),
            Map.entry("claude-opus-4-5-20251101", "global.anthropic.claude-opus-4-5-20251101-v1:0"),
            Map.entry("claude-haiku-4-5", "global.anthropic.claude-haiku-4-5-20251015-v1:0"),
            Map.entry("claude-haiku-4-5-20251015", "global.anthropic.claude-haiku-4-5-20251015-v1:0"),
            Map.entry("claude-haiku-4-5-20251001", "global.anthropic.claude-haiku-4-5-20251001-v1:0"),
            Map.entry("claude-sonnet-4-5", "global.anthropic.claude-sonnet-4-5-20250929-v1:0"),
            Map.entry("claude-sonnet-4-5-20250929", "global.anthropic.claude-sonnet-4-5-20250929-v1:0"),
            // Claude 4.1 / 4
            Map.entry("claude-opus-4-1", "us.anthropic.claude-opus-4-1-20250805-v1:0"),
            Map.entry("claude-opus-4-1-20250805", "us.anthropic.claude-opus-4-1-20250805-v1:0"),
            Map.entry("claude-sonnet-4-20250514", "global.anthropic.claude-sonnet-4-20250514-v1:0"),
            Map.entry("claude-opus-4-20250514", "global.anthropic.claude-opus-4-20250514-v1:0"),
            // Claude 3.x
            Map.entry("claude-3-5-sonnet-20241022", "us.anthropic.claude-3-5-sonnet-20241022-v2:0"),
            Map.entry("claude-3-5-sonnet-20240620", "us.anthropic.claude-3-5-sonnet-20240620-v1:0"),
            Map.entry("claude-3-5-haiku-20241022", "us.anthropic.claude-3-5-haiku-20241022-v1:0"),
            Map.entry("claude-3-opus-20240229", "us.anthropic.claude-3-opus-20240229-v1:0"),
            Map.entry("claude-3-sonnet-20240229", "us.anthropic.claude-3-sonnet-20240229-v1:0"),
            Map.entry("claude-3-haiku-20240307", "us.anthropic.claude-3-haiku-20240307-v1:0")
    );

    private final Map<String, String> bedrockModels;

    public ModelMapping(GwProperties properties) {
        Map<String, String> merged = new HashMap<>(BEDROCK_MODELS);
        Map<String, String> overrides = properties.getRouting().getModelOverrides();
        if (overrides != null && !overrides.isEmpty()) {
            merged.putAll(overrides);
            log.info("Loaded {} Bedrock model overrides", overrides.size());
        }
        this.bedrockModels = Map.copyOf(merged);
    }

    public String toProviderModel(Provider provider, String logicalModel) {
        if (logicalModel == null || provider != Provider.BEDROCK) {
            return logicalModel;
        }
        String mapped = bedrockModels.get(logicalModel);
        if (mapped == null) {
            log.debug("No Bedrock mapping for model {}, passing through", logicalModel);
            return logicalModel;
        }
        return mapped;
    }
}
