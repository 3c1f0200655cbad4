package com.llmcommittee.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Connection settings for the OpenAI-compatible backend API and the backend label catalog.
 */
@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "committee.provider")
public class BackendProviderProperties {

    private String baseUrl = "https://openrouter.ai/api/v1";
    private String apiKey = "";
    private String appUrl = "http://localhost:3000";
    private String appTitle = "LLM Committee";
    private int connectTimeoutSeconds = 10;
    private int callTimeoutSeconds = 120;

    /**
     * Display labels keyed by backend id. Unknown ids are shown as the id itself.
     */
    private Map<String, String> labels = defaultLabels();

    private static Map<String, String> defaultLabels() {
        Map<String, String> labels = new LinkedHashMap<>();
        labels.put("anthropic/claude-sonnet-4", "Claude Sonnet 4");
        labels.put("openai/gpt-4o", "GPT-4o");
        labels.put("google/gemini-2.0-flash-001", "Gemini 2.0 Flash");
        labels.put("anthropic/claude-3.5-haiku", "Claude 3.5 Haiku");
        labels.put("openai/gpt-4o-mini", "GPT-4o Mini");
        labels.put("meta-llama/llama-3.3-70b-instruct", "Llama 3.3 70B");
        labels.put("mistralai/mistral-large-2411", "Mistral Large");
        labels.put("deepseek/deepseek-chat", "DeepSeek Chat");
        return labels;
    }
}
