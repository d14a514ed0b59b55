package com.taskboard.providers.chat;

import com.taskboard.AppConfig;

/**
 * Where and how to reach the model backend.
 */
public class ChatEndpoint {

    private final String baseUrl;
    private final String model;
    private final String apiKey;
    private final Integer timeoutMs;

    public ChatEndpoint(String baseUrl, String model, String apiKey, Integer timeoutMs) {
        this.baseUrl = baseUrl;
        this.model = model;
        this.apiKey = apiKey;
        this.timeoutMs = timeoutMs;
    }

    public static ChatEndpoint fromConfig(AppConfig config) {
        return new ChatEndpoint(config.getChatBaseUrl(), config.getChatModel(), config.getChatApiKey(),
            config.getChatTimeoutMs());
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public String getModel() {
        return model;
    }

    public String getApiKey() {
        return apiKey;
    }

    public Integer getTimeoutMs() {
        return timeoutMs;
    }
}
