package com.taskboard.providers.chat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.net.http.HttpClient;
import java.util.List;

/**
 * Backends speaking the OpenAI {@code /v1/chat/completions} format (openai, lmstudio, custom).
 */
public class OpenAiCompatibleChatProvider extends AbstractChatProvider {

    private final String providerName;

    public OpenAiCompatibleChatProvider(ObjectMapper mapper, HttpClient httpClient, String providerName) {
        super(mapper, httpClient);
        this.providerName = providerName;
    }

    @Override
    public String getProviderName() {
        return providerName;
    }

    @Override
    public String chat(ChatEndpoint endpoint, List<ChatTurn> turns) throws IOException, InterruptedException {
        String url = normalizeOpenAiBaseUrl(endpoint.getBaseUrl(), defaultBase(providerName)) + "/v1/chat/completions";

        ObjectNode payload = mapper.createObjectNode();
        payload.put("model", endpoint.getModel());
        appendTurns(payload.putArray("messages"), turns);

        String apiKey = endpoint.getApiKey();
        JsonNode response = sendJsonPost(url, payload, apiKey == null ? null : "Bearer " + apiKey,
            endpoint.getTimeoutMs());
        return extractReply(response);
    }

    String extractReply(JsonNode response) {
        JsonNode choices = response.path("choices");
        if (choices.isArray() && choices.size() > 0) {
            JsonNode choice = choices.get(0);
            JsonNode content = choice.path("message").path("content");
            if (!content.isMissingNode() && !content.isNull()) {
                return content.asText();
            }
            JsonNode text = choice.path("text");
            if (!text.isMissingNode()) {
                return text.asText();
            }
        }
        return response.toString();
    }

    private String defaultBase(String provider) {
        switch (provider) {
            case "openai":
                return "https://api.openai.com";
            case "lmstudio":
            default:
                return "http://localhost:1234";
        }
    }

    private String normalizeOpenAiBaseUrl(String baseUrl, String fallback) {
        String url = normalizeBaseUrl(baseUrl, fallback);
        if (url.endsWith("/v1")) {
            url = url.substring(0, url.length() - 3);
        }
        return url;
    }
}
