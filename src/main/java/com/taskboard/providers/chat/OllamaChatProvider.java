package com.taskboard.providers.chat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.net.http.HttpClient;
import java.util.List;

/**
 * Non-streaming requests to Ollama's {@code /api/chat}.
 */
public class OllamaChatProvider extends AbstractChatProvider {

    public static final String DEFAULT_BASE_URL = "http://localhost:11434";

    public OllamaChatProvider(ObjectMapper mapper, HttpClient httpClient) {
        super(mapper, httpClient);
    }

    @Override
    public String getProviderName() {
        return "ollama";
    }

    @Override
    public String chat(ChatEndpoint endpoint, List<ChatTurn> turns) throws IOException, InterruptedException {
        String url = normalizeBaseUrl(endpoint.getBaseUrl(), DEFAULT_BASE_URL) + "/api/chat";
        return extractReply(sendJsonPost(url, buildPayload(endpoint, turns), null, endpoint.getTimeoutMs()));
    }

    ObjectNode buildPayload(ChatEndpoint endpoint, List<ChatTurn> turns) {
        ObjectNode payload = mapper.createObjectNode();
        payload.put("model", endpoint.getModel());
        payload.put("stream", false);
        appendTurns(payload.putArray("messages"), turns);
        return payload;
    }

    String extractReply(JsonNode response) {
        JsonNode content = response.path("message").path("content");
        if (!content.isMissingNode()) {
            return content.asText();
        }
        JsonNode text = response.path("response");
        if (!text.isMissingNode()) {
            return text.asText();
        }
        return response.toString();
    }
}
