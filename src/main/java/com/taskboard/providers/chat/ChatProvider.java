package com.taskboard.providers.chat;

import java.io.IOException;
import java.util.List;

/**
 * Interface for model chat backends.
 * Each implementation handles the request format of one service and returns plain text.
 */
public interface ChatProvider {

    /**
     * Get the provider name this implementation handles.
     */
    String getProviderName();

    /**
     * Send the conversation and return the assistant's reply text.
     *
     * @throws java.net.http.HttpTimeoutException when the request exceeds the endpoint timeout
     */
    String chat(ChatEndpoint endpoint, List<ChatTurn> turns) throws IOException, InterruptedException;
}
