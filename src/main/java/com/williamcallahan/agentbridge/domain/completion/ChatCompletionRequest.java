package com.williamcallahan.agentbridge.domain.completion;

import java.util.List;

/**
 * Inbound OpenAI chat completion request. Fields other than these are accepted and ignored.
 *
 * @param model requested model, may be null
 * @param messages conversation history, may be null
 * @param stream whether to stream the answer, may be null
 */
public record ChatCompletionRequest(String model, List<ChatMessage> messages, Boolean stream) {

    public ChatCompletionRequest {
        messages = messages == null ? List.of() : List.copyOf(messages);
    }

    public boolean streaming() {
        return Boolean.TRUE.equals(stream);
    }
}
