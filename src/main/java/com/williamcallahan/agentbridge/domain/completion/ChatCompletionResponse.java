package com.williamcallahan.agentbridge.domain.completion;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * OpenAI {@code chat.completion} envelope returned for non-streaming requests.
 *
 * <p>The backend reports no token counts, so usage is always zero.</p>
 */
public record ChatCompletionResponse(
        String id,
        String object,
        long created,
        String model,
        List<Choice> choices,
        Usage usage) {

    public static final String OBJECT_TYPE = "chat.completion";
    public static final String FINISH_REASON_STOP = "stop";
    private static final String ROLE_ASSISTANT = "assistant";

    /**
     * Creates a single-choice assistant completion.
     *
     * @param id completion id
     * @param created creation time in epoch seconds
     * @param model model name
     * @param content full assistant content
     * @return completion envelope
     */
    public static ChatCompletionResponse of(String id, long created, String model, String content) {
        Choice choice = new Choice(0, new Message(ROLE_ASSISTANT, content), FINISH_REASON_STOP, null);
        return new ChatCompletionResponse(id, OBJECT_TYPE, created, model, List.of(choice), Usage.EMPTY);
    }

    public record Choice(
            int index,
            Message message,
            @JsonProperty("finish_reason") String finishReason,
            Object logprobs) {}

    public record Message(String role, String content) {}

    public record Usage(
            @JsonProperty("prompt_tokens") int promptTokens,
            @JsonProperty("completion_tokens") int completionTokens,
            @JsonProperty("total_tokens") int totalTokens) {

        static final Usage EMPTY = new Usage(0, 0, 0);
    }
}
