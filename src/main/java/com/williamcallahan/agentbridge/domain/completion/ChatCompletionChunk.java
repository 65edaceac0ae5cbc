package com.williamcallahan.agentbridge.domain.completion;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * OpenAI {@code chat.completion.chunk} envelope carried by each event-stream frame.
 *
 * @param id completion id shared by every chunk of one response
 * @param object always {@code chat.completion.chunk}
 * @param created creation time in epoch seconds
 * @param model model name echoed back to the caller
 * @param choices single-element choice list
 */
public record ChatCompletionChunk(String id, String object, long created, String model, List<Choice> choices) {

    public static final String OBJECT_TYPE = "chat.completion.chunk";

    /**
     * Creates a one-choice chunk.
     *
     * @param id completion id
     * @param created creation time in epoch seconds
     * @param model model name
     * @param content incremental content; null or empty yields an empty delta
     * @param finishReason finish reason, null until the final chunk
     * @return chunk envelope
     */
    public static ChatCompletionChunk of(String id, long created, String model, String content, String finishReason) {
        Delta delta = new Delta(content == null || content.isEmpty() ? null : content);
        return new ChatCompletionChunk(id, OBJECT_TYPE, created, model, List.of(new Choice(0, delta, finishReason, null)));
    }

    /**
     * Streaming choice. {@code finish_reason} and {@code logprobs} are serialized even when null.
     */
    public record Choice(
            int index,
            Delta delta,
            @JsonProperty("finish_reason") String finishReason,
            Object logprobs) {}

    /** Incremental content; serializes as {@code {}} when there is none. */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Delta(String content) {}
}
