package com.williamcallahan.agentbridge.domain.completion;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.List;

/**
 * One message of an OpenAI chat request.
 *
 * @param role speaker role
 * @param content a string, an array of content parts, or absent
 */
public record ChatMessage(String role, JsonNode content) {

    private static final String TEXT_PART_TYPE = "text";

    /**
     * Flattens the content to text. Array content keeps only {@code text} parts with non-empty text,
     * joined by newlines. Any other content shape yields an empty string.
     *
     * @return text content, empty when there is none
     */
    public String text() {
        if (content == null || content.isNull()) {
            return "";
        }
        if (content.isTextual()) {
            return content.asText();
        }
        if (content.isArray()) {
            List<String> parts = new ArrayList<>();
            for (JsonNode part : content) {
                JsonNode text = part.path("text");
                if (TEXT_PART_TYPE.equals(part.path("type").asText()) && text.isTextual() && !text.asText().isEmpty()) {
                    parts.add(text.asText());
                }
            }
            return String.join("\n", parts);
        }
        return "";
    }
}
