package com.williamcallahan.agentbridge.service.conversation;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Builds the prompt sent to the backend from a conversation history.
 *
 * <p>A continued backend chat already holds the earlier turns, so only the newest user message is
 * sent. A new chat gets the whole history rendered as {@code role:\ncontent\n} blocks.</p>
 */
public final class PromptComposer {

    private PromptComposer() {}

    /**
     * @param turns incoming history
     * @param continuing whether the backend chat already exists
     * @return the prompt
     * @throws EmptyPromptException if no usable content is found
     */
    public static String compose(List<ConversationTurn> turns, boolean continuing) {
        return continuing ? lastUserMessage(turns) : transcript(turns);
    }

    static String lastUserMessage(List<ConversationTurn> turns) {
        for (int index = turns.size() - 1; index >= 0; index--) {
            ConversationTurn turn = turns.get(index);
            if (turn.isUser()) {
                if (turn.content().isBlank()) {
                    throw new EmptyPromptException("The last user message is empty");
                }
                return turn.content();
            }
        }
        throw new EmptyPromptException("No user message found");
    }

    static String transcript(List<ConversationTurn> turns) {
        String prompt = turns.stream()
                .filter(turn -> !turn.content().isBlank())
                .map(turn -> turn.role() + ":\n" + turn.content() + "\n")
                .collect(Collectors.joining("\n"));
        if (prompt.isBlank()) {
            throw new EmptyPromptException("All messages are empty");
        }
        return prompt;
    }
}
