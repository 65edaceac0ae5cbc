package com.williamcallahan.agentbridge.service.conversation;

import java.util.List;
import java.util.Optional;

/**
 * Remembers which backend session a conversation history belongs to, so a client that resends
 * the full history continues the same backend chat instead of starting a new one.
 */
public interface ConversationRegistry {

    /**
     * Finds the session for an incoming history.
     *
     * @param turns history as sent by the client
     * @param model requested model
     * @return the session id when the history up to its last assistant turn was registered before
     */
    Optional<String> findSessionId(List<ConversationTurn> turns, String model);

    /**
     * Records a completed exchange.
     *
     * @param turns full history including the assistant reply just produced
     * @param model model used
     * @param sessionId backend session the exchange ran on
     */
    void register(List<ConversationTurn> turns, String model, String sessionId);
}
