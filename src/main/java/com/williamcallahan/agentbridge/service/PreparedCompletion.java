package com.williamcallahan.agentbridge.service;

import com.williamcallahan.agentbridge.service.conversation.ConversationTurn;
import com.williamcallahan.agentbridge.service.stream.BridgeSession;
import java.util.List;

/**
 * A session ready to run together with the history it was built from.
 *
 * @param session session handed to the completion engine
 * @param turns incoming history, used to register the exchange afterwards
 * @param continuing whether the session continues an earlier backend chat
 */
public record PreparedCompletion(BridgeSession session, List<ConversationTurn> turns, boolean continuing) {

    public PreparedCompletion {
        turns = List.copyOf(turns);
    }
}
