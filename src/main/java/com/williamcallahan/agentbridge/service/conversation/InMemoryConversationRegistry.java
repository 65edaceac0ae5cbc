package com.williamcallahan.agentbridge.service.conversation;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.williamcallahan.agentbridge.config.AppProperties;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Caffeine-backed registry. Entries expire a fixed time after they are written and the cache is
 * size-bounded, so abandoned conversations age out on their own.
 */
@Service
public class InMemoryConversationRegistry implements ConversationRegistry {
    private static final Logger log = LoggerFactory.getLogger(InMemoryConversationRegistry.class);

    private final Cache<String, String> sessionsByFingerprint;

    public InMemoryConversationRegistry(AppProperties appProperties) {
        AppProperties.Conversations settings = appProperties.getConversations();
        this.sessionsByFingerprint = Caffeine.newBuilder()
                .expireAfterWrite(settings.getTtl())
                .maximumSize(settings.getMaxEntries())
                .build();
    }

    @Override
    public Optional<String> findSessionId(List<ConversationTurn> turns, String model) {
        int lastAssistant = lastAssistantIndex(turns);
        if (lastAssistant < 0) {
            return Optional.empty();
        }
        String fingerprint = ConversationFingerprint.of(turns.subList(0, lastAssistant + 1), model);
        Optional<String> sessionId = Optional.ofNullable(sessionsByFingerprint.getIfPresent(fingerprint));
        log.debug("Conversation lookup over {} turns: {}", lastAssistant + 1,
                sessionId.isPresent() ? "hit" : "miss");
        return sessionId;
    }

    @Override
    public void register(List<ConversationTurn> turns, String model, String sessionId) {
        if (turns.isEmpty() || sessionId == null || sessionId.isBlank()) {
            throw new IllegalArgumentException("A conversation needs turns and a session id");
        }
        sessionsByFingerprint.put(ConversationFingerprint.of(turns, model), sessionId);
    }

    long size() {
        sessionsByFingerprint.cleanUp();
        return sessionsByFingerprint.estimatedSize();
    }

    private static int lastAssistantIndex(List<ConversationTurn> turns) {
        for (int index = turns.size() - 1; index >= 0; index--) {
            if (turns.get(index).isAssistant()) {
                return index;
            }
        }
        return -1;
    }
}
