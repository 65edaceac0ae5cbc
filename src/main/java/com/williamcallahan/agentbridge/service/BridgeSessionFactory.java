package com.williamcallahan.agentbridge.service;

import com.williamcallahan.agentbridge.config.AppProperties;
import com.williamcallahan.agentbridge.domain.completion.ChatCompletionRequest;
import com.williamcallahan.agentbridge.service.auth.CredentialExchange;
import com.williamcallahan.agentbridge.service.auth.CredentialResolver;
import com.williamcallahan.agentbridge.service.auth.IdentityTokenExtractor;
import com.williamcallahan.agentbridge.service.auth.ResolvedCredential;
import com.williamcallahan.agentbridge.service.conversation.ConversationRegistry;
import com.williamcallahan.agentbridge.service.conversation.ConversationTurn;
import com.williamcallahan.agentbridge.service.conversation.EmptyPromptException;
import com.williamcallahan.agentbridge.service.conversation.PromptComposer;
import com.williamcallahan.agentbridge.service.stream.BridgeSession;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Service;

/**
 * Turns an inbound chat request into a {@link BridgeSession} and records finished exchanges so
 * follow-up requests continue the same backend chat.
 */
@Service
public class BridgeSessionFactory {
    private static final Logger log = LoggerFactory.getLogger(BridgeSessionFactory.class);
    private static final Logger PIPELINE_LOG = LoggerFactory.getLogger("PIPELINE");

    private static final String REQUEST_ID_PREFIX = "chatcmpl-";
    private static final int PROMPT_LOG_PREVIEW = 50;

    private final CredentialResolver credentialResolver;
    private final CredentialExchange credentialExchange;
    private final IdentityTokenExtractor identityTokenExtractor;
    private final ConversationRegistry conversationRegistry;
    private final String defaultModel;

    public BridgeSessionFactory(CredentialResolver credentialResolver, CredentialExchange credentialExchange,
                                IdentityTokenExtractor identityTokenExtractor,
                                ConversationRegistry conversationRegistry, AppProperties appProperties) {
        this.credentialResolver = credentialResolver;
        this.credentialExchange = credentialExchange;
        this.identityTokenExtractor = identityTokenExtractor;
        this.conversationRegistry = conversationRegistry;
        this.defaultModel = appProperties.getModels().getDefaultModel();
    }

    /**
     * Authenticates the caller and builds the session for a request.
     *
     * @param authorizationHeader caller's {@code Authorization} header, may be null
     * @param request parsed request body
     * @param callerHeaders caller's headers, filtered later before forwarding
     * @return prepared session
     * @throws com.williamcallahan.agentbridge.service.auth.AuthenticationFailedException on bad credentials
     * @throws com.williamcallahan.agentbridge.service.auth.CredentialUnavailableException when no pooled
     *     credential backs the admin key
     * @throws EmptyPromptException when the messages carry no usable prompt
     */
    public PreparedCompletion prepare(String authorizationHeader, ChatCompletionRequest request,
                                      HttpHeaders callerHeaders) {
        ResolvedCredential credential = credentialResolver.resolve(authorizationHeader);
        if (request.messages().isEmpty()) {
            throw new EmptyPromptException("messages must not be empty");
        }
        String model = request.model() == null || request.model().isBlank() ? defaultModel : request.model();

        String authToken = credentialExchange.exchange(credential.credential());
        String identityToken = identityTokenExtractor.extractUserId(authToken);
        log.debug("Authenticated backend user {} ({} credential)", identityToken,
                credential.pooled() ? "pooled" : "caller");

        List<ConversationTurn> turns = request.messages().stream()
                .map(message -> new ConversationTurn(message.role(), message.text()))
                .toList();
        Optional<String> existingSession = conversationRegistry.findSessionId(turns, model);
        boolean continuing = existingSession.isPresent();
        String sessionId = existingSession.orElseGet(() -> UUID.randomUUID().toString());
        String prompt = PromptComposer.compose(turns, continuing);
        String requestId = REQUEST_ID_PREFIX + UUID.randomUUID();

        if (continuing) {
            PIPELINE_LOG.info("[{}] Continuing session {} (model={}, prompt={}...)", requestId, sessionId, model,
                    preview(prompt));
        } else {
            PIPELINE_LOG.info("[{}] New session {} (model={}, messages={})", requestId, sessionId, model,
                    turns.size());
        }
        BridgeSession session = new BridgeSession(requestId, model, sessionId, identityToken, authToken, prompt,
                callerHeaders);
        return new PreparedCompletion(session, turns, continuing);
    }

    /**
     * Registers the history plus the assistant reply. Blank replies are not registered and a
     * registration failure is logged, never thrown.
     *
     * @param prepared the completed session
     * @param assistantContent full assistant reply
     */
    public void registerExchange(PreparedCompletion prepared, String assistantContent) {
        if (assistantContent == null || assistantContent.isBlank()) {
            return;
        }
        BridgeSession session = prepared.session();
        List<ConversationTurn> history = new ArrayList<>(prepared.turns());
        history.add(new ConversationTurn(ConversationTurn.ROLE_ASSISTANT, assistantContent.trim()));
        try {
            conversationRegistry.register(history, session.model(), session.sessionId());
            PIPELINE_LOG.info("[{}] Registered conversation for session {}", session.requestId(), session.sessionId());
        } catch (RuntimeException registrationFailure) {
            log.error("[{}] Conversation registration failed", session.requestId(), registrationFailure);
        }
    }

    private static String preview(String prompt) {
        return prompt.length() > PROMPT_LOG_PREVIEW ? prompt.substring(0, PROMPT_LOG_PREVIEW) : prompt;
    }
}
