package com.williamcallahan.agentbridge.service.upstream;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.williamcallahan.agentbridge.config.AppProperties;
import com.williamcallahan.agentbridge.service.stream.BridgeSession;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

/**
 * Issues the out-of-band call that asks the backend to start generating for a chat history.
 */
@Service
public class TriggerClient {
    private static final Logger log = LoggerFactory.getLogger(TriggerClient.class);

    static final String TRIGGER_PATH = "/engine-agent/chat";
    private static final int BODY_EXCERPT_LENGTH = 200;

    /** Managed by the HTTP client for the outgoing body; forwarding them would corrupt the request. */
    private static final List<String> TRANSPORT_HEADERS = List.of(HttpHeaders.CONTENT_LENGTH, HttpHeaders.HOST);

    private final WebClient webClient;
    private final ForwardedHeaderFilter headerFilter;
    private final String origin;

    public TriggerClient(WebClient upstreamWebClient, ForwardedHeaderFilter headerFilter, AppProperties appProperties) {
        this.webClient = upstreamWebClient;
        this.headerFilter = headerFilter;
        this.origin = appProperties.getUpstream().getOrigin();
    }

    /**
     * Sends the trigger call.
     *
     * @param session session whose prompt should be generated
     * @return the HTTP status on success; fails with {@link TriggerCallException} otherwise
     */
    public Mono<Integer> send(BridgeSession session) {
        HttpHeaders headers = buildHeaders(session);
        return webClient.post()
                .uri(TRIGGER_PATH)
                .headers(outgoing -> outgoing.addAll(headers))
                .bodyValue(new TriggerRequest(session.prompt(), session.sessionId(), session.model()))
                .exchangeToMono(response -> {
                    int statusCode = response.statusCode().value();
                    if (response.statusCode().is2xxSuccessful()) {
                        return response.releaseBody().thenReturn(statusCode);
                    }
                    return response.bodyToMono(String.class)
                            .defaultIfEmpty("")
                            .flatMap(body -> Mono.error(new TriggerCallException(statusCode, excerpt(body))));
                })
                .onErrorMap(failure -> !(failure instanceof TriggerCallException), TriggerCallException::new);
    }

    /**
     * Sends the trigger call and logs any failure instead of propagating it.
     *
     * @param session session whose prompt should be generated
     * @return a publisher that always completes empty
     */
    public Mono<Void> fire(BridgeSession session) {
        return send(session)
                .doOnNext(statusCode -> log.info("[{}] POST {} status: {}", session.requestId(), TRIGGER_PATH, statusCode))
                .doOnError(TriggerCallException.class, failure -> {
                    if (failure.statusCode() > 0) {
                        log.warn("[{}] Trigger call rejected: {}", session.requestId(), failure.getMessage());
                    } else {
                        log.error("[{}] Trigger call failed: {}", session.requestId(), failure.getMessage());
                    }
                })
                .onErrorResume(TriggerCallException.class, failure -> Mono.empty())
                .then();
    }

    HttpHeaders buildHeaders(BridgeSession session) {
        HttpHeaders headers = headerFilter.filter(session.callerHeaders());
        TRANSPORT_HEADERS.forEach(headers::remove);
        // Mandatory headers replace caller values of the same name, whatever their case
        headers.setBearerAuth(session.authToken());
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setOrigin(origin);
        headers.set(HttpHeaders.REFERER, origin + "/" + session.sessionId());
        return headers;
    }

    private static String excerpt(String body) {
        return body.length() > BODY_EXCERPT_LENGTH ? body.substring(0, BODY_EXCERPT_LENGTH) : body;
    }

    /** Trigger payload; the backend calls the session id a chat-history id. */
    public record TriggerRequest(
            String prompt,
            @JsonProperty("chatHistoryId") String sessionId,
            @JsonProperty("adapterName") String model) {}
}
