package com.williamcallahan.agentbridge.web;

import com.williamcallahan.agentbridge.config.AppProperties;
import com.williamcallahan.agentbridge.domain.completion.ChatCompletionRequest;
import com.williamcallahan.agentbridge.domain.completion.ChatCompletionResponse;
import com.williamcallahan.agentbridge.domain.completion.ModelList;
import com.williamcallahan.agentbridge.service.BridgeSessionFactory;
import com.williamcallahan.agentbridge.service.PreparedCompletion;
import com.williamcallahan.agentbridge.service.stream.AgentCompletionService;
import com.williamcallahan.agentbridge.service.stream.BridgeSession;
import com.williamcallahan.agentbridge.service.stream.CompletionFrameEncoder;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Iterator;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * OpenAI-compatible chat completion endpoints.
 */
@RestController
@RequestMapping("/v1")
public class ChatCompletionsController extends BaseController {
    private static final Logger log = LoggerFactory.getLogger(ChatCompletionsController.class);
    private static final Logger PIPELINE_LOG = LoggerFactory.getLogger("PIPELINE");

    private final BridgeSessionFactory sessionFactory;
    private final AgentCompletionService completionService;
    private final CompletionFrameEncoder encoder;
    private final AppProperties appProperties;

    public ChatCompletionsController(BridgeSessionFactory sessionFactory, AgentCompletionService completionService,
                                     CompletionFrameEncoder encoder, AppProperties appProperties,
                                     ExceptionResponseBuilder exceptionBuilder) {
        super(exceptionBuilder);
        this.sessionFactory = sessionFactory;
        this.completionService = completionService;
        this.encoder = encoder;
        this.appProperties = appProperties;
    }

    /**
     * Runs a chat completion against the agent backend.
     *
     * <p>With {@code stream=true} the answer is written straight to the response as event-stream
     * frames, each flushed as soon as it is produced; otherwise the whole answer is returned as one
     * completion object.</p>
     *
     * <p>Streams are drained on the request thread and written verbatim rather than returned as a
     * {@code Flux}, because Spring's event-stream writer emits {@code data:} without the trailing
     * space that OpenAI clients expect.</p>
     *
     * @param authorization bearer API key or backend cookie
     * @param request OpenAI chat request
     * @param headers caller headers, some of which are forwarded to the backend
     * @param response servlet response the stream is written to
     * @return the completion object, or null once a stream has been written
     */
    @PostMapping("/chat/completions")
    public ResponseEntity<ChatCompletionResponse> completions(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @RequestBody ChatCompletionRequest request,
            @RequestHeader HttpHeaders headers,
            HttpServletResponse response) throws IOException {
        PreparedCompletion prepared = sessionFactory.prepare(authorization, request, headers);
        if (request.streaming()) {
            stream(prepared, response);
            return null;
        }
        return ResponseEntity.ok(aggregate(prepared));
    }

    @GetMapping("/models")
    public ModelList models() {
        AppProperties.Models models = appProperties.getModels();
        return ModelList.of(models.getAvailable().stream()
                .map(id -> ModelList.ModelCard.of(id, models.getCreated(), models.getOwnedBy()))
                .toList());
    }

    private ChatCompletionResponse aggregate(PreparedCompletion prepared) {
        BridgeSession session = prepared.session();
        String content;
        try {
            content = completionService.aggregateCompletion(session).block();
        } catch (RuntimeException failure) {
            CompletionMetrics.record(CompletionMetrics.MODE_AGGREGATE, CompletionMetrics.OUTCOME_FAILED);
            throw failure;
        }
        String fullContent = content == null ? "" : content;
        CompletionMetrics.record(CompletionMetrics.MODE_AGGREGATE, CompletionMetrics.OUTCOME_COMPLETED);
        sessionFactory.registerExchange(prepared, fullContent);
        return encoder.completion(session, fullContent);
    }

    private void stream(PreparedCompletion prepared, HttpServletResponse response) throws IOException {
        BridgeSession session = prepared.session();
        response.setStatus(HttpServletResponse.SC_OK);
        response.setContentType(StreamingConstants.EVENT_STREAM_UTF8.toString());
        response.setHeader(HttpHeaders.CACHE_CONTROL, StreamingConstants.CACHE_CONTROL_NO_CACHE);
        response.setHeader(StreamingConstants.PROXY_BUFFERING_HEADER, StreamingConstants.PROXY_BUFFERING_DISABLED);

        StringBuilder content = new StringBuilder();
        AtomicReference<Throwable> failure = new AtomicReference<>();
        OutputStream output = response.getOutputStream();
        // Closing the stream cancels the subscription, which closes the backend socket
        try (Stream<String> frames =
                     completionService.streamCompletion(session, content::append, failure::set).toStream()) {
            Iterator<String> iterator = frames.iterator();
            while (iterator.hasNext()) {
                write(output, iterator.next());
            }
        } catch (IOException disconnected) {
            PIPELINE_LOG.info("[{}] Client disconnected: {}", session.requestId(), disconnected.getMessage());
            CompletionMetrics.record(CompletionMetrics.MODE_STREAM, CompletionMetrics.OUTCOME_DISCONNECTED);
            throw disconnected;
        }
        CompletionMetrics.record(CompletionMetrics.MODE_STREAM,
                failure.get() == null ? CompletionMetrics.OUTCOME_COMPLETED : CompletionMetrics.OUTCOME_FAILED);
        log.debug("[{}] Streamed {} chars", session.requestId(), content.length());
        sessionFactory.registerExchange(prepared, content.toString());
    }

    private static void write(OutputStream output, String frame) throws IOException {
        output.write(frame.getBytes(StandardCharsets.UTF_8));
        output.flush();
    }
}
