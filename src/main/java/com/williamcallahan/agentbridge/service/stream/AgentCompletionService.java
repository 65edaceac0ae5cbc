package com.williamcallahan.agentbridge.service.stream;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.williamcallahan.agentbridge.service.AgentBridgeException;
import com.williamcallahan.agentbridge.service.upstream.BackendSocket;
import com.williamcallahan.agentbridge.service.upstream.SessionInitiator;
import java.util.Optional;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.FluxSink;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Runs completions against the agent backend and renders them for callers.
 *
 * <p>Both renditions drive one {@link SessionTranslator} per request over the session's socket
 * events. The consumption loop blocks on the event queue, so it runs on {@code boundedElastic}.</p>
 *
 * <p>There is no deadline: a backend that never reports completion keeps the session open until
 * the socket closes or the caller cancels.</p>
 */
@Service
public class AgentCompletionService {
    private static final Logger log = LoggerFactory.getLogger(AgentCompletionService.class);
    private static final Logger PIPELINE_LOG = LoggerFactory.getLogger("PIPELINE");

    private static final String ERROR_CONTENT_PREFIX = "Error: ";

    private final SessionInitiator sessionInitiator;
    private final CompletionFrameEncoder encoder;
    private final UpstreamEventDecoder decoder;

    public AgentCompletionService(SessionInitiator sessionInitiator, CompletionFrameEncoder encoder,
                                  ObjectMapper objectMapper) {
        this.sessionInitiator = sessionInitiator;
        this.encoder = encoder;
        this.decoder = new UpstreamEventDecoder(objectMapper);
    }

    /**
     * Streams a completion as encoded event-stream frames.
     *
     * <p>A priming frame is emitted before the socket is even opened. The trigger call runs
     * concurrently with consumption. Any failure after the priming frame becomes an error-content
     * frame, so the stream always ends with the finish frame and {@code data: [DONE]}.
     * Cancelling the subscription closes the socket.</p>
     *
     * @param session session to run
     * @param contentObserver receives the text of every delta and marker frame, in order
     * @return cold, single-use flux of encoded frames
     */
    public Flux<String> streamCompletion(BridgeSession session, Consumer<String> contentObserver) {
        return streamCompletion(session, contentObserver, failure -> { });
    }

    /**
     * Streams a completion, reporting a failure that was rendered as error content.
     *
     * @param session session to run
     * @param contentObserver receives the text of every delta and marker frame, in order
     * @param failureObserver called at most once with the cause when the stream ends in an error frame
     * @return cold, single-use flux of encoded frames
     */
    public Flux<String> streamCompletion(BridgeSession session, Consumer<String> contentObserver,
                                         Consumer<Throwable> failureObserver) {
        return Flux.<String>create(sink -> runStreaming(session, contentObserver, failureObserver, sink))
                .subscribeOn(Schedulers.boundedElastic());
    }

    /**
     * Runs a completion and returns the concatenated text.
     *
     * <p>The trigger call is awaited before consumption starts. A socket close ends the completion
     * with whatever arrived; a socket failure or connection failure before the backend reports
     * completion fails the returned {@code Mono} with the original cause attached.</p>
     *
     * @param session session to run
     * @return the full assistant content, thinking markers included
     */
    public Mono<String> aggregateCompletion(BridgeSession session) {
        return Mono.fromCallable(() -> runAggregate(session))
                .onErrorMap(failure -> !(failure instanceof AgentBridgeException),
                        failure -> new PipelineFailureException("Completion pipeline failed: " + failure, failure))
                .subscribeOn(Schedulers.boundedElastic());
    }

    private void runStreaming(BridgeSession session, Consumer<String> contentObserver,
                              Consumer<Throwable> failureObserver, FluxSink<String> sink) {
        String requestId = session.requestId();
        sink.next(encoder.priming(session));

        SessionTranslator translator = new SessionTranslator(requestId, decoder);
        SocketEventQueue events = new SocketEventQueue().claim();
        BackendSocket socket = null;
        int emittedFrames = 0;
        try {
            socket = sessionInitiator.openSocket(session, events);
            sink.onCancel(socket::close);
            sessionInitiator.trigger(session).subscribe();

            while (!sink.isCancelled()) {
                Optional<SocketEvent> next = events.next();
                if (next.isEmpty()) {
                    break;
                }
                SessionTranslator.Step step = translator.accept(next.get());
                emittedFrames += emit(session, step, contentObserver, sink);
                if (step.outcome() == SessionTranslator.Outcome.FAILED) {
                    log.error("[{}] Backend socket failed: {}", requestId, describe(step.failure()));
                    failureObserver.accept(step.failure());
                    sink.next(encoder.chunk(session, errorContent(step.failure()), null));
                }
                if (step.terminal()) {
                    PIPELINE_LOG.info("[{}] Stream ended ({}) after {} frames", requestId, step.outcome(), emittedFrames);
                    break;
                }
            }
        } catch (InterruptedException interrupted) {
            Thread.currentThread().interrupt();
            emitFailure(session, translator, contentObserver, sink, interrupted);
            failureObserver.accept(interrupted);
        } catch (RuntimeException failure) {
            emitFailure(session, translator, contentObserver, sink, failure);
            failureObserver.accept(failure);
        } finally {
            if (socket != null) {
                socket.close();
            }
        }
        if (!translator.isTerminated()) {
            // Cancelled by the caller
            translator.abort();
        }
        sink.next(encoder.finish(session));
        sink.next(encoder.done());
        sink.complete();
    }

    private String runAggregate(BridgeSession session) throws InterruptedException {
        String requestId = session.requestId();
        SessionTranslator translator = new SessionTranslator(requestId, decoder);
        SocketEventQueue events = new SocketEventQueue().claim();
        StringBuilder content = new StringBuilder();

        try (BackendSocket socket = sessionInitiator.openSocket(session, events)) {
            sessionInitiator.trigger(session).block();
            while (true) {
                Optional<SocketEvent> next = events.next();
                if (next.isEmpty()) {
                    break;
                }
                SessionTranslator.Step step = translator.accept(next.get());
                step.frames().forEach(frame -> content.append(frame.text()));
                if (step.outcome() == SessionTranslator.Outcome.FAILED) {
                    throw new PipelineFailureException("Backend socket failed before completion", step.failure());
                }
                if (step.terminal()) {
                    PIPELINE_LOG.info("[{}] Aggregate ended ({}) with {} chars", requestId, step.outcome(),
                            content.length());
                    break;
                }
            }
        }
        return content.toString();
    }

    private int emit(BridgeSession session, SessionTranslator.Step step, Consumer<String> contentObserver,
                     FluxSink<String> sink) {
        for (StreamFrame frame : step.frames()) {
            contentObserver.accept(frame.text());
            sink.next(encoder.frame(session, frame));
        }
        return step.frames().size();
    }

    private void emitFailure(BridgeSession session, SessionTranslator translator, Consumer<String> contentObserver,
                             FluxSink<String> sink, Exception failure) {
        log.error("[{}] Streaming pipeline failed: {}", session.requestId(), describe(failure), failure);
        for (StreamFrame frame : translator.abort()) {
            contentObserver.accept(frame.text());
            sink.next(encoder.frame(session, frame));
        }
        sink.next(encoder.chunk(session, errorContent(failure), null));
    }

    private static String errorContent(Throwable failure) {
        return ERROR_CONTENT_PREFIX + describe(failure);
    }

    private static String describe(Throwable failure) {
        if (failure == null) {
            return "unknown failure";
        }
        String message = failure.getMessage();
        Throwable cause = failure.getCause();
        String description = message == null || message.isBlank() ? failure.getClass().getSimpleName() : message;
        if (cause != null && cause != failure && cause.getMessage() != null) {
            description = description + " (" + cause.getMessage() + ")";
        }
        return description;
    }
}
