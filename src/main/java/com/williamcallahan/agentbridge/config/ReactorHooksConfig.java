package com.williamcallahan.agentbridge.config;

import java.io.InterruptedIOException;
import java.nio.channels.ClosedChannelException;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.event.ContextRefreshedEvent;
import org.springframework.context.event.EventListener;
import reactor.core.publisher.Hooks;
import reactor.netty.channel.AbortedException;

/**
 * Routes errors Reactor drops after a subscriber is gone into the application log.
 *
 * <p>Closing a backend socket while frames are in flight, or cancelling a blocked consumer,
 * produces errors that arrive after cancellation. Those are logged at DEBUG; anything else at WARN.</p>
 */
@Configuration
public class ReactorHooksConfig {

    private static final Logger log = LoggerFactory.getLogger(ReactorHooksConfig.class);

    /**
     * Installs the handler on every refresh so devtools restarts keep it.
     */
    @EventListener(ContextRefreshedEvent.class)
    public void configureDroppedErrorHandler() {
        Hooks.onErrorDropped(error -> {
            if (isExpectedTeardownError(error)) {
                log.debug("Dropped expected teardown error (exceptionType={})", error.getClass().getSimpleName());
            } else {
                log.warn("Dropped unexpected error", error);
            }
        });
        log.info("Reactor dropped-error hook configured");
    }

    static boolean isExpectedTeardownError(Throwable error) {
        for (Throwable current = error; current != null; current = current.getCause()) {
            if (current instanceof InterruptedException
                    || current instanceof InterruptedIOException
                    || current instanceof ClosedChannelException
                    || current instanceof AbortedException) {
                return true;
            }
            if (current.getCause() == current) {
                break;
            }
        }
        String message = error.getMessage();
        return message != null && message.toLowerCase(Locale.ROOT).contains("interrupt");
    }
}
