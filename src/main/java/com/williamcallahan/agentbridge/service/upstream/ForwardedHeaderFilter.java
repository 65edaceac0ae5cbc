package com.williamcallahan.agentbridge.service.upstream;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;

/**
 * Decides which caller headers may travel upstream with the trigger call.
 *
 * <p>Only OpenAI protocol headers and standard HTTP metadata pass. Everything else is dropped
 * and the dropped names are logged at DEBUG.</p>
 */
@Component
public class ForwardedHeaderFilter {
    private static final Logger log = LoggerFactory.getLogger(ForwardedHeaderFilter.class);

    private static final Set<String> ALLOWED_HEADER_NAMES = Set.of(
            // OpenAI protocol
            "authorization",
            "content-type",
            "accept",
            "openai-organization",
            "openai-project",
            "idempotency-key",
            "openai-beta",
            "x-request-id",
            // HTTP metadata
            "user-agent",
            "accept-encoding",
            "accept-language",
            "content-length");

    private static final List<String> ALLOWED_HEADER_PREFIXES = List.of("openai-", "x-openai-");

    /**
     * Checks a single header name against the allow-list, ignoring case.
     *
     * @param headerName header name as received
     * @return whether the header may be forwarded
     */
    public boolean isAllowed(String headerName) {
        if (headerName == null) {
            return false;
        }
        String normalized = headerName.toLowerCase(Locale.ROOT);
        if (ALLOWED_HEADER_NAMES.contains(normalized)) {
            return true;
        }
        for (String prefix : ALLOWED_HEADER_PREFIXES) {
            if (normalized.startsWith(prefix)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Returns a copy of the allowed headers with all of their values.
     *
     * @param callerHeaders headers of the inbound request
     * @return new header set holding only allowed entries
     */
    public HttpHeaders filter(HttpHeaders callerHeaders) {
        HttpHeaders forwarded = new HttpHeaders();
        if (callerHeaders == null || callerHeaders.isEmpty()) {
            return forwarded;
        }
        List<String> droppedHeaders = new ArrayList<>();
        callerHeaders.forEach((name, values) -> {
            if (isAllowed(name)) {
                forwarded.addAll(name, values);
            } else {
                droppedHeaders.add(name);
            }
        });
        if (!droppedHeaders.isEmpty()) {
            log.debug("Dropped non-allow-listed request headers: {}", String.join(", ", droppedHeaders));
        }
        return forwarded;
    }
}
