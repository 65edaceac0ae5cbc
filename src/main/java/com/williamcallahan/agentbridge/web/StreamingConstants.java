package com.williamcallahan.agentbridge.web;

import java.nio.charset.StandardCharsets;
import org.springframework.http.MediaType;

/**
 * Headers and media type for event-stream responses.
 */
public final class StreamingConstants {

    public static final MediaType EVENT_STREAM_UTF8 = new MediaType(MediaType.TEXT_EVENT_STREAM, StandardCharsets.UTF_8);

    public static final String CACHE_CONTROL_NO_CACHE = "no-cache";

    /** Nginx: disable proxy buffering. */
    public static final String PROXY_BUFFERING_HEADER = "X-Accel-Buffering";
    public static final String PROXY_BUFFERING_DISABLED = "no";

    private StreamingConstants() {
        // Non-instantiable utility class
    }
}
