package com.williamcallahan.agentbridge.domain.status;

/**
 * Liveness payload for the root endpoint.
 */
public record ServiceStatus(String status, String service, String version) {

    private static final String STATUS_OK = "ok";

    public static ServiceStatus ok(String service, String version) {
        return new ServiceStatus(STATUS_OK, service, version);
    }
}
