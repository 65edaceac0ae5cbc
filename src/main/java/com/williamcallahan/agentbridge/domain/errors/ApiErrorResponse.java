package com.williamcallahan.agentbridge.domain.errors;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.Objects;

/**
 * JSON error payload returned by every endpoint.
 *
 * @param error short error description
 * @param message optional detail for the client
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiErrorResponse(String error, String message) {

    public ApiErrorResponse {
        Objects.requireNonNull(error, "Error description is required");
    }

    public static ApiErrorResponse of(String error) {
        return new ApiErrorResponse(error, null);
    }

    public static ApiErrorResponse of(String error, String message) {
        return new ApiErrorResponse(error, message);
    }
}
