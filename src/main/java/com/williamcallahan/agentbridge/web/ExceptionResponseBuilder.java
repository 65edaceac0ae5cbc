package com.williamcallahan.agentbridge.web;

import com.williamcallahan.agentbridge.domain.errors.ApiErrorResponse;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;

/**
 * Builds the JSON error responses shared by all controllers.
 */
@Component
public class ExceptionResponseBuilder {

    /**
     * @param status HTTP status to return
     * @param error short error description
     * @return error response without detail
     */
    public ResponseEntity<ApiErrorResponse> buildErrorResponse(HttpStatus status, String error) {
        return ResponseEntity.status(status).body(ApiErrorResponse.of(error));
    }

    /**
     * @param status HTTP status to return
     * @param error short error description
     * @param exception failure whose message becomes the detail
     * @return error response with detail
     */
    public ResponseEntity<ApiErrorResponse> buildErrorResponse(HttpStatus status, String error, Exception exception) {
        return ResponseEntity.status(status).body(ApiErrorResponse.of(error, describeException(exception)));
    }

    /**
     * Describes an exception for clients, falling back to its type when it has no message.
     */
    public String describeException(Exception exception) {
        if (exception == null) {
            return null;
        }
        String message = exception.getMessage();
        return message == null || message.isBlank() ? exception.getClass().getSimpleName() : message;
    }
}
