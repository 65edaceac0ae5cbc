package com.williamcallahan.agentbridge.web;

import com.williamcallahan.agentbridge.domain.errors.ApiErrorResponse;
import com.williamcallahan.agentbridge.service.AgentBridgeException;
import com.williamcallahan.agentbridge.service.auth.AuthenticationFailedException;
import com.williamcallahan.agentbridge.service.auth.CredentialUnavailableException;
import com.williamcallahan.agentbridge.service.conversation.EmptyPromptException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;

/**
 * Maps service failures to JSON error responses for the controllers that extend it.
 */
public abstract class BaseController {
    private static final Logger log = LoggerFactory.getLogger(BaseController.class);

    protected final ExceptionResponseBuilder exceptionBuilder;

    protected BaseController(ExceptionResponseBuilder exceptionBuilder) {
        this.exceptionBuilder = exceptionBuilder;
    }

    @ExceptionHandler(AuthenticationFailedException.class)
    public ResponseEntity<ApiErrorResponse> handleAuthenticationFailure(AuthenticationFailedException e) {
        log.warn("Rejected request: {}", e.getMessage());
        return exceptionBuilder.buildErrorResponse(HttpStatus.UNAUTHORIZED, e.getMessage());
    }

    @ExceptionHandler(CredentialUnavailableException.class)
    public ResponseEntity<ApiErrorResponse> handleCredentialUnavailable(CredentialUnavailableException e) {
        return exceptionBuilder.buildErrorResponse(HttpStatus.SERVICE_UNAVAILABLE, e.getMessage());
    }

    @ExceptionHandler(EmptyPromptException.class)
    public ResponseEntity<ApiErrorResponse> handleEmptyPrompt(EmptyPromptException e) {
        return exceptionBuilder.buildErrorResponse(HttpStatus.BAD_REQUEST, e.getMessage());
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiErrorResponse> handleUnreadableBody(HttpMessageNotReadableException e) {
        return exceptionBuilder.buildErrorResponse(HttpStatus.BAD_REQUEST, "Invalid JSON request body");
    }

    /**
     * Handles anything else the pipeline raises with a 500.
     */
    @ExceptionHandler(AgentBridgeException.class)
    public ResponseEntity<ApiErrorResponse> handleServiceException(AgentBridgeException e) {
        log.error("Request failed: {}", exceptionBuilder.describeException(e), e);
        return exceptionBuilder.buildErrorResponse(HttpStatus.INTERNAL_SERVER_ERROR, "Failed to process request", e);
    }
}
