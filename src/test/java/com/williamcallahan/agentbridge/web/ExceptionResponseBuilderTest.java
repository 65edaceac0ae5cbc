package com.williamcallahan.agentbridge.web;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

import com.williamcallahan.agentbridge.domain.errors.ApiErrorResponse;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

class ExceptionResponseBuilderTest {

    private final ExceptionResponseBuilder builder = new ExceptionResponseBuilder();

    @Test
    void errorWithoutExceptionHasNoMessage() {
        ResponseEntity<ApiErrorResponse> response = builder.buildErrorResponse(HttpStatus.BAD_REQUEST, "bad");

        assertEquals(HttpStatus.BAD_REQUEST, response.getStatusCode());
        assertEquals("bad", response.getBody().error());
        assertNull(response.getBody().message());
    }

    @Test
    void exceptionWithoutMessageIsDescribedByItsType() {
        ResponseEntity<ApiErrorResponse> response =
                builder.buildErrorResponse(HttpStatus.INTERNAL_SERVER_ERROR, "failed", new IllegalStateException());

        assertEquals("IllegalStateException", response.getBody().message());
    }
}
