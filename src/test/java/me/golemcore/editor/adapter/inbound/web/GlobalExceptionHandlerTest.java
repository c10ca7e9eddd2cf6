package me.golemcore.editor.adapter.inbound.web;

import me.golemcore.editor.adapter.inbound.web.dto.ApiErrorResponse;
import me.golemcore.editor.domain.exception.DocumentNotFoundException;
import me.golemcore.editor.domain.exception.DocumentStoreException;
import org.junit.jupiter.api.Test;
import org.springframework.http.ResponseEntity;

import java.io.IOException;

import static org.junit.jupiter.api.Assertions.assertEquals;

class GlobalExceptionHandlerTest {

    private final GlobalExceptionHandler handler = new GlobalExceptionHandler();

    @Test
    void shouldMapMissingDocumentToNotFound() {
        ResponseEntity<ApiErrorResponse> response = handler.handleNotFound(new DocumentNotFoundException("doc-9"))
                .block();

        assertEquals(404, response.getStatusCode().value());
        assertEquals("Document not found: doc-9", response.getBody().getMessage());
    }

    @Test
    void shouldMapIllegalArgumentToBadRequest() {
        ResponseEntity<ApiErrorResponse> response = handler
                .handleIllegalArgument(new IllegalArgumentException("instruction is required")).block();

        assertEquals(400, response.getBody().getStatus());
        assertEquals("instruction is required", response.getBody().getMessage());
    }

    @Test
    void shouldExposeStoreFailureMessage() {
        ResponseEntity<ApiErrorResponse> response = handler.handleStore(
                new DocumentStoreException("Failed to write document: doc-1", new IOException("disk full"))).block();

        assertEquals(500, response.getStatusCode().value());
        assertEquals("Failed to write document: doc-1", response.getBody().getMessage());
    }

    @Test
    void shouldHideDetailsOfUnexpectedErrors() {
        ResponseEntity<ApiErrorResponse> response = handler.handleGeneric(new IllegalStateException("secret"))
                .block();

        assertEquals(500, response.getBody().getStatus());
        assertEquals("Internal server error", response.getBody().getMessage());
    }
}
