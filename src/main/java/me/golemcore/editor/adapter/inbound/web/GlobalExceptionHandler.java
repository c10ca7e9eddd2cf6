package me.golemcore.editor.adapter.inbound.web;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.extern.slf4j.Slf4j;
import me.golemcore.editor.adapter.inbound.web.dto.ApiErrorResponse;
import me.golemcore.editor.domain.exception.DocumentNotFoundException;
import me.golemcore.editor.domain.exception.DocumentStoreException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import reactor.core.publisher.Mono;

/**
 * Maps failures of the edits API to JSON error bodies.
 */
@ControllerAdvice(basePackages = "me.golemcore.editor.adapter.inbound.web.controller")
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(DocumentNotFoundException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleNotFound(DocumentNotFoundException ex) {
        log.warn("[API] Not found: {}", ex.getMessage());
        return Mono.just(error(HttpStatus.NOT_FOUND, ex.getMessage()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleIllegalArgument(IllegalArgumentException ex) {
        log.warn("[API] Bad request: {}", ex.getMessage());
        return Mono.just(error(HttpStatus.BAD_REQUEST, ex.getMessage()));
    }

    @ExceptionHandler(DocumentStoreException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleStore(DocumentStoreException ex) {
        log.error("[API] Document store failure", ex);
        return Mono.just(error(HttpStatus.INTERNAL_SERVER_ERROR, ex.getMessage()));
    }

    @ExceptionHandler(Exception.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleGeneric(Exception ex) {
        log.error("[API] Internal server error", ex);
        return Mono.just(error(HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error"));
    }

    private static ResponseEntity<ApiErrorResponse> error(HttpStatus status, String message) {
        return ResponseEntity.status(status).body(ApiErrorResponse.builder()
                .status(status.value())
                .message(message)
                .build());
    }
}
