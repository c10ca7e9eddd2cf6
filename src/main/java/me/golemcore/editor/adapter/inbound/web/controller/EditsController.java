package me.golemcore.editor.adapter.inbound.web.controller;

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

import lombok.RequiredArgsConstructor;
import me.golemcore.editor.adapter.inbound.web.dto.CreateDocumentRequest;
import me.golemcore.editor.adapter.inbound.web.dto.EditRequest;
import me.golemcore.editor.adapter.inbound.web.dto.EditRunResponse;
import me.golemcore.editor.domain.model.CircuitState;
import me.golemcore.editor.domain.model.DocumentState;
import me.golemcore.editor.domain.model.ToolExecutionStats;
import me.golemcore.editor.domain.service.EditRunService;
import me.golemcore.editor.domain.service.ToolRegistryService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.Map;

/**
 * Edit runs, stored documents and tool health.
 */
@RestController
@RequestMapping("/api/edits")
@RequiredArgsConstructor
public class EditsController {

    private final EditRunService editRunService;
    private final ToolRegistryService toolRegistry;

    @PostMapping
    public Mono<ResponseEntity<EditRunResponse>> runEdit(@RequestBody EditRequest request) {
        return Mono.fromCallable(() -> editRunService.runEdit(request.getDocumentId(), request.getInstruction()))
                .subscribeOn(Schedulers.boundedElastic())
                .map(result -> ResponseEntity.ok(EditRunResponse.from(result)));
    }

    @PostMapping("/documents")
    public Mono<ResponseEntity<DocumentState>> createDocument(@RequestBody CreateDocumentRequest request) {
        return Mono.fromCallable(() -> editRunService.createDocument(request.getTitle(), request.getLanguage(),
                request.getContent()))
                .subscribeOn(Schedulers.boundedElastic())
                .map(document -> ResponseEntity.status(HttpStatus.CREATED).body(document));
    }

    @GetMapping("/documents/{id}")
    public Mono<ResponseEntity<DocumentState>> getDocument(@PathVariable String id) {
        return Mono.fromCallable(() -> editRunService.getDocument(id))
                .subscribeOn(Schedulers.boundedElastic())
                .map(ResponseEntity::ok);
    }

    @GetMapping("/tools/stats")
    public Mono<ResponseEntity<ToolExecutionStats>> getToolStats() {
        return Mono.just(ResponseEntity.ok(toolRegistry.getStats()));
    }

    @GetMapping("/tools/circuits")
    public Mono<ResponseEntity<Map<String, CircuitState>>> getCircuits() {
        return Mono.just(ResponseEntity.ok(toolRegistry.getCircuitStates()));
    }

    @PostMapping("/tools/{name}/circuit/reset")
    public Mono<ResponseEntity<Void>> resetCircuit(@PathVariable String name) {
        if (toolRegistry.getTool(name) == null) {
            return Mono.just(ResponseEntity.notFound().build());
        }
        toolRegistry.resetCircuit(name);
        return Mono.just(ResponseEntity.noContent().build());
    }
}
