package me.golemcore.editor.domain.service;

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
import lombok.extern.slf4j.Slf4j;
import me.golemcore.editor.domain.exception.DocumentNotFoundException;
import me.golemcore.editor.domain.loop.EditOrchestrator;
import me.golemcore.editor.domain.model.DocumentState;
import me.golemcore.editor.domain.model.EditRunResult;
import me.golemcore.editor.port.outbound.DocumentStorePort;
import org.springframework.stereotype.Service;

/**
 * Application entry point for edit runs: loads the document, runs the
 * orchestrator and persists the final state when the run changed it.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EditRunService {

    private final EditOrchestrator orchestrator;
    private final DocumentStorePort documentStore;

    public EditRunResult runEdit(String documentId, String instruction) {
        if (instruction == null || instruction.isBlank()) {
            throw new IllegalArgumentException("Instruction must not be blank");
        }
        DocumentState document = getDocument(documentId);
        EditRunResult result = orchestrator.run(instruction, document);
        if (result.hasChanges()) {
            // applied edits survive a blocked run
            documentStore.save(result.getFinalDocument());
            log.info("[EditLoop] Saved document {} after run {} ({})", documentId, result.getRunId(),
                    result.getOutcome());
        }
        return result;
    }

    public DocumentState createDocument(String title, String language, String content) {
        DocumentState saved = documentStore.save(new DocumentState(null, title, language, content));
        log.info("[Store] Created document {} ('{}')", saved.id(), saved.displayName());
        return saved;
    }

    public DocumentState getDocument(String documentId) {
        return documentStore.load(documentId).orElseThrow(() -> new DocumentNotFoundException(documentId));
    }
}
