package me.golemcore.editor.adapter.outbound.storage;

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

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.editor.domain.exception.DocumentStoreException;
import me.golemcore.editor.domain.model.DocumentState;
import me.golemcore.editor.infrastructure.config.EditorProperties;
import me.golemcore.editor.port.outbound.DocumentStorePort;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.Optional;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Local filesystem implementation of {@link DocumentStorePort}.
 *
 * <p>
 * Each document is one JSON file {@code documents/<id>.json} under the base
 * path configured via {@code editor.storage.base-path}. Writes go to a
 * temporary file first and are moved into place atomically where the file
 * system supports it.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LocalDocumentStoreAdapter implements DocumentStorePort {

    private static final String DOCUMENTS_DIR = "documents";
    private static final Pattern SAFE_ID = Pattern.compile("[A-Za-z0-9_-]{1,128}");

    private final EditorProperties properties;
    private final ObjectMapper objectMapper;

    private Path documentsPath;

    @PostConstruct
    public void init() {
        String basePathStr = properties.getStorage().getBasePath();
        Path basePath = Paths.get(basePathStr.replace("${user.home}", System.getProperty("user.home")))
                .toAbsolutePath().normalize();
        this.documentsPath = basePath.resolve(DOCUMENTS_DIR);
        try {
            Files.createDirectories(documentsPath);
            log.info("[Store] Document store initialized at: {}", documentsPath);
        } catch (IOException e) {
            throw new DocumentStoreException("Failed to create document directory: " + documentsPath, e);
        }
    }

    @Override
    public Optional<DocumentState> load(String documentId) {
        Path file = resolve(documentId);
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(file.toFile(), DocumentState.class));
        } catch (IOException e) {
            throw new DocumentStoreException("Failed to read document: " + documentId, e);
        }
    }

    @Override
    public DocumentState save(DocumentState document) {
        DocumentState toSave = document.id() != null && !document.id().isBlank()
                ? document
                : new DocumentState(UUID.randomUUID().toString(), document.title(), document.language(),
                        document.content());
        Path file = resolve(toSave.id());
        Path temp = file.resolveSibling(file.getFileName() + ".tmp");
        try {
            objectMapper.writeValue(temp.toFile(), toSave);
            try {
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                log.debug("[Store] Atomic move not supported, falling back to plain move: {}", e.getMessage());
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
            }
            log.debug("[Store] Saved document {} ({} chars)", toSave.id(), toSave.content().length());
            return toSave;
        } catch (IOException e) {
            throw new DocumentStoreException("Failed to write document: " + toSave.id(), e);
        }
    }

    private Path resolve(String documentId) {
        if (documentId == null || !SAFE_ID.matcher(documentId).matches()) {
            throw new DocumentStoreException("Invalid document id: " + documentId);
        }
        return documentsPath.resolve(documentId + ".json");
    }
}
