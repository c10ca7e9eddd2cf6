package me.golemcore.editor.domain.model;

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

import java.util.Locale;
import java.util.Set;

/**
 * Immutable snapshot of the document being edited. A new instance replaces
 * the current one after every successful mutation.
 */
public record DocumentState(String id, String title, String language, String content) {

    private static final Set<String> CODE_LANGUAGES = Set.of(
            "java", "kotlin", "scala", "groovy", "js", "javascript", "jsx", "ts", "typescript", "tsx",
            "json", "python", "py", "c", "cpp", "h", "hpp", "cs", "csharp", "go", "rust", "rs",
            "swift", "php", "ruby", "rb", "css", "scss");

    public DocumentState {
        content = content != null ? content : "";
    }

    public DocumentState withContent(String newContent) {
        return new DocumentState(id, title, language, newContent);
    }

    public int lineCount() {
        return content.split("\n", -1).length;
    }

    public boolean isCode() {
        return language != null && CODE_LANGUAGES.contains(language.toLowerCase(Locale.ROOT));
    }

    public String displayName() {
        return title != null && !title.isBlank() ? title : id;
    }
}
