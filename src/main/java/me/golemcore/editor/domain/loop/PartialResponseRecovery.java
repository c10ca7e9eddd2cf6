package me.golemcore.editor.domain.loop;

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

import me.golemcore.editor.domain.model.ToolInvocation;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Salvages a full-document rewrite that was cut off when the oracle stream
 * hit its deadline. Only long, code-shaped content is accepted; anything
 * shorter is more likely a truncated fragment than a finished document.
 */
final class PartialResponseRecovery {

    static final int MIN_CONTENT_LENGTH = 500;

    private static final String OVERWRITE_OPEN = "<" + ToolInvocation.OVERWRITE;
    private static final Pattern CODE_STRUCTURE = Pattern.compile(
            "\\b(?:function|class|def|import|export|const|let|var|public|private|return)\\b|[{};]");

    private PartialResponseRecovery() {
    }

    static boolean isTruncatedOverwrite(String text) {
        String lower = text.toLowerCase(Locale.ROOT);
        return lower.contains(OVERWRITE_OPEN) && lower.contains("<content>") && !lower.contains("</content>");
    }

    /**
     * Closes the open {@code <content>} and tool tags when the partial
     * content is long enough and looks like code.
     */
    static Optional<String> completeOverwrite(String text) {
        if (!isTruncatedOverwrite(text)) {
            return Optional.empty();
        }
        int contentStart = text.toLowerCase(Locale.ROOT).indexOf("<content>") + "<content>".length();
        String content = text.substring(contentStart).strip();
        if (content.length() < MIN_CONTENT_LENGTH || !CODE_STRUCTURE.matcher(content).find()) {
            return Optional.empty();
        }
        return Optional.of(text + "\n</content>\n</" + ToolInvocation.OVERWRITE + ">");
    }
}
