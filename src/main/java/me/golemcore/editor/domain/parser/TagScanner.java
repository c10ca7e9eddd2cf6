package me.golemcore.editor.domain.parser;

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

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Single-pass scanner for simple {@code <name>} and {@code </name>} tags.
 * Attributes are not supported. Spaces or tabs inside the brackets are
 * accepted only for names from the tool vocabulary, so comparisons such as
 * {@code a < b > c} in code are not mistaken for tags.
 */
final class TagScanner {

    private static final Set<String> PARAMETER_NAMES = Set.of("path", "content", "pattern");

    record Tag(String name, int start, int end, boolean closing, boolean normalized) {
    }

    private TagScanner() {
    }

    static List<Tag> scan(String text) {
        List<Tag> tags = new ArrayList<>();
        int length = text.length();
        int i = 0;
        while (i < length) {
            if (text.charAt(i) != '<') {
                i++;
                continue;
            }
            Tag tag = readTag(text, i);
            if (tag != null) {
                tags.add(tag);
                i = tag.end();
            } else {
                i++;
            }
        }
        return tags;
    }

    private static Tag readTag(String text, int start) {
        int length = text.length();
        int pos = start + 1;
        boolean normalized = false;

        int afterSpaces = skipInlineSpaces(text, pos);
        normalized |= afterSpaces != pos;
        pos = afterSpaces;

        boolean closing = false;
        if (pos < length && text.charAt(pos) == '/') {
            closing = true;
            afterSpaces = skipInlineSpaces(text, pos + 1);
            normalized |= afterSpaces != pos + 1;
            pos = afterSpaces;
        }

        int nameStart = pos;
        if (pos >= length || !isNameStart(text.charAt(pos))) {
            return null;
        }
        while (pos < length && isNamePart(text.charAt(pos))) {
            pos++;
        }
        String name = text.substring(nameStart, pos);

        afterSpaces = skipInlineSpaces(text, pos);
        normalized |= afterSpaces != pos;
        pos = afterSpaces;

        if (pos >= length || text.charAt(pos) != '>') {
            return null;
        }
        if (normalized && !isVocabulary(name)) {
            return null;
        }
        return new Tag(name, start, pos + 1, closing, normalized);
    }

    private static boolean isVocabulary(String name) {
        return ToolInvocationParser.resolveToolName(name) != null
                || PARAMETER_NAMES.contains(name.toLowerCase(Locale.ROOT));
    }

    private static int skipInlineSpaces(String text, int pos) {
        int cursor = pos;
        while (cursor < text.length() && (text.charAt(cursor) == ' ' || text.charAt(cursor) == '\t')) {
            cursor++;
        }
        return cursor;
    }

    private static boolean isNameStart(char c) {
        return Character.isLetter(c) || c == '_';
    }

    private static boolean isNamePart(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '-';
    }
}
