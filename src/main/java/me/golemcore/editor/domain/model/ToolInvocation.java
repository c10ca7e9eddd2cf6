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

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A parsed tool call. One record per tool with typed parameters; the wire
 * names and the parameter map exist only for the executor boundary.
 */
public interface ToolInvocation {

    String READ = "read_file";
    String OVERWRITE = "write_to_file";
    String PATCH = "replace_in_file";
    String SEARCH = "search_files";

    List<String> TOOL_NAMES = List.of(READ, OVERWRITE, PATCH, SEARCH);

    String toolName();

    String path();

    Map<String, Object> parameters();

    record Read(String path) implements ToolInvocation {
        @Override
        public String toolName() {
            return READ;
        }

        @Override
        public Map<String, Object> parameters() {
            return withPath(path, new LinkedHashMap<>());
        }
    }

    record Overwrite(String path, String content) implements ToolInvocation {
        @Override
        public String toolName() {
            return OVERWRITE;
        }

        @Override
        public Map<String, Object> parameters() {
            Map<String, Object> params = withPath(path, new LinkedHashMap<>());
            params.put("content", content);
            return params;
        }
    }

    record Patch(String path, String content, List<PatchBlock> blocks) implements ToolInvocation {
        public Patch {
            blocks = blocks != null ? List.copyOf(blocks) : List.of();
        }

        @Override
        public String toolName() {
            return PATCH;
        }

        @Override
        public Map<String, Object> parameters() {
            Map<String, Object> params = withPath(path, new LinkedHashMap<>());
            params.put("content", content);
            return params;
        }
    }

    record Search(String path, String pattern) implements ToolInvocation {
        @Override
        public String toolName() {
            return SEARCH;
        }

        @Override
        public Map<String, Object> parameters() {
            Map<String, Object> params = withPath(path, new LinkedHashMap<>());
            params.put("pattern", pattern);
            return params;
        }
    }

    private static Map<String, Object> withPath(String path, Map<String, Object> params) {
        if (path != null && !path.isBlank()) {
            params.put("path", path);
        }
        return params;
    }
}
