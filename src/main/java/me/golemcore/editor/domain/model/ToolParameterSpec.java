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

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Schema entry for one tool parameter.
 */
@Value
@Builder
public class ToolParameterSpec {

    public enum Type {
        STRING, INTEGER, NUMBER, BOOLEAN
    }

    @Builder.Default
    Type type = Type.STRING;

    boolean required;

    String description;

    @Builder.Default
    List<String> allowedValues = List.of();

    public static ToolParameterSpec requiredString(String description) {
        return ToolParameterSpec.builder().required(true).description(description).build();
    }

    public static ToolParameterSpec optionalString(String description) {
        return ToolParameterSpec.builder().required(false).description(description).build();
    }
}
