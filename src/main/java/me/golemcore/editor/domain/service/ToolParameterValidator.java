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

import me.golemcore.editor.domain.model.ToolDefinition;
import me.golemcore.editor.domain.model.ToolParameterSpec;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Checks call parameters against a tool's schema: required fields,
 * enumerated values and primitive types. Unknown parameters are ignored.
 */
public class ToolParameterValidator {

    public List<String> validate(ToolDefinition definition, Map<String, Object> parameters) {
        List<String> errors = new ArrayList<>();
        if (definition.getParameters() == null) {
            return errors;
        }
        Map<String, Object> params = parameters != null ? parameters : Map.of();

        for (Map.Entry<String, ToolParameterSpec> entry : definition.getParameters().entrySet()) {
            String name = entry.getKey();
            ToolParameterSpec spec = entry.getValue();
            Object value = params.get(name);

            if (value == null) {
                if (spec.isRequired()) {
                    errors.add("Missing required parameter: " + name);
                }
                continue;
            }
            if (!matchesType(spec.getType(), value)) {
                errors.add("Parameter '" + name + "' must be of type " + spec.getType().name().toLowerCase(Locale.ROOT)
                        + " but was " + value.getClass().getSimpleName());
                continue;
            }
            List<String> allowed = spec.getAllowedValues();
            if (allowed != null && !allowed.isEmpty() && !allowed.contains(String.valueOf(value))) {
                errors.add("Parameter '" + name + "' must be one of " + allowed + " but was '" + value + "'");
            }
        }
        return errors;
    }

    private static boolean matchesType(ToolParameterSpec.Type type, Object value) {
        return switch (type) {
        case STRING -> value instanceof CharSequence;
        case INTEGER -> value instanceof Integer || value instanceof Long || value instanceof Short;
        case NUMBER -> value instanceof Number;
        case BOOLEAN -> value instanceof Boolean;
        };
    }
}
