package me.golemcore.editor.domain.component;

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

/**
 * Base interface for pluggable editor components. Each component type
 * extends it with its own capabilities under a shared lifecycle contract.
 */
public interface Component {

    /**
     * Returns the type identifier of this component (e.g. "tool").
     */
    String getComponentType();

    /**
     * Whether the component is enabled and available for use.
     */
    default boolean isEnabled() {
        return true;
    }
}
