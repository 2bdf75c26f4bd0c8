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

package me.golemcore.crew.domain.tool;

import me.golemcore.crew.domain.component.ToolComponent;
import me.golemcore.crew.domain.model.ToolDefinition;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Named set of tools owned by one agent. Built once and never modified; to give
 * several agents tools from a shared template, derive a new catalog per agent
 * with {@link #restrictTo(Collection)}.
 */
public final class ToolCatalog {

    private static final ToolCatalog EMPTY = new ToolCatalog(Collections.emptyMap());

    private final Map<String, ToolComponent> tools;

    private ToolCatalog(Map<String, ToolComponent> tools) {
        this.tools = tools;
    }

    public static ToolCatalog empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static ToolCatalog of(Collection<? extends ToolComponent> tools) {
        Builder builder = builder();
        tools.forEach(builder::register);
        return builder.build();
    }

    public Optional<ToolComponent> find(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(tools.get(name));
    }

    public boolean contains(String name) {
        return name != null && tools.containsKey(name);
    }

    public boolean isEmpty() {
        return tools.isEmpty();
    }

    public int size() {
        return tools.size();
    }

    public Set<String> names() {
        return tools.keySet();
    }

    /**
     * Definitions in registration order.
     */
    public List<ToolDefinition> definitions() {
        List<ToolDefinition> definitions = new ArrayList<>(tools.size());
        for (ToolComponent tool : tools.values()) {
            definitions.add(tool.getDefinition());
        }
        return definitions;
    }

    /**
     * Derives a catalog holding only the named tools. Unknown names are ignored.
     */
    public ToolCatalog restrictTo(Collection<String> names) {
        Builder builder = builder();
        for (Map.Entry<String, ToolComponent> entry : tools.entrySet()) {
            if (names.contains(entry.getKey())) {
                builder.register(entry.getValue());
            }
        }
        return builder.build();
    }

    public static final class Builder {

        private final Map<String, ToolComponent> tools = new LinkedHashMap<>();

        private Builder() {
        }

        /**
         * Adds a tool.
         *
         * @throws IllegalArgumentException
         *             if a tool with the same name is already registered
         */
        public Builder register(ToolComponent tool) {
            String name = tool.getToolName();
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("Tool name must not be blank");
            }
            if (tools.containsKey(name)) {
                throw new IllegalArgumentException("Tool already registered: " + name);
            }
            tools.put(name, tool);
            return this;
        }

        public ToolCatalog build() {
            if (tools.isEmpty()) {
                return EMPTY;
            }
            return new ToolCatalog(Collections.unmodifiableMap(new LinkedHashMap<>(tools)));
        }
    }
}
