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

package me.golemcore.crew.domain.model;

import lombok.Builder;
import lombok.Data;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Describes a tool the model may call: its unique name, a human description and
 * the typed parameter list. {@link #toInputSchema()} renders the parameters as
 * a JSON Schema object for provider-native function calling.
 */
@Data
@Builder
public class ToolDefinition {

    private String name;
    private String description;

    @Builder.Default
    private List<ToolParameter> parameters = new ArrayList<>();

    /**
     * Creates a tool definition without parameters.
     */
    public static ToolDefinition simple(String name, String description) {
        return ToolDefinition.builder()
                .name(name)
                .description(description)
                .build();
    }

    public List<String> requiredParameterNames() {
        return parameters.stream()
                .filter(ToolParameter::isRequired)
                .map(ToolParameter::getName)
                .toList();
    }

    public Map<String, Object> toInputSchema() {
        Map<String, Object> properties = new LinkedHashMap<>();
        for (ToolParameter parameter : parameters) {
            Map<String, Object> property = new LinkedHashMap<>();
            property.put("type", parameter.getType());
            if (parameter.getDescription() != null) {
                property.put("description", parameter.getDescription());
            }
            if (parameter.getEnumValues() != null && !parameter.getEnumValues().isEmpty()) {
                property.put("enum", parameter.getEnumValues());
            }
            if ("array".equals(parameter.getType())) {
                property.put("items", Map.of("type",
                        parameter.getItemsType() != null ? parameter.getItemsType() : "string"));
            }
            properties.put(parameter.getName(), property);
        }

        Map<String, Object> schema = new LinkedHashMap<>();
        schema.put("type", "object");
        schema.put("properties", properties);
        schema.put("required", requiredParameterNames());
        return schema;
    }
}
