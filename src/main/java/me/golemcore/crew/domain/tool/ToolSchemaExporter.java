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

import me.golemcore.crew.domain.model.ToolDefinition;
import me.golemcore.crew.domain.model.ToolParameter;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Renders a catalog in provider wire formats and as the plain-text instructions
 * block that teaches a model the textual invocation syntax.
 */
public final class ToolSchemaExporter {

    private ToolSchemaExporter() {
    }

    /**
     * Anthropic format: {@code {name, description, input_schema}}.
     */
    public static List<Map<String, Object>> toAnthropicFormat(ToolCatalog catalog) {
        List<Map<String, Object>> result = new ArrayList<>();
        for (ToolDefinition definition : catalog.definitions()) {
            Map<String, Object> tool = new LinkedHashMap<>();
            tool.put("name", definition.getName());
            tool.put("description", definition.getDescription());
            tool.put("input_schema", definition.toInputSchema());
            result.add(tool);
        }
        return result;
    }

    /**
     * OpenAI format: {@code {type: "function", function: {name, description,
     * parameters}}}.
     */
    public static List<Map<String, Object>> toOpenAiFormat(ToolCatalog catalog) {
        List<Map<String, Object>> result = new ArrayList<>();
        for (ToolDefinition definition : catalog.definitions()) {
            Map<String, Object> function = new LinkedHashMap<>();
            function.put("name", definition.getName());
            function.put("description", definition.getDescription());
            function.put("parameters", definition.toInputSchema());

            Map<String, Object> tool = new LinkedHashMap<>();
            tool.put("type", "function");
            tool.put("function", function);
            result.add(tool);
        }
        return result;
    }

    public static String instructionsPrompt(ToolCatalog catalog) {
        if (catalog.isEmpty()) {
            return "";
        }
        StringBuilder sb = new StringBuilder();
        sb.append("You have access to the following tools:\n\n");
        for (ToolDefinition definition : catalog.definitions()) {
            sb.append("Tool: ").append(definition.getName()).append('\n');
            sb.append("Description: ").append(definition.getDescription()).append('\n');
            if (definition.getParameters().isEmpty()) {
                sb.append("Parameters: none\n");
            } else {
                sb.append("Parameters:\n");
                for (ToolParameter parameter : definition.getParameters()) {
                    sb.append("  - ").append(parameter.getName())
                            .append(" (").append(parameter.getType())
                            .append(parameter.isRequired() ? ", required" : ", optional")
                            .append(')');
                    if (parameter.getDescription() != null) {
                        sb.append(": ").append(parameter.getDescription());
                    }
                    sb.append('\n');
                }
            }
            sb.append('\n');
        }
        sb.append("To call a tool, write a block in exactly this form:\n");
        sb.append(ToolCallParser.OPEN_TAG).append('\n');
        sb.append("{\"tool\": \"tool_name\", \"arguments\": {\"param\": \"value\"}}\n");
        sb.append(ToolCallParser.CLOSE_TAG).append('\n');
        sb.append("You may call several tools in one response. Tool results are returned to you")
                .append(" before you give your final answer.");
        return sb.toString();
    }
}
