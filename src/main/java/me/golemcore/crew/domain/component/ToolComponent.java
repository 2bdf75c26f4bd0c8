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

package me.golemcore.crew.domain.component;

import me.golemcore.crew.domain.model.ToolDefinition;
import me.golemcore.crew.domain.model.ToolExecutionContext;
import me.golemcore.crew.domain.model.ToolResult;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * An executable capability an agent can invoke mid-conversation. Every bean of
 * this type lands in the shared tool template from which per-agent catalogs are
 * derived.
 */
public interface ToolComponent {

    /**
     * Returns the tool definition: name, description and typed parameters.
     */
    ToolDefinition getDefinition();

    /**
     * Executes the tool. Required parameters have already been checked by the
     * caller.
     *
     * @param parameters
     *            raw arguments as parsed from the model output
     * @param context
     *            calling agent, project, conversation and progress callback
     * @return a future containing the tool execution result
     */
    CompletableFuture<ToolResult> execute(Map<String, Object> parameters, ToolExecutionContext context);

    default String getToolName() {
        return getDefinition().getName();
    }
}
