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

/**
 * Narrow context handed to every tool execution: who is calling, in which
 * project and conversation, and where progress lines go.
 */
public record ToolExecutionContext(String agentId, String projectId, String conversationId,
        ProgressReporter progress) {

    public ToolExecutionContext {
        if (progress == null) {
            progress = ProgressReporter.NONE;
        }
    }

    public static ToolExecutionContext of(String agentId, String projectId, String conversationId) {
        return new ToolExecutionContext(agentId, projectId, conversationId, ProgressReporter.NONE);
    }

    public void reportProgress(String status) {
        progress.report(status);
    }
}
