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
 * Classifies why a tool call did not succeed.
 */
public enum ToolFailureKind {

    /**
     * No tool with the requested name exists in the agent's catalog.
     */
    UNKNOWN_TOOL,

    /**
     * One or more required parameters were absent from the call arguments.
     */
    MISSING_PARAMETER,

    /**
     * The tool threw or reported a failure while running.
     */
    EXECUTION_FAILED,

    /**
     * The tool did not finish within the configured time limit.
     */
    TIMEOUT
}
