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

/**
 * The unit of work a team was formed for.
 */
@Data
@Builder
public class TaskDefinition {

    private String id;
    private String description;
    private String type; // feature, refactor, security_fix, database_migration, api_change, ...
    private Integer estimatedComplexity; // 1-10

    /**
     * Explicit greenlight requirement. When null the gate is decided from the task
     * type and complexity.
     */
    private Boolean requiresGreenLight;
}
