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
import java.util.List;

/**
 * An agent known to the directory: identity, role description and model
 * configuration. An empty tool list means every shared tool is available.
 */
@Data
@Builder
public class AgentProfile {

    private String id;
    private String name;
    private String role;
    private String description;
    private String model;

    @Builder.Default
    private List<String> tools = new ArrayList<>();

    public String displayName() {
        return name != null && !name.isBlank() ? name : id;
    }
}
