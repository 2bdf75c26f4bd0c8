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

package me.golemcore.crew.domain.toolloop;

import lombok.RequiredArgsConstructor;
import me.golemcore.crew.domain.model.AgentProfile;
import me.golemcore.crew.domain.tool.ToolCallExecutor;
import me.golemcore.crew.domain.tool.ToolCallParser;
import me.golemcore.crew.domain.tool.ToolCatalog;
import me.golemcore.crew.domain.tool.ToolCatalogFactory;
import me.golemcore.crew.infrastructure.config.CrewProperties;
import me.golemcore.crew.port.outbound.LlmPort;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Hands out one tool-orchestrating provider per agent, each bound to the
 * agent's own catalog.
 */
@Component
@RequiredArgsConstructor
public class ToolOrchestratorFactory {

    private final LlmPort llmPort;
    private final ToolCatalogFactory catalogFactory;
    private final ToolCallParser parser;
    private final ToolCallExecutor executor;
    private final MessageSequenceNormalizer normalizer;
    private final CrewProperties properties;

    private final Map<String, ToolOrchestratingLlmPort> byAgent = new ConcurrentHashMap<>();

    public ToolOrchestratingLlmPort forAgent(AgentProfile agent) {
        return byAgent.computeIfAbsent(agent.getId(), id -> create(catalogFactory.forAgent(agent)));
    }

    public ToolOrchestratingLlmPort create(ToolCatalog catalog) {
        return new ToolOrchestratingLlmPort(llmPort, catalog, parser, executor, normalizer,
                properties.getProjectId(), properties.getTools().isAppendToolResults());
    }
}
