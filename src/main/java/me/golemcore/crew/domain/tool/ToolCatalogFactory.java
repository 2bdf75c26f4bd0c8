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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.crew.domain.component.ToolComponent;
import me.golemcore.crew.domain.model.AgentProfile;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Builds the shared tool template from every {@link ToolComponent} bean and
 * derives per-agent catalogs from it.
 */
@Component
@Slf4j
public class ToolCatalogFactory {

    private final ToolCatalog template;

    public ToolCatalogFactory(List<ToolComponent> tools) {
        this.template = ToolCatalog.of(tools);
        log.info("[Tools] Shared tool template: {}", template.names());
    }

    /**
     * Returns the agent's own catalog. An agent without an explicit tool list gets
     * the whole template.
     */
    public ToolCatalog forAgent(AgentProfile agent) {
        if (agent == null || agent.getTools() == null || agent.getTools().isEmpty()) {
            return template;
        }
        ToolCatalog catalog = template.restrictTo(agent.getTools());
        if (catalog.size() < agent.getTools().size()) {
            log.warn("[Tools] Agent {} requested unknown tools: {}", agent.getId(),
                    agent.getTools().stream().filter(name -> !template.contains(name)).toList());
        }
        return catalog;
    }
}
