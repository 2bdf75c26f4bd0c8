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

package me.golemcore.crew.adapter.outbound.directory;

import lombok.RequiredArgsConstructor;
import me.golemcore.crew.domain.model.AgentProfile;
import me.golemcore.crew.infrastructure.config.CrewProperties;
import me.golemcore.crew.port.outbound.AgentDirectoryPort;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Agent directory backed by the {@code crew.agents.*} properties. The map key
 * is the agent id.
 */
@Component
@RequiredArgsConstructor
public class ConfiguredAgentDirectory implements AgentDirectoryPort {

    private final CrewProperties properties;

    @Override
    public List<AgentProfile> listAgents() {
        List<AgentProfile> agents = new ArrayList<>();
        for (Map.Entry<String, CrewProperties.AgentProperties> entry : properties.getAgents().entrySet()) {
            agents.add(toProfile(entry.getKey(), entry.getValue()));
        }
        return agents;
    }

    @Override
    public Optional<AgentProfile> findAgent(String agentId) {
        if (agentId == null) {
            return Optional.empty();
        }
        CrewProperties.AgentProperties agent = properties.getAgents().get(agentId);
        return Optional.ofNullable(agent).map(a -> toProfile(agentId, a));
    }

    private static AgentProfile toProfile(String id, CrewProperties.AgentProperties agent) {
        return AgentProfile.builder()
                .id(id)
                .name(agent.getName())
                .role(agent.getRole())
                .description(agent.getDescription())
                .model(agent.getModel())
                .tools(agent.getTools() != null ? new ArrayList<>(agent.getTools()) : new ArrayList<>())
                .build();
    }
}
