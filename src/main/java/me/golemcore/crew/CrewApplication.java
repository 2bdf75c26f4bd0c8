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

package me.golemcore.crew;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for GolemCore Crew.
 *
 * <p>
 * GolemCore Crew coordinates a small, fixed set of LLM-backed agents working on
 * one project. It covers four concerns:
 * <ul>
 * <li><b>Tool round trips</b> - tool calls embedded in model text are parsed,
 * executed and fed back for a second pass</li>
 * <li><b>Context windows</b> - per-agent conversation history kept within a
 * model's token budget</li>
 * <li><b>Peer review</b> - completed work is fanned out to peer agents and the
 * verdicts are aggregated</li>
 * <li><b>Reflection</b> - corrections are detected and turned into per-agent
 * lessons</li>
 * </ul>
 *
 * <h2>Architecture</h2>
 *
 * <pre>
 * Inbound events     → InboundEventListener, CrewCoordinator
 * Domain Layer       → Tool loop, Review, Reflection, Context services
 * Infrastructure     → LLM/Storage/Directory/Lesson adapters
 * </pre>
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class CrewApplication {

    public static void main(String[] args) {
        SpringApplication.run(CrewApplication.class, args);
    }
}
