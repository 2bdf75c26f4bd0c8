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

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * A message delivered to the crew by the transport layer.
 */
@Data
@Builder
public class InboundEvent {

    private String id;
    private String conversationId;
    private String senderId;
    private String content;
    private Instant timestamp;

    /**
     * Agents that should see this event. Empty means every known agent.
     */
    @Builder.Default
    private List<String> recipients = new ArrayList<>();

    /**
     * Agent expected to answer, if any.
     */
    private String respondingAgentId;

    /**
     * Set when the sender reports the task as complete.
     */
    private Team completedTeam;
}
