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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * One agent's view of a shared thread. Each participating agent owns its own
 * copy; instances are never shared between agents.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Conversation {

    private String id;
    private String ownerAgentId;

    @Builder.Default
    private List<Message> messages = new ArrayList<>();

    @Builder.Default
    private Set<String> participants = new LinkedHashSet<>();

    private Instant createdAt;
    private Instant lastActivityAt;

    /**
     * Returns the trailing {@code count} messages, or all of them when fewer
     * exist.
     */
    public List<Message> lastMessages(int count) {
        if (messages.size() <= count) {
            return new ArrayList<>(messages);
        }
        return new ArrayList<>(messages.subList(messages.size() - count, messages.size()));
    }
}
