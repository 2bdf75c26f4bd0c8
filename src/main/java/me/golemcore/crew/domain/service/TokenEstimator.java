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

package me.golemcore.crew.domain.service;

import lombok.RequiredArgsConstructor;
import me.golemcore.crew.domain.model.Message;
import me.golemcore.crew.infrastructure.config.CrewProperties;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Approximate token counts from text length. This is a budgeting heuristic,
 * not a tokenizer: it assumes a fixed number of characters per token and adds
 * a small per-message overhead for role framing.
 */
@Component
@RequiredArgsConstructor
public class TokenEstimator {

    static final int MESSAGE_OVERHEAD_TOKENS = 4;

    private final CrewProperties properties;

    public int estimate(String text) {
        if (text == null || text.isEmpty()) {
            return 0;
        }
        int charsPerToken = Math.max(1, properties.getContext().getCharsPerToken());
        return (text.length() + charsPerToken - 1) / charsPerToken;
    }

    public int estimate(Message message) {
        int tokens = MESSAGE_OVERHEAD_TOKENS + estimate(message.getContent());
        if (message.hasToolCalls()) {
            for (Message.ToolCall toolCall : message.getToolCalls()) {
                tokens += estimate(toolCall.getName());
                if (toolCall.getArguments() != null) {
                    tokens += estimate(toolCall.getArguments().toString());
                }
            }
        }
        return tokens;
    }

    public int estimate(List<Message> messages) {
        int total = 0;
        for (Message message : messages) {
            total += estimate(message);
        }
        return total;
    }
}
