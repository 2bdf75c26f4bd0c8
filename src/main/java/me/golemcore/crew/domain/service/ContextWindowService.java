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
import lombok.extern.slf4j.Slf4j;
import me.golemcore.crew.domain.model.Message;
import me.golemcore.crew.infrastructure.config.CrewProperties;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Fits a conversation into a model's token budget.
 *
 * <p>
 * Only the prompt is trimmed; the stored conversation is never touched. A
 * leading system message is always kept. The remaining messages are taken from
 * newest to oldest until the next one would overflow the budget.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ContextWindowService {

    private final TokenEstimator tokenEstimator;
    private final CompactionService compactionService;
    private final CrewProperties properties;

    /**
     * Context size minus the response reserve, never negative.
     */
    public int defaultBudget() {
        CrewProperties.ContextProperties context = properties.getContext();
        return Math.max(0, context.getMaxContextTokens() - context.getResponseReserveTokens());
    }

    public List<Message> window(List<Message> messages, int budget) {
        if (messages == null || messages.isEmpty()) {
            return List.of();
        }
        Message system = messages.get(0).isSystemMessage() ? messages.get(0) : null;
        int start = system != null ? 1 : 0;
        int remaining = budget - (system != null ? tokenEstimator.estimate(system) : 0);

        List<Message> kept = new ArrayList<>();
        for (int i = messages.size() - 1; i >= start; i--) {
            int cost = tokenEstimator.estimate(messages.get(i));
            if (cost > remaining) {
                break;
            }
            remaining -= cost;
            kept.add(messages.get(i));
        }
        Collections.reverse(kept);

        // A tool result whose assistant call was cut off is meaningless to the model
        while (!kept.isEmpty() && kept.get(0).isToolMessage()) {
            kept.remove(0);
        }

        List<Message> result = new ArrayList<>(kept.size() + 1);
        if (system != null) {
            result.add(system);
        }
        result.addAll(kept);
        if (result.size() < messages.size()) {
            log.debug("[Context] Window kept {}/{} messages within {} tokens",
                    result.size(), messages.size(), budget);
        }
        return result;
    }

    /**
     * Windows the conversation, first folding older messages into a summary when
     * plain windowing would drop more than the configured share of them.
     */
    public List<Message> prepare(List<Message> messages, int budget) {
        List<Message> windowed = window(messages, budget);
        if (messages == null || messages.isEmpty()) {
            return windowed;
        }
        CrewProperties.ContextProperties context = properties.getContext();
        double droppedShare = (double) (messages.size() - windowed.size()) / messages.size();
        if (droppedShare <= context.getSummarizeThreshold() || messages.size() <= context.getSummarizeKeepLast()) {
            return windowed;
        }

        log.info("[Context] Windowing would drop {}% of {} messages, summarizing",
                Math.round(droppedShare * 100), messages.size());
        List<Message> compacted = compactionService.compact(messages, context.getSummarizeKeepLast());
        if (compacted == messages) {
            return windowed;
        }
        return window(compacted, budget);
    }

    public List<Message> prepare(List<Message> messages) {
        return prepare(messages, defaultBudget());
    }
}
