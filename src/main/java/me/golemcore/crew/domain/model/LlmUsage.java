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

/**
 * Token and cost accounting for one or more model calls. All fields are
 * additive.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LlmUsage {

    private int inputTokens;
    private int outputTokens;
    private int totalTokens;
    private int cacheCreationTokens;
    private int cacheReadTokens;
    private double cost;

    public static LlmUsage of(int inputTokens, int outputTokens) {
        return LlmUsage.builder()
                .inputTokens(inputTokens)
                .outputTokens(outputTokens)
                .totalTokens(inputTokens + outputTokens)
                .build();
    }

    /**
     * Sums two usage records field by field. Either side may be null.
     */
    public static LlmUsage merge(LlmUsage first, LlmUsage second) {
        if (first == null) {
            return second;
        }
        if (second == null) {
            return first;
        }
        return first.plus(second);
    }

    public LlmUsage plus(LlmUsage other) {
        return LlmUsage.builder()
                .inputTokens(inputTokens + other.inputTokens)
                .outputTokens(outputTokens + other.outputTokens)
                .totalTokens(totalTokens + other.totalTokens)
                .cacheCreationTokens(cacheCreationTokens + other.cacheCreationTokens)
                .cacheReadTokens(cacheReadTokens + other.cacheReadTokens)
                .cost(cost + other.cost)
                .build();
    }
}
