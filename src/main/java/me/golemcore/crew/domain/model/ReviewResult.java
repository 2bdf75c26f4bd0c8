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
 * Aggregated outcome of a review round. Derived from its decisions and never
 * stored on its own.
 */
@Data
@Builder
public class ReviewResult {

    private ReviewStatus status;

    @Builder.Default
    private List<ReviewDecision> decisions = new ArrayList<>();

    private String aggregatedFeedback;

    @Builder.Default
    private List<String> requiredChanges = new ArrayList<>();

    private Double confidence;

    public static ReviewResult notRequired() {
        return ReviewResult.builder().status(ReviewStatus.NOT_REQUIRED).build();
    }
}
