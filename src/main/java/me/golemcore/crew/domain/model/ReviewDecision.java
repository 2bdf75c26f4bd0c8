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
 * One responding reviewer's verdict. Reviewers that fail or time out produce no
 * decision at all.
 */
@Data
@Builder
public class ReviewDecision {

    private String reviewerId;
    private String reviewerName;
    private ReviewVerdict decision;
    private String feedback;
    private double confidence; // 0.0 - 1.0

    @Builder.Default
    private List<String> suggestedChanges = new ArrayList<>();

    private Instant timestamp;

    public String attribution() {
        return reviewerName != null && !reviewerName.isBlank() ? reviewerName : reviewerId;
    }
}
