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
 * Heuristic digest of the work done in a conversation. Values are scraped from
 * message text and are approximate.
 */
@Data
@Builder
public class WorkSummary {

    private int linesOfCode;

    @Builder.Default
    private List<String> filesModified = new ArrayList<>();

    @Builder.Default
    private List<String> testsAdded = new ArrayList<>();

    @Builder.Default
    private List<String> keyChanges = new ArrayList<>();
}
