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

import java.util.List;

/**
 * A keyword-level correction signal found in the tail of a conversation.
 *
 * @param indicators
 *            the keywords that matched
 * @param messageIndices
 *            indices of the messages forming the pattern, earliest first
 */
public record CorrectionPattern(CorrectionType type, List<String> indicators, double confidence,
        List<Integer> messageIndices) {
}
