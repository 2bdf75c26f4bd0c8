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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Decodes JSON that a model was asked to produce. Models wrap JSON in markdown
 * fences, add prose around it, or return nothing useful at all, so every
 * method here returns {@link Optional#empty()} instead of throwing and leaves
 * the fallback to the caller.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class StructuredResponseDecoder {

    private static final Pattern FENCED_JSON = Pattern.compile("```(?:json)?\\s*([\\[{].*?[]}])\\s*```",
            Pattern.DOTALL);

    private final ObjectMapper objectMapper;

    public Optional<JsonNode> decodeObject(String response) {
        return decode(response, '{').filter(JsonNode::isObject);
    }

    public Optional<JsonNode> decodeArray(String response) {
        return decode(response, '[').filter(JsonNode::isArray);
    }

    private Optional<JsonNode> decode(String response, char opening) {
        if (response == null || response.isBlank()) {
            return Optional.empty();
        }
        String json = extractJson(response, opening);
        try {
            return Optional.ofNullable(objectMapper.readTree(json));
        } catch (JsonProcessingException e) {
            log.debug("Failed to decode structured response: {}", e.getOriginalMessage());
            return Optional.empty();
        }
    }

    private static String extractJson(String response, char opening) {
        Matcher fenced = FENCED_JSON.matcher(response);
        while (fenced.find()) {
            if (fenced.group(1).charAt(0) == opening) {
                return fenced.group(1);
            }
        }
        int start = response.indexOf(opening);
        if (start >= 0) {
            int end = findBalancedEnd(response, start);
            if (end > 0) {
                return response.substring(start, end);
            }
        }
        return response.trim();
    }

    /**
     * Returns the index just past the bracket that closes the one at
     * {@code start} ({@code {} or {@code [}), or -1 when it is never closed.
     * Brackets inside string literals are ignored.
     */
    public static int findBalancedEnd(String text, int start) {
        char open = text.charAt(start);
        char close = open == '[' ? ']' : '}';
        int depth = 0;
        boolean inString = false;
        boolean escaped = false;
        for (int i = start; i < text.length(); i++) {
            char c = text.charAt(i);
            if (inString) {
                if (escaped) {
                    escaped = false;
                } else if (c == '\\') {
                    escaped = true;
                } else if (c == '"') {
                    inString = false;
                }
                continue;
            }
            if (c == '"') {
                inString = true;
            } else if (c == open) {
                depth++;
            } else if (c == close) {
                depth--;
                if (depth == 0) {
                    return i + 1;
                }
            }
        }
        return -1;
    }
}
