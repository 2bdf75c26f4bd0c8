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

package me.golemcore.crew.domain.tool;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.crew.domain.model.Message;
import me.golemcore.crew.domain.service.StructuredResponseDecoder;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts tool calls that a model wrote into its free-form answer.
 *
 * <p>
 * Three encodings are recognized:
 * <ol>
 * <li>a tagged block: {@code <tool_use>{"tool": "name", "arguments": {...}}</tool_use>}
 * ({@code name} and {@code args} are accepted as aliases, and arguments may be
 * a JSON-encoded string)</li>
 * <li>an inline object: {@code {"type": "tool_use", "name": "...", "input": {...}}}</li>
 * <li>an inline object: {@code {"function_call": {"name": "...", "arguments": "<json>"}}}</li>
 * </ol>
 *
 * <p>
 * Both {@link #parse(String)} and {@link #removeToolCalls(String)} work from the
 * same located spans, so removal deletes exactly what parsing recognized.
 * Malformed candidates are logged and left in the text untouched.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ToolCallParser {

    public static final String OPEN_TAG = "<tool_use>";
    public static final String CLOSE_TAG = "</tool_use>";

    private static final Pattern TAGGED_BLOCK = Pattern.compile(
            Pattern.quote(OPEN_TAG) + "(.*?)" + Pattern.quote(CLOSE_TAG), Pattern.DOTALL);
    private static final Pattern EXCESS_BLANK_LINES = Pattern.compile("(?:[ \\t]*\\r?\\n){3,}");
    private static final String INLINE_TOOL_USE_MARKER = "\"tool_use\"";
    private static final String INLINE_FUNCTION_CALL_MARKER = "\"function_call\"";
    private static final String ID_PREFIX = "call_";
    private static final String ID_ALPHABET = "abcdefghijklmnopqrstuvwxyz0123456789";
    private static final int ID_LENGTH = 9;
    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE_REF = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public enum Encoding {
        TAGGED_BLOCK, TOOL_USE_OBJECT, FUNCTION_CALL_OBJECT
    }

    /**
     * A recognized tool call and the half-open character range it occupies in the
     * source text.
     */
    public record ToolCallSpan(int start, int end, Encoding encoding, Message.ToolCall call) {
    }

    public List<Message.ToolCall> parse(String text) {
        return locate(text).stream()
                .map(ToolCallSpan::call)
                .toList();
    }

    public boolean hasToolCalls(String text) {
        return !parse(text).isEmpty();
    }

    /**
     * Deletes every recognized tool call from the text, collapses the blank lines
     * left behind and trims the result. Deleting a tagged block can join the text
     * around it into a new inline call, so deletion repeats until nothing is
     * recognized. Applying it twice yields the same string as applying it once.
     */
    public String removeToolCalls(String text) {
        if (text == null) {
            return "";
        }
        String current = text;
        List<ToolCallSpan> spans = locate(current);
        while (!spans.isEmpty()) {
            StringBuilder sb = new StringBuilder(current);
            for (int i = spans.size() - 1; i >= 0; i--) {
                ToolCallSpan span = spans.get(i);
                sb.delete(span.start(), span.end());
            }
            current = sb.toString();
            spans = locate(current);
        }
        return EXCESS_BLANK_LINES.matcher(current).replaceAll("\n\n").trim();
    }

    /**
     * Finds all recognized tool calls ordered by position.
     */
    public List<ToolCallSpan> locate(String text) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }
        List<ToolCallSpan> spans = new ArrayList<>();
        List<int[]> taggedRegions = new ArrayList<>();

        Matcher matcher = TAGGED_BLOCK.matcher(text);
        while (matcher.find()) {
            int start = matcher.start();
            int end = matcher.end();
            taggedRegions.add(new int[] { start, end });
            parseTaggedBlock(matcher.group(1))
                    .ifPresent(call -> spans.add(new ToolCallSpan(start, end, Encoding.TAGGED_BLOCK, call)));
        }

        scanInlineObjects(text, taggedRegions, spans);
        spans.sort(Comparator.comparingInt(ToolCallSpan::start));
        return spans;
    }

    private Optional<Message.ToolCall> parseTaggedBlock(String body) {
        JsonNode node;
        try {
            node = objectMapper.readTree(body.trim());
        } catch (JsonProcessingException e) {
            log.warn("[Tools] Skipping malformed tool block: {}", e.getOriginalMessage());
            return Optional.empty();
        }
        if (node == null || !node.isObject()) {
            log.warn("[Tools] Skipping tool block that is not a JSON object");
            return Optional.empty();
        }

        String name = textField(node, "tool");
        if (name == null) {
            name = textField(node, "name");
        }
        if (name == null) {
            log.warn("[Tools] Skipping tool block without a tool name");
            return Optional.empty();
        }

        JsonNode arguments = node.has("arguments") ? node.get("arguments") : node.get("args");
        String toolName = name;
        return decodeArguments(arguments, toolName).map(args -> newCall(toolName, args));
    }

    private void scanInlineObjects(String text, List<int[]> taggedRegions, List<ToolCallSpan> spans) {
        int i = 0;
        while (i < text.length()) {
            int regionEnd = taggedRegionEnd(taggedRegions, i);
            if (regionEnd >= 0) {
                i = regionEnd;
                continue;
            }
            if (text.charAt(i) != '{') {
                i++;
                continue;
            }
            int end = StructuredResponseDecoder.findBalancedEnd(text, i);
            if (end < 0 || overlapsTaggedRegion(taggedRegions, i, end)) {
                i++;
                continue;
            }
            String candidate = text.substring(i, end);
            if (candidate.contains(INLINE_TOOL_USE_MARKER) || candidate.contains(INLINE_FUNCTION_CALL_MARKER)) {
                Optional<ToolCallSpan> span = parseInlineObject(candidate, i, end);
                if (span.isPresent()) {
                    spans.add(span.get());
                    i = end;
                    continue;
                }
            }
            i++;
        }
    }

    private Optional<ToolCallSpan> parseInlineObject(String candidate, int start, int end) {
        JsonNode node;
        try {
            node = objectMapper.readTree(candidate);
        } catch (JsonProcessingException e) {
            log.debug("[Tools] Inline candidate at {} is not valid JSON: {}", start, e.getOriginalMessage());
            return Optional.empty();
        }
        if (node == null || !node.isObject()) {
            return Optional.empty();
        }
        JsonNode object = node;
        return parseToolUseObject(object, start, end)
                .or(() -> parseFunctionCallObject(object, start, end));
    }

    private Optional<ToolCallSpan> parseToolUseObject(JsonNode node, int start, int end) {
        if (!"tool_use".equals(textField(node, "type"))) {
            return Optional.empty();
        }
        String name = textField(node, "name");
        if (name == null) {
            log.warn("[Tools] Skipping tool_use object without a name");
            return Optional.empty();
        }
        return decodeArguments(node.get("input"), name)
                .map(args -> new ToolCallSpan(start, end, Encoding.TOOL_USE_OBJECT, newCall(name, args)));
    }

    private Optional<ToolCallSpan> parseFunctionCallObject(JsonNode node, int start, int end) {
        JsonNode functionCall = node.get("function_call");
        if (functionCall == null || !functionCall.isObject()) {
            return Optional.empty();
        }
        String name = textField(functionCall, "name");
        if (name == null) {
            log.warn("[Tools] Skipping function_call object without a name");
            return Optional.empty();
        }
        return decodeArguments(functionCall.get("arguments"), name)
                .map(args -> new ToolCallSpan(start, end, Encoding.FUNCTION_CALL_OBJECT, newCall(name, args)));
    }

    /**
     * Accepts an object, a JSON-encoded object string, or nothing. Anything else
     * makes the whole call malformed.
     */
    private Optional<Map<String, Object>> decodeArguments(JsonNode raw, String toolName) {
        if (raw == null || raw.isNull() || raw.isMissingNode()) {
            return Optional.of(new LinkedHashMap<>());
        }
        JsonNode resolved = raw;
        if (raw.isTextual()) {
            String encoded = raw.asText();
            if (encoded.isBlank()) {
                return Optional.of(new LinkedHashMap<>());
            }
            try {
                resolved = objectMapper.readTree(encoded);
            } catch (JsonProcessingException e) {
                log.warn("[Tools] Skipping call to '{}': arguments string is not JSON", toolName);
                return Optional.empty();
            }
        }
        if (resolved == null || !resolved.isObject()) {
            log.warn("[Tools] Skipping call to '{}': arguments are not an object", toolName);
            return Optional.empty();
        }
        return Optional.of(objectMapper.convertValue(resolved, MAP_TYPE_REF));
    }

    private static int taggedRegionEnd(List<int[]> regions, int index) {
        for (int[] region : regions) {
            if (index >= region[0] && index < region[1]) {
                return region[1];
            }
        }
        return -1;
    }

    private static boolean overlapsTaggedRegion(List<int[]> regions, int start, int end) {
        for (int[] region : regions) {
            if (start < region[1] && region[0] < end) {
                return true;
            }
        }
        return false;
    }

    private static String textField(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || !value.isTextual() || value.asText().isBlank()) {
            return null;
        }
        return value.asText().trim();
    }

    private static Message.ToolCall newCall(String name, Map<String, Object> arguments) {
        return Message.ToolCall.builder()
                .id(generateCallId())
                .name(name)
                .arguments(arguments)
                .build();
    }

    static String generateCallId() {
        ThreadLocalRandom random = ThreadLocalRandom.current();
        StringBuilder sb = new StringBuilder(ID_PREFIX);
        for (int i = 0; i < ID_LENGTH; i++) {
            sb.append(ID_ALPHABET.charAt(random.nextInt(ID_ALPHABET.length())));
        }
        return sb.toString();
    }
}
