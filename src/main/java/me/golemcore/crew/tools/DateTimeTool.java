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

package me.golemcore.crew.tools;

import lombok.RequiredArgsConstructor;
import me.golemcore.crew.domain.component.ToolComponent;
import me.golemcore.crew.domain.model.ToolDefinition;
import me.golemcore.crew.domain.model.ToolExecutionContext;
import me.golemcore.crew.domain.model.ToolFailureKind;
import me.golemcore.crew.domain.model.ToolParameter;
import me.golemcore.crew.domain.model.ToolResult;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Reports the current time.
 *
 * <p>
 * Timezone examples: {@code "America/New_York"}, {@code "Europe/London"},
 * {@code "UTC"}. Formats: {@code iso} (default), {@code unix} (epoch seconds)
 * and {@code human}.
 */
@Component
@RequiredArgsConstructor
public class DateTimeTool implements ToolComponent {

    static final String NAME = "get_time";

    private static final DateTimeFormatter HUMAN_FORMAT =
            DateTimeFormatter.ofPattern("EEEE, MMMM d, yyyy 'at' HH:mm:ss z", Locale.ENGLISH);

    private final Clock clock;

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name(NAME)
                .description("Get the current date and time. Optionally specify a timezone and an output format.")
                .parameters(List.of(
                        ToolParameter.builder()
                                .name("timezone")
                                .description("IANA timezone, e.g. 'America/New_York' or 'UTC'. Default is UTC.")
                                .build(),
                        ToolParameter.builder()
                                .name("format")
                                .description("Output format. Default is iso.")
                                .enumValues(List.of("iso", "unix", "human"))
                                .build()))
                .build();
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters, ToolExecutionContext context) {
        return CompletableFuture.completedFuture(currentTime(parameters));
    }

    private ToolResult currentTime(Map<String, Object> parameters) {
        String timezone = stringParam(parameters, "timezone");
        ZoneId zoneId;
        try {
            zoneId = timezone != null ? ZoneId.of(timezone) : ZoneId.of("UTC");
        } catch (DateTimeException e) {
            return ToolResult.failure(ToolFailureKind.EXECUTION_FAILED, "Invalid timezone: " + timezone);
        }

        String format = stringParam(parameters, "format");
        format = format != null ? format.toLowerCase(Locale.ROOT) : "iso";

        ZonedDateTime now = ZonedDateTime.now(clock.withZone(zoneId));
        String formatted;
        switch (format) {
            case "iso" -> formatted = now.format(DateTimeFormatter.ISO_OFFSET_DATE_TIME);
            case "unix" -> formatted = String.valueOf(now.toEpochSecond());
            case "human" -> formatted = now.format(HUMAN_FORMAT);
            default -> {
                return ToolResult.failure(ToolFailureKind.EXECUTION_FAILED,
                        "Unsupported format: " + format + ". Use iso, unix or human.");
            }
        }

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("formatted", formatted);
        data.put("timezone", zoneId.getId());
        data.put("epochSeconds", now.toEpochSecond());
        data.put("dayOfWeek", now.getDayOfWeek().name());
        return ToolResult.success(formatted, data);
    }

    private static String stringParam(Map<String, Object> parameters, String name) {
        Object value = parameters.get(name);
        if (value == null || value.toString().isBlank()) {
            return null;
        }
        return value.toString().trim();
    }
}
