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

package me.golemcore.crew.infrastructure.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Centralized configuration properties for the crew, bound from
 * application.properties under the {@code crew.*} prefix.
 *
 * <ul>
 * <li>{@link LlmProperties} - model provider settings</li>
 * <li>{@link ContextProperties} - context window budget</li>
 * <li>{@link ToolsProperties} - tool execution</li>
 * <li>{@link ReviewProperties} - peer review fan-out</li>
 * <li>{@link ReflectionProperties} - correction detection and lessons</li>
 * <li>{@link StorageProperties} - local persistence</li>
 * <li>{@code agents} - the static agent directory</li>
 * </ul>
 */
@Component
@ConfigurationProperties(prefix = "crew")
@Data
public class CrewProperties {

    private String projectId = "default";
    private LlmProperties llm = new LlmProperties();
    private ContextProperties context = new ContextProperties();
    private ToolsProperties tools = new ToolsProperties();
    private ReviewProperties review = new ReviewProperties();
    private ReflectionProperties reflection = new ReflectionProperties();
    private StorageProperties storage = new StorageProperties();
    private Map<String, AgentProperties> agents = new LinkedHashMap<>();

    @Data
    public static class LlmProperties {
        private String provider = "langchain4j";
        private String model = "openai/gpt-4o";
        private double temperature = 0.7;
        private long timeoutMs = 300_000;
        private int maxRetries = 5;
        private long initialBackoffMs = 5_000;
        private Map<String, ProviderProperties> providers = new HashMap<>();
    }

    @Data
    public static class ProviderProperties {
        private String apiKey;
        private String baseUrl;
    }

    @Data
    public static class ContextProperties {
        private int maxContextTokens = 128_000;
        private int responseReserveTokens = 4_096;
        private int charsPerToken = 4;
        private int summarizeKeepLast = 10;
        private double summarizeThreshold = 0.5;
        private int summaryTimeoutSeconds = 60;
    }

    @Data
    public static class ToolsProperties {
        private int timeoutSeconds = 30;
        private boolean appendToolResults = true;
    }

    @Data
    public static class ReviewProperties {
        private long timeoutMs = 300_000;
        private int maxReviewers = 3;
        private int historyMessages = 10;
        private int messagePreviewChars = 200;
    }

    @Data
    public static class ReflectionProperties {
        private boolean enabled = true;
        private double minPatternConfidence = 0.6;
        private int historyMessages = 5;
    }

    @Data
    public static class StorageProperties {
        private String basePath = "${user.home}/.golemcore-crew";
    }

    @Data
    public static class AgentProperties {
        private String name;
        private String role;
        private String description;
        private String model;
        private List<String> tools = new ArrayList<>();
    }
}
