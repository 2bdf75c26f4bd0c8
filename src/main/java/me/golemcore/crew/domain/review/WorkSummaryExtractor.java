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

package me.golemcore.crew.domain.review;

import me.golemcore.crew.domain.model.Message;
import me.golemcore.crew.domain.model.WorkSummary;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Scrapes a rough work summary from conversation text for reviewers. The
 * numbers are telemetry only: code lines are counted inside fenced blocks, and
 * files are whatever looks like a file name.
 */
@Component
public class WorkSummaryExtractor {

    static final int MAX_FILES = 20;
    static final int MAX_TESTS = 10;
    static final int MAX_KEY_CHANGES = 10;

    private static final Pattern CODE_FENCE = Pattern.compile("```[^\\n]*\\n(.*?)```", Pattern.DOTALL);
    private static final Pattern FILE_NAME = Pattern.compile(
            "(?<![\\w/.-])([\\w./-]*[\\w-]\\.(?:java|kt|kts|ts|tsx|js|jsx|py|go|rs|rb|md|json|ya?ml|xml|sql|sh"
                    + "|css|html|properties|gradle|toml))\\b");
    private static final Pattern TEST_MENTION = Pattern.compile(
            "(?i)\\btests?\\s+(?:for|of)\\s+([\\w.#/-]+)");
    private static final List<String> KEY_CHANGE_VERBS = List.of(
            "added", "created", "implemented", "fixed", "updated", "refactored");

    public WorkSummary extract(List<Message> messages) {
        int linesOfCode = 0;
        Set<String> files = new LinkedHashSet<>();
        Set<String> tests = new LinkedHashSet<>();
        List<String> keyChanges = new ArrayList<>();

        for (Message message : messages) {
            if (message.isSystemMessage() || message.getContent() == null) {
                continue;
            }
            String content = message.getContent();

            Matcher fence = CODE_FENCE.matcher(content);
            while (fence.find()) {
                linesOfCode += (int) fence.group(1).lines().filter(line -> !line.isBlank()).count();
            }

            Matcher file = FILE_NAME.matcher(content);
            while (file.find() && files.size() < MAX_FILES) {
                files.add(file.group(1));
            }

            Matcher test = TEST_MENTION.matcher(content);
            while (test.find() && tests.size() < MAX_TESTS) {
                tests.add(test.group(1));
            }

            content.lines()
                    .map(WorkSummaryExtractor::stripBullet)
                    .filter(WorkSummaryExtractor::isKeyChange)
                    .forEach(line -> {
                        if (keyChanges.size() < MAX_KEY_CHANGES) {
                            keyChanges.add(line);
                        }
                    });
        }

        return WorkSummary.builder()
                .linesOfCode(linesOfCode)
                .filesModified(new ArrayList<>(files))
                .testsAdded(new ArrayList<>(tests))
                .keyChanges(keyChanges)
                .build();
    }

    private static String stripBullet(String line) {
        return line.trim().replaceFirst("^(?:[-*+]|\\d+\\.)\\s+", "");
    }

    private static boolean isKeyChange(String line) {
        String lower = line.toLowerCase(Locale.ROOT);
        return KEY_CHANGE_VERBS.stream().anyMatch(verb -> lower.startsWith(verb + " "));
    }
}
