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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.crew.domain.model.Conversation;
import me.golemcore.crew.domain.model.ReviewCompletedEvent;
import me.golemcore.crew.domain.model.ReviewRequest;
import me.golemcore.crew.domain.model.ReviewResult;
import me.golemcore.crew.domain.model.TaskDefinition;
import me.golemcore.crew.domain.model.Team;
import me.golemcore.crew.domain.service.ConversationStore;
import me.golemcore.crew.infrastructure.event.SpringEventBus;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Runs a full review round for a team's finished task: decides whether the
 * task needs a greenlight, summarizes the work, picks reviewers, collects and
 * aggregates their verdicts and publishes the outcome.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ReviewService {

    static final int COMPLEXITY_THRESHOLD = 7;

    // Checked in order: the most specific type wins
    private static final Map<String, List<String>> TASK_TYPE_KEYWORDS = new LinkedHashMap<>();

    static {
        TASK_TYPE_KEYWORDS.put("security_fix", List.of("security", "vulnerability", "exploit", "cve"));
        TASK_TYPE_KEYWORDS.put("database_migration", List.of("migration", "schema change", "database"));
        TASK_TYPE_KEYWORDS.put("api_change", List.of("api", "endpoint", "breaking change"));
        TASK_TYPE_KEYWORDS.put("refactor", List.of("refactor", "restructure", "cleanup"));
        TASK_TYPE_KEYWORDS.put("feature", List.of("feature", "implement", "add support"));
    }

    private static final List<String> REVIEWED_TASK_TYPES = List.of(
            "feature", "refactor", "security_fix", "database_migration", "api_change");

    private final ReviewCoordinator coordinator;
    private final ReviewAggregator aggregator;
    private final WorkSummaryExtractor workSummaryExtractor;
    private final ConversationStore conversationStore;
    private final SpringEventBus eventBus;
    private final Clock clock;

    /**
     * An explicit greenlight flag always wins. Otherwise review is required for
     * feature, refactor, security fix, database migration and API change tasks,
     * and for anything with an estimated complexity of 7 or more.
     */
    public boolean shouldRequireReview(TaskDefinition task) {
        if (task == null) {
            return false;
        }
        if (task.getRequiresGreenLight() != null) {
            return task.getRequiresGreenLight();
        }
        if (REVIEWED_TASK_TYPES.contains(resolveTaskType(task))) {
            return true;
        }
        return task.getEstimatedComplexity() != null && task.getEstimatedComplexity() >= COMPLEXITY_THRESHOLD;
    }

    /**
     * Uses the declared type when present, otherwise guesses it from keywords in
     * the description.
     */
    String resolveTaskType(TaskDefinition task) {
        if (task.getType() != null && !task.getType().isBlank()) {
            return task.getType().trim().toLowerCase(Locale.ROOT);
        }
        if (task.getDescription() == null) {
            return "general";
        }
        String description = task.getDescription().toLowerCase(Locale.ROOT);
        for (Map.Entry<String, List<String>> entry : TASK_TYPE_KEYWORDS.entrySet()) {
            if (entry.getValue().stream().anyMatch(description::contains)) {
                return entry.getKey();
            }
        }
        return "general";
    }

    /**
     * Reviews the team's work as seen from the owner's copy of the conversation.
     * Completes with {@code NOT_REQUIRED} when the gate says no review is needed
     * or no reviewer is available.
     */
    public CompletableFuture<ReviewResult> requestReview(Team team, String ownerAgentId, String conversationId,
            Collection<String> excludeMembers) {
        if (!shouldRequireReview(team.getTaskDefinition())) {
            log.debug("[Review] Team {} task does not require review", team.getId());
            return CompletableFuture.completedFuture(ReviewResult.notRequired());
        }

        Conversation conversation = conversationStore.find(ownerAgentId, conversationId)
                .orElseGet(() -> Conversation.builder().id(conversationId).ownerAgentId(ownerAgentId).build());
        ReviewRequest request = ReviewRequest.builder()
                .teamId(team.getId())
                .conversationId(conversationId)
                .taskDescription(team.getTaskDefinition().getDescription())
                .workSummary(workSummaryExtractor.extract(conversation.getMessages()))
                .timestamp(clock.instant())
                .build();

        return coordinator.selectReviewers(team, excludeMembers)
                .thenCompose(reviewers -> coordinator.collectReviews(reviewers, conversation, request))
                .thenApply(aggregator::aggregate)
                .thenApply(result -> {
                    log.info("[Review] Team {} review result: {} ({} decisions)", team.getId(), result.getStatus(),
                            result.getDecisions().size());
                    eventBus.publish(new ReviewCompletedEvent(team.getId(), conversationId, result));
                    return result;
                });
    }
}
