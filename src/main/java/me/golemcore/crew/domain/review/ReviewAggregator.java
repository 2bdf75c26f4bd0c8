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

import me.golemcore.crew.domain.model.ReviewDecision;
import me.golemcore.crew.domain.model.ReviewResult;
import me.golemcore.crew.domain.model.ReviewStatus;
import me.golemcore.crew.domain.model.ReviewVerdict;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Reduces reviewer decisions to one outcome. Pure and independent of input
 * order.
 *
 * <ul>
 * <li>no decisions: {@code NOT_REQUIRED}</li>
 * <li>any reject: {@code REJECTED} with the lowest rejector confidence</li>
 * <li>otherwise any revise: {@code REVISION_NEEDED} with the mean confidence of
 * all reviewers</li>
 * <li>all approve: {@code APPROVED} with the mean confidence</li>
 * </ul>
 * Unless approved, required changes are the suggestions of every reviewer,
 * approvers included, deduplicated ignoring case and ordered by how many
 * reviewers made them, then by their mean confidence.
 */
@Component
public class ReviewAggregator {

    public ReviewResult aggregate(List<ReviewDecision> decisions) {
        if (decisions == null || decisions.isEmpty()) {
            return ReviewResult.notRequired();
        }

        long approvals = count(decisions, ReviewVerdict.APPROVE);
        long revisions = count(decisions, ReviewVerdict.REVISE);
        long rejections = count(decisions, ReviewVerdict.REJECT);
        double meanConfidence = decisions.stream().mapToDouble(ReviewDecision::getConfidence).average().orElse(0);

        ReviewStatus status;
        double confidence;
        if (rejections > 0) {
            status = ReviewStatus.REJECTED;
            confidence = decisions.stream()
                    .filter(d -> d.getDecision() == ReviewVerdict.REJECT)
                    .mapToDouble(ReviewDecision::getConfidence)
                    .min()
                    .orElse(0);
        } else if (revisions > 0) {
            status = ReviewStatus.REVISION_NEEDED;
            confidence = meanConfidence;
        } else {
            status = ReviewStatus.APPROVED;
            confidence = meanConfidence;
        }

        return ReviewResult.builder()
                .status(status)
                .decisions(List.copyOf(decisions))
                .aggregatedFeedback(feedback(decisions, status, approvals, revisions, rejections))
                .requiredChanges(status == ReviewStatus.APPROVED ? List.of() : requiredChanges(decisions))
                .confidence(confidence)
                .build();
    }

    private static long count(List<ReviewDecision> decisions, ReviewVerdict verdict) {
        return decisions.stream()
                .filter(d -> d.getDecision() == verdict)
                .count();
    }

    private static List<String> requiredChanges(List<ReviewDecision> decisions) {
        Map<String, SuggestedChange> changes = new LinkedHashMap<>();
        for (ReviewDecision decision : decisions) {
            if (decision.getSuggestedChanges() == null) {
                continue;
            }
            for (String change : decision.getSuggestedChanges()) {
                if (change != null && !change.isBlank()) {
                    String text = change.trim();
                    changes.computeIfAbsent(text.toLowerCase(Locale.ROOT), key -> new SuggestedChange(text))
                            .add(decision.getConfidence());
                }
            }
        }
        List<SuggestedChange> ordered = new ArrayList<>(changes.values());
        ordered.sort(Comparator.comparingInt(SuggestedChange::getCount).reversed()
                .thenComparing(Comparator.comparingDouble(SuggestedChange::meanConfidence).reversed()));
        return ordered.stream().map(SuggestedChange::getText).toList();
    }

    private static String feedback(List<ReviewDecision> decisions, ReviewStatus status, long approvals,
            long revisions, long rejections) {
        StringBuilder sb = new StringBuilder();
        sb.append("Review status: ").append(status.name()).append("\n")
                .append("Decisions: ").append(approvals).append(" approved, ")
                .append(revisions).append(" requested revisions, ")
                .append(rejections).append(" rejected\n\n")
                .append(switch (status) {
                case APPROVED -> "The reviewers approved the work with the following feedback:";
                case REJECTED -> "The work was rejected with the following concerns:";
                default -> "Revisions are needed based on the following feedback:";
                });
        for (ReviewDecision decision : decisions) {
            sb.append("\n\n[").append(decision.attribution()).append("] ")
                    .append(decision.getDecision().wireName()).append(": ")
                    .append(decision.getFeedback() != null ? decision.getFeedback() : "");
        }
        return sb.toString();
    }

    private static final class SuggestedChange {

        private final String text;
        private int count;
        private double confidenceSum;

        SuggestedChange(String text) {
            this.text = text;
        }

        void add(double confidence) {
            count++;
            confidenceSum += confidence;
        }

        String getText() {
            return text;
        }

        int getCount() {
            return count;
        }

        double meanConfidence() {
            return confidenceSum / count;
        }
    }
}
