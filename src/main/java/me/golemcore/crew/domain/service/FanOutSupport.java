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

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * Joins independent asynchronous tasks back into one result.
 *
 * <p>
 * A failed task, or one that yields null, contributes nothing; it never fails
 * its siblings. Surviving values keep the order of the input tasks.
 */
@Slf4j
public final class FanOutSupport {

    private FanOutSupport() {
    }

    /**
     * Waits for every task to settle.
     */
    public static <T> CompletableFuture<List<T>> settleAll(List<CompletableFuture<T>> tasks, String label) {
        List<CompletableFuture<T>> isolated = new ArrayList<>(tasks.size());
        for (CompletableFuture<T> task : tasks) {
            isolated.add(task.exceptionally(e -> {
                log.warn("[{}] Task failed: {}", label, rootMessage(e));
                return null;
            }));
        }
        return CompletableFuture.allOf(isolated.toArray(new CompletableFuture[0]))
                .thenApply(ignored -> isolated.stream()
                        .map(CompletableFuture::join)
                        .filter(Objects::nonNull)
                        .toList());
    }

    /**
     * Waits for every task to settle, but no longer than {@code timeout}. When the
     * deadline passes first the result is empty and whatever already settled is
     * discarded. Outstanding tasks are not cancelled; their late results are
     * ignored.
     */
    public static <T> CompletableFuture<Optional<List<T>>> settleAllWithin(List<CompletableFuture<T>> tasks,
            Duration timeout, String label) {
        return settleAll(tasks, label)
                .thenApply(Optional::of)
                .completeOnTimeout(Optional.empty(), timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    public static String rootMessage(Throwable error) {
        Throwable cursor = error;
        while (cursor.getCause() != null && cursor.getCause() != cursor) {
            cursor = cursor.getCause();
        }
        String message = cursor.getMessage();
        return message != null && !message.isBlank() ? message : cursor.getClass().getSimpleName();
    }
}
