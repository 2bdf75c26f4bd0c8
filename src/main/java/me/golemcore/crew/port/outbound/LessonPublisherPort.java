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

package me.golemcore.crew.port.outbound;

import me.golemcore.crew.domain.model.AgentLesson;

import java.util.concurrent.CompletableFuture;

/**
 * Hands a lesson to the append-only lesson log. Delivery is at-least-once and
 * callers must not rely on the returned future for ordering or confirmation of
 * durability.
 *
 * @return a future holding the identifier assigned to the published entry
 */
public interface LessonPublisherPort {

    CompletableFuture<String> publish(AgentLesson lesson);
}
