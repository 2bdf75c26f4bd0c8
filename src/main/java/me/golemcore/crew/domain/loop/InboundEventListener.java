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

package me.golemcore.crew.domain.loop;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.crew.domain.model.InboundEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Listens for inbound events and hands them to {@link CrewCoordinator}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class InboundEventListener {

    private final CrewCoordinator coordinator;

    @EventListener
    public void onInboundEvent(InboundEvent event) {
        log.debug("[Inbound] event {} (conversation={}, sender={})", event.getId(), event.getConversationId(),
                event.getSenderId());
        coordinator.handle(event)
                .exceptionally(e -> {
                    log.warn("[Inbound] Failed to handle event {}: {}", event.getId(), e.getMessage());
                    return null;
                });
    }
}
