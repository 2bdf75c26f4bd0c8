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

package me.golemcore.crew.domain.toolloop;

import me.golemcore.crew.domain.model.Message;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Reshapes a message list so providers that require strict role alternation
 * accept it.
 *
 * <ul>
 * <li>non-system messages whose trimmed text is shorter than two characters
 * are dropped, unless they carry tool calls or are tool results</li>
 * <li>consecutive user messages are merged with a newline</li>
 * <li>for any other run of plain same-role messages the first one wins</li>
 * </ul>
 */
@Component
public class MessageSequenceNormalizer {

    private static final int MIN_CONTENT_LENGTH = 2;

    public List<Message> normalize(List<Message> messages) {
        List<Message> result = new ArrayList<>(messages.size());
        for (Message message : messages) {
            if (isNearEmpty(message)) {
                continue;
            }
            Message previous = result.isEmpty() ? null : result.get(result.size() - 1);
            if (previous != null && isPlain(previous) && isPlain(message)
                    && previous.getRole().equals(message.getRole())) {
                if (message.isUserMessage()) {
                    result.set(result.size() - 1, previous.toBuilder()
                            .content(previous.getContent() + "\n" + message.getContent())
                            .build());
                }
                continue;
            }
            result.add(message);
        }
        return result;
    }

    private static boolean isNearEmpty(Message message) {
        if (message.isSystemMessage() || message.isToolMessage() || message.hasToolCalls()) {
            return false;
        }
        String content = message.getContent();
        return content == null || content.trim().length() < MIN_CONTENT_LENGTH;
    }

    private static boolean isPlain(Message message) {
        return !message.isSystemMessage() && !message.isToolMessage() && !message.hasToolCalls();
    }
}
