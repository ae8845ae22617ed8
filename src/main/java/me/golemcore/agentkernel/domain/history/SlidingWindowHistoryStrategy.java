package me.golemcore.agentkernel.domain.history;

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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.agentkernel.domain.exception.KernelConfigurationException;
import me.golemcore.agentkernel.domain.model.Message;
import me.golemcore.agentkernel.port.outbound.HistoryStrategy;

import java.util.ArrayList;
import java.util.List;

/**
 * Keeps a leading instruction message plus the most recent messages.
 *
 * <p>
 * Tool messages at the start of the window lost their assistant message to
 * the cut and are dropped as well, so every kept tool message still follows
 * the call it answers. When the window holds nothing but tool messages, it
 * is widened back to their assistant message instead, which may exceed the
 * limit.
 */
@Slf4j
public class SlidingWindowHistoryStrategy implements HistoryStrategy {

    public static final int DEFAULT_MAX_MESSAGES = 50;

    private final int maxMessages;

    public SlidingWindowHistoryStrategy() {
        this(DEFAULT_MAX_MESSAGES);
    }

    public SlidingWindowHistoryStrategy(int maxMessages) {
        if (maxMessages < 2) {
            throw new KernelConfigurationException("max-history-messages must be at least 2, got " + maxMessages);
        }
        this.maxMessages = maxMessages;
    }

    @Override
    public List<Message> trim(List<Message> history) {
        if (history.size() <= maxMessages) {
            return history;
        }
        boolean keepHead = history.get(0).isInstructionMessage();
        int windowSize = keepHead ? maxMessages - 1 : maxMessages;
        int cut = history.size() - windowSize;
        int windowStart = cut;
        while (windowStart < history.size() && history.get(windowStart).isToolMessage()) {
            windowStart++;
        }
        if (windowStart == history.size()) {
            // only tool results left: keep the assistant message that issued them
            windowStart = cut;
            while (windowStart > 0 && history.get(windowStart).isToolMessage()) {
                windowStart--;
            }
            if (keepHead && windowStart == 0) {
                windowStart = 1;
            }
        }

        List<Message> trimmed = new ArrayList<>(maxMessages);
        if (keepHead) {
            trimmed.add(history.get(0));
        }
        trimmed.addAll(history.subList(windowStart, history.size()));
        log.debug("[Kernel] History trimmed from {} to {} messages", history.size(), trimmed.size());
        return trimmed;
    }

    public int getMaxMessages() {
        return maxMessages;
    }
}
