package me.golemcore.agentkernel.domain.observer;

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

import me.golemcore.agentkernel.domain.model.KernelEvent;
import me.golemcore.agentkernel.domain.model.KernelEventType;
import me.golemcore.agentkernel.port.outbound.KernelObserver;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Keeps every event in memory, in emission order.
 */
public class RecordingKernelObserver implements KernelObserver {

    private final List<KernelEvent> events = new CopyOnWriteArrayList<>();

    @Override
    public void onEvent(KernelEvent event) {
        events.add(event);
    }

    public List<KernelEvent> getEvents() {
        return List.copyOf(events);
    }

    public List<KernelEvent> getEvents(KernelEventType type) {
        return events.stream().filter(event -> event.type() == type).toList();
    }

    public List<KernelEventType> getEventTypes() {
        return events.stream().map(KernelEvent::type).toList();
    }

    public void clear() {
        events.clear();
    }
}
