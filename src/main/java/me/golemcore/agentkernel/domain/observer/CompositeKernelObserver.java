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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.agentkernel.domain.model.KernelEvent;
import me.golemcore.agentkernel.port.outbound.KernelObserver;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Fans events out to every registered observer. A failing observer is logged
 * and skipped; it never prevents delivery to the others or reaches the
 * kernel.
 */
@Slf4j
public class CompositeKernelObserver implements KernelObserver {

    private final List<KernelObserver> observers = new CopyOnWriteArrayList<>();

    public CompositeKernelObserver(List<? extends KernelObserver> observers) {
        if (observers != null) {
            this.observers.addAll(observers);
        }
    }

    public void add(KernelObserver observer) {
        observers.add(observer);
    }

    public void remove(KernelObserver observer) {
        observers.remove(observer);
    }

    public List<KernelObserver> getObservers() {
        return List.copyOf(observers);
    }

    @Override
    public void onEvent(KernelEvent event) {
        for (KernelObserver observer : observers) {
            try {
                observer.onEvent(event);
            } catch (RuntimeException e) {
                log.warn("[Kernel] Observer {} failed on {}: {}", observer.getClass().getSimpleName(),
                        event.type(), e.getMessage());
            }
        }
    }
}
