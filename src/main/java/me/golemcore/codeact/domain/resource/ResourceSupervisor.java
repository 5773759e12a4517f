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


package me.golemcore.codeact.domain.resource;

import me.golemcore.codeact.domain.exception.ResourceStartException;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Starts and stops a fixed bundle of resources as a unit.
 *
 * <p>
 * {@link #start()} acquires resources in list order. If one fails, every
 * resource already started is stopped in reverse order before the failure is
 * rethrown as {@link ResourceStartException}. {@link #stop()} releases started
 * resources in reverse order and is idempotent; a failure while stopping one
 * resource is logged and does not prevent stopping the rest.
 */
@Slf4j
public class ResourceSupervisor {

    private final String ownerName;
    private final List<ManagedResource> resources;
    private final Deque<ManagedResource> started = new ArrayDeque<>();

    public ResourceSupervisor(String ownerName, List<ManagedResource> resources) {
        this.ownerName = ownerName;
        this.resources = List.copyOf(resources);
    }

    public synchronized void start() {
        if (!started.isEmpty()) {
            throw new IllegalStateException("Resources of " + ownerName + " already started");
        }
        for (ManagedResource resource : resources) {
            try {
                resource.start();
            } catch (RuntimeException e) {
                log.warn("[Resources] {} failed to start {}, rolling back {} started resource(s)",
                        ownerName, resource.resourceName(), started.size());
                stopStarted();
                throw new ResourceStartException(resource.resourceName(), e);
            }
            started.push(resource);
            log.debug("[Resources] {} started {}", ownerName, resource.resourceName());
        }
        log.info("[Resources] {} started {} resource(s)", ownerName, resources.size());
    }

    public synchronized void stop() {
        if (started.isEmpty()) {
            return;
        }
        int count = started.size();
        stopStarted();
        log.info("[Resources] {} stopped {} resource(s)", ownerName, count);
    }

    public synchronized boolean isStarted() {
        return !started.isEmpty();
    }

    private void stopStarted() {
        while (!started.isEmpty()) {
            ManagedResource resource = started.pop();
            try {
                resource.stop();
            } catch (RuntimeException e) {
                log.warn("[Resources] {} failed to stop {}: {}", ownerName, resource.resourceName(),
                        e.getMessage(), e);
            }
        }
    }
}
