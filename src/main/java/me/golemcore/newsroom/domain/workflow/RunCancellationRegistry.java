package me.golemcore.newsroom.domain.workflow;

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
import org.springframework.stereotype.Component;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Tracks active runs and cancellation requests. The engine checks the flag
 * between steps; tool dispatch checks it while calls are in flight.
 */
@Component
@Slf4j
public class RunCancellationRegistry {

    private final Set<String> activeRuns = ConcurrentHashMap.newKeySet();
    private final Set<String> cancelRequests = ConcurrentHashMap.newKeySet();

    /**
     * Marks a run as active. Returns {@code false} if it is already active.
     */
    public boolean activate(String runId) {
        if (!activeRuns.add(runId)) {
            return false;
        }
        cancelRequests.remove(runId);
        return true;
    }

    public void deactivate(String runId) {
        activeRuns.remove(runId);
        cancelRequests.remove(runId);
    }

    /**
     * Requests cancellation of an active run. Returns {@code false} when no such
     * run is active.
     */
    public boolean cancel(String runId) {
        if (!activeRuns.contains(runId)) {
            return false;
        }
        cancelRequests.add(runId);
        log.info("[Workflow] Cancellation requested for run {}", runId);
        return true;
    }

    public boolean isCancelled(String runId) {
        return cancelRequests.contains(runId);
    }

    public boolean isActive(String runId) {
        return activeRuns.contains(runId);
    }
}
