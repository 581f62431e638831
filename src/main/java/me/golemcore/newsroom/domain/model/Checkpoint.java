package me.golemcore.newsroom.domain.model;

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

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Instant;

/**
 * Immutable, append-only record of the run state after a node invocation.
 *
 * <p>
 * Step 0 is the start sentinel written before any node runs. A failure
 * checkpoint has a {@code null} hint, a non-null {@code failureKind} and names
 * the node that was being invoked when the run stopped.
 */
public record Checkpoint(
        String runId,
        long step,
        NodeName nodeName,
        NextHint hint,
        RunState state,
        Instant timestamp,
        FailureKind failureKind) {

    @JsonIgnore
    public boolean isFailure() {
        return failureKind != null;
    }
}
