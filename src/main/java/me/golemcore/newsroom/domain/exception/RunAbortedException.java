package me.golemcore.newsroom.domain.exception;

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

import me.golemcore.newsroom.domain.model.Checkpoint;
import me.golemcore.newsroom.domain.model.FailureKind;

/**
 * Thrown by the engine when a run stops on an error. Carries the failure
 * checkpoint (or the last good one when the failure could not be persisted).
 */
public class RunAbortedException extends WorkflowException {

    private static final long serialVersionUID = 1L;

    private final transient Checkpoint lastCheckpoint;

    public RunAbortedException(FailureKind kind, String message, Throwable cause, Checkpoint lastCheckpoint) {
        super(kind, message, cause);
        this.lastCheckpoint = lastCheckpoint;
    }

    public Checkpoint getLastCheckpoint() {
        return lastCheckpoint;
    }

    public String getRunId() {
        return lastCheckpoint != null ? lastCheckpoint.runId() : null;
    }
}
