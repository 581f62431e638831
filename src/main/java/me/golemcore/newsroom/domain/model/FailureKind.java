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

/**
 * Machine-readable classification of why a run step failed.
 *
 * <p>
 * Only {@link #RETRYABLE_TOOL_ERROR} is retried in place by the engine. The
 * resumable kinds may be continued later with an explicit resume.
 */
public enum FailureKind {

    /**
     * Transient failure of an external capability (tool, inference, embedding).
     */
    RETRYABLE_TOOL_ERROR(true),

    /**
     * Missing transition, unregistered node or unavailable capability.
     */
    CONFIGURATION_ERROR(false),

    /**
     * A node was invoked with state that violates its entry contract.
     */
    PRECONDITION_VIOLATION(false),

    /**
     * Publisher was reached without a unique, checked draft.
     */
    PUBLISH_PRECONDITION_FAILED(false),

    /**
     * Too many consecutive duplicate verdicts.
     */
    DUPLICATE_CONTENT_REJECTED(false),

    /**
     * Research came back empty twice in a row.
     */
    NO_RESEARCH_FOUND(false),

    /**
     * The publishing capability reported a failure. Never re-attempted
     * automatically.
     */
    PUBLISH_FAILED(false),

    STEP_BUDGET_EXCEEDED(false),

    RUN_TIMEOUT(true),

    /**
     * The episodic store could not persist a checkpoint or article.
     */
    STORE_FAILURE(true),

    /**
     * Unexpected exception thrown by a node.
     */
    NODE_FAILURE(true),

    CANCELED(true);

    private final boolean resumable;

    FailureKind(boolean resumable) {
        this.resumable = resumable;
    }

    public boolean isResumable() {
        return resumable;
    }
}
