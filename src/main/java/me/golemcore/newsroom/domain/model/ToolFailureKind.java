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
 * Machine-readable classification of tool execution failures.
 *
 * <p>
 * This exists to avoid relying on string matching in tool error messages.
 */
public enum ToolFailureKind {

    /**
     * No configured capability provider exposes the requested tool.
     */
    UNKNOWN_TOOL,

    /**
     * The provider answered with a result flagged as an error.
     */
    PROVIDER_ERROR,

    /**
     * Tool execution failed during runtime (transport errors, protocol errors,
     * exceptions).
     */
    EXECUTION_FAILED,

    /**
     * The call did not complete within the per-call timeout.
     */
    TIMEOUT,

    /**
     * The call was abandoned because the run was canceled.
     */
    CANCELED,

    /**
     * The call was not sent because the provider exposing the tool could not be
     * started.
     */
    PROVIDER_UNAVAILABLE,

    /**
     * The call was never sent: the run was canceled or dispatch shut down
     * before it started.
     */
    NOT_STARTED;

    /**
     * Whether the failure guarantees that the tool never ran, so the same call
     * can be issued again without side effects.
     */
    public boolean isNeverSent() {
        return this == PROVIDER_UNAVAILABLE || this == NOT_STARTED;
    }
}
