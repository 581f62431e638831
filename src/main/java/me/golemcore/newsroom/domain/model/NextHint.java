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
 * Symbolic token returned by a node alongside its state update. The engine
 * resolves (node, hint) pairs to the next node through the transition table.
 */
public enum NextHint {

    /** Supervisor: gather (more) research. */
    RESEARCH,

    /** Supervisor: produce a new draft. */
    WRITE,

    /** Supervisor: run the duplicate check on the current draft. */
    CHECK_QUALITY,

    /** Supervisor: publish the approved draft. */
    PUBLISH,

    /** Supervisor: the run is done. */
    FINISH,

    /** Agent node: pending tool calls must be dispatched. */
    NEEDS_TOOLS,

    RESEARCH_READY,

    DRAFT_READY,

    QUALITY_CHECKED,

    PUBLISHED,

    TOOLS_DONE,

    /** Hint recorded with the step-0 checkpoint of every run. */
    START
}
