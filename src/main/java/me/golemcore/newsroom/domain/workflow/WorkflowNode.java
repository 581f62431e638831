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

import me.golemcore.newsroom.domain.model.NodeName;
import me.golemcore.newsroom.domain.model.NodeOutcome;
import me.golemcore.newsroom.domain.model.RunState;

/**
 * Base interface for the nodes of the newsroom graph (supervisor, researcher,
 * writer, quality, publisher, tool dispatch). Each node receives a working copy
 * of the run state, mutates it and returns it together with a hint that the
 * {@link TransitionTable} resolves to the next node.
 *
 * <p>
 * A node must never rely on being invoked exactly once: the engine may
 * re-invoke it from the same input state after a retryable failure or a
 * resume.
 */
public interface WorkflowNode {

    /**
     * Get the node name used in transitions and checkpoints.
     */
    NodeName getName();

    /**
     * Execute the node against the given working state.
     */
    NodeOutcome execute(RunState state);
}
