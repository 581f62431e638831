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

import me.golemcore.newsroom.domain.exception.WorkflowException;
import me.golemcore.newsroom.domain.model.FailureKind;
import me.golemcore.newsroom.domain.model.NextHint;
import me.golemcore.newsroom.domain.model.NodeName;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Explicit (node, hint) → next node table of the newsroom graph.
 *
 * <pre>
 * START          START           → SUPERVISOR
 * SUPERVISOR     RESEARCH        → RESEARCHER
 * SUPERVISOR     WRITE           → WRITER
 * SUPERVISOR     CHECK_QUALITY   → QUALITY
 * SUPERVISOR     PUBLISH         → PUBLISHER
 * SUPERVISOR     FINISH          → END
 * RESEARCHER     NEEDS_TOOLS     → TOOL_DISPATCH
 * RESEARCHER     RESEARCH_READY  → SUPERVISOR
 * WRITER         DRAFT_READY     → SUPERVISOR
 * QUALITY        QUALITY_CHECKED → SUPERVISOR
 * PUBLISHER      NEEDS_TOOLS     → TOOL_DISPATCH
 * PUBLISHER      PUBLISHED       → END
 * TOOL_DISPATCH  TOOLS_DONE      → SUPERVISOR
 * </pre>
 *
 * Any pair not listed is a configuration error.
 */
@Component
public class TransitionTable {

    private final Map<NodeName, Map<NextHint, NodeName>> transitions;

    public TransitionTable() {
        Map<NodeName, Map<NextHint, NodeName>> table = new EnumMap<>(NodeName.class);
        put(table, NodeName.START, NextHint.START, NodeName.SUPERVISOR);
        put(table, NodeName.SUPERVISOR, NextHint.RESEARCH, NodeName.RESEARCHER);
        put(table, NodeName.SUPERVISOR, NextHint.WRITE, NodeName.WRITER);
        put(table, NodeName.SUPERVISOR, NextHint.CHECK_QUALITY, NodeName.QUALITY);
        put(table, NodeName.SUPERVISOR, NextHint.PUBLISH, NodeName.PUBLISHER);
        put(table, NodeName.SUPERVISOR, NextHint.FINISH, NodeName.END);
        put(table, NodeName.RESEARCHER, NextHint.NEEDS_TOOLS, NodeName.TOOL_DISPATCH);
        put(table, NodeName.RESEARCHER, NextHint.RESEARCH_READY, NodeName.SUPERVISOR);
        put(table, NodeName.WRITER, NextHint.DRAFT_READY, NodeName.SUPERVISOR);
        put(table, NodeName.QUALITY, NextHint.QUALITY_CHECKED, NodeName.SUPERVISOR);
        put(table, NodeName.PUBLISHER, NextHint.NEEDS_TOOLS, NodeName.TOOL_DISPATCH);
        put(table, NodeName.PUBLISHER, NextHint.PUBLISHED, NodeName.END);
        put(table, NodeName.TOOL_DISPATCH, NextHint.TOOLS_DONE, NodeName.SUPERVISOR);
        this.transitions = Collections.unmodifiableMap(table);
    }

    private static void put(Map<NodeName, Map<NextHint, NodeName>> table, NodeName from, NextHint hint,
            NodeName to) {
        table.computeIfAbsent(from, k -> new EnumMap<>(NextHint.class)).put(hint, to);
    }

    /**
     * Resolves the node that follows {@code from} when it returned {@code hint}.
     *
     * @throws WorkflowException
     *             with {@link FailureKind#CONFIGURATION_ERROR} for an unmapped
     *             pair
     */
    public NodeName resolve(NodeName from, NextHint hint) {
        Map<NextHint, NodeName> row = transitions.get(from);
        NodeName next = row != null && hint != null ? row.get(hint) : null;
        if (next == null) {
            throw new WorkflowException(FailureKind.CONFIGURATION_ERROR,
                    "No transition from " + from + " on " + hint);
        }
        return next;
    }
}
