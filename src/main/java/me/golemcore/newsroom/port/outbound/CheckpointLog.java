package me.golemcore.newsroom.port.outbound;

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

import java.util.List;
import java.util.Optional;

/**
 * Append-only, per-run log of {@link Checkpoint}s.
 */
public interface CheckpointLog {

    /**
     * Persists a checkpoint. Fails if a checkpoint with the same run id and step
     * already exists.
     */
    void append(Checkpoint checkpoint);

    /**
     * Returns the checkpoint with the highest step for the run, if any.
     */
    Optional<Checkpoint> loadLatest(String runId);

    /**
     * Returns all checkpoints of the run ordered by step.
     */
    List<Checkpoint> list(String runId);
}
