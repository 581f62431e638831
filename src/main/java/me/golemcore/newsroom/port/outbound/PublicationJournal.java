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
import me.golemcore.newsroom.domain.model.EpisodicRecord;

/**
 * Records a successful publication. The episodic record and the final
 * checkpoint become visible together or not at all.
 */
public interface PublicationJournal {

    void commit(Checkpoint finalCheckpoint, EpisodicRecord record);

    boolean hasRecord(String runId);
}
