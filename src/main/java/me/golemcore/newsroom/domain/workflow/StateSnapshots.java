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

import me.golemcore.newsroom.domain.model.RunState;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * Deep-copies run state through its JSON form, so a node's working copy and
 * the state kept for retries never share mutable structure.
 */
@Component
@RequiredArgsConstructor
public class StateSnapshots {

    private final ObjectMapper objectMapper;

    public RunState copy(RunState state) {
        try {
            return objectMapper.readValue(objectMapper.writeValueAsBytes(state), RunState.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to copy state of run " + state.getRunId(), e);
        }
    }
}
