package me.golemcore.newsroom.adapter.outbound.store;

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
import me.golemcore.newsroom.domain.model.NeighborMatch;
import me.golemcore.newsroom.port.outbound.CheckpointLog;
import me.golemcore.newsroom.port.outbound.PublicationJournal;
import me.golemcore.newsroom.port.outbound.SimilarityIndex;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * In-memory episodic store for tests and throwaway runs
 * ({@code newsroom.store.type=memory}).
 *
 * <p>
 * Checkpoints are kept as serialized JSON so a loaded checkpoint never shares
 * mutable state with the run that wrote it.
 */
@Component
@ConditionalOnProperty(name = "newsroom.store.type", havingValue = "memory")
@Slf4j
public class InMemoryEpisodicStore implements CheckpointLog, SimilarityIndex, PublicationJournal {

    private final ObjectMapper objectMapper;

    private final Map<String, NavigableMap<Long, String>> checkpoints = new ConcurrentHashMap<>();
    private final Map<String, EpisodicRecord> articles = new ConcurrentHashMap<>();

    public InMemoryEpisodicStore(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public void append(Checkpoint checkpoint) {
        NavigableMap<Long, String> entries = checkpointsOf(checkpoint.runId());
        String json = toJson(checkpoint);
        synchronized (entries) {
            if (entries.putIfAbsent(checkpoint.step(), json) != null) {
                throw new IllegalStateException("Checkpoint already exists: " + checkpoint.runId()
                        + "#" + checkpoint.step());
            }
        }
    }

    @Override
    public Optional<Checkpoint> loadLatest(String runId) {
        NavigableMap<Long, String> entries = checkpoints.get(runId);
        if (entries == null || entries.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(fromJson(entries.lastEntry().getValue()));
    }

    @Override
    public List<Checkpoint> list(String runId) {
        NavigableMap<Long, String> entries = checkpoints.get(runId);
        if (entries == null) {
            return List.of();
        }
        List<Checkpoint> result = new ArrayList<>();
        for (String json : entries.values()) {
            result.add(fromJson(json));
        }
        return result;
    }

    @Override
    public void recordArticle(EpisodicRecord record) {
        articles.put(record.runId(), record);
    }

    @Override
    public List<NeighborMatch> nearestNeighbor(float[] vector, int k) {
        if (k <= 0) {
            return List.of();
        }
        articles.values().forEach(record -> requireComparable(record, vector));
        return articles.values().stream()
                .map(record -> new NeighborMatch(record, cosineSimilarity(vector, record.embedding())))
                .sorted(Comparator.comparingDouble(NeighborMatch::score).reversed())
                .limit(k)
                .toList();
    }

    @Override
    public void commit(Checkpoint finalCheckpoint, EpisodicRecord record) {
        NavigableMap<Long, String> entries = checkpointsOf(finalCheckpoint.runId());
        String json = toJson(finalCheckpoint);
        synchronized (entries) {
            if (entries.containsKey(finalCheckpoint.step())) {
                throw new IllegalStateException("Checkpoint already exists: " + finalCheckpoint.runId()
                        + "#" + finalCheckpoint.step());
            }
            entries.put(finalCheckpoint.step(), json);
            articles.put(record.runId(), record);
        }
        log.debug("[Store] Publication committed for run {} at step {}", record.runId(), finalCheckpoint.step());
    }

    @Override
    public boolean hasRecord(String runId) {
        return articles.containsKey(runId);
    }

    public int articleCount() {
        return articles.size();
    }

    private NavigableMap<Long, String> checkpointsOf(String runId) {
        return checkpoints.computeIfAbsent(runId, id -> new ConcurrentSkipListMap<>());
    }

    private String toJson(Checkpoint checkpoint) {
        try {
            return objectMapper.writeValueAsString(checkpoint);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize checkpoint " + checkpoint.runId()
                    + "#" + checkpoint.step(), e);
        }
    }

    private Checkpoint fromJson(String json) {
        try {
            return objectMapper.readValue(json, Checkpoint.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to deserialize checkpoint", e);
        }
    }
}
