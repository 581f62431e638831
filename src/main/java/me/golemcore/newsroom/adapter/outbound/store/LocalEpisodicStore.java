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
import me.golemcore.newsroom.infrastructure.config.NewsroomProperties;
import me.golemcore.newsroom.port.outbound.CheckpointLog;
import me.golemcore.newsroom.port.outbound.PublicationJournal;
import me.golemcore.newsroom.port.outbound.SimilarityIndex;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Stream;

/**
 * Local filesystem implementation of the episodic store.
 *
 * <p>
 * Layout under the base path:
 * <ul>
 * <li>runs/&lt;runId&gt;/checkpoints/&lt;step&gt;.json - one file per
 * checkpoint, never overwritten
 * <li>articles/&lt;runId&gt;.json - one file per published article
 * </ul>
 *
 * <p>
 * Every file is written to a temp sibling with fsync and atomically renamed.
 * Writes for one run are serialized on a per-run lock, reads are lock-free.
 * Published articles are also kept in memory for similarity search.
 *
 * <p>
 * Base path configured via {@code newsroom.store.base-path}, defaults to
 * {@code ${user.home}/.golemcore/newsroom}.
 */
@Component
@ConditionalOnProperty(name = "newsroom.store.type", havingValue = "local", matchIfMissing = true)
@Slf4j
public class LocalEpisodicStore implements CheckpointLog, SimilarityIndex, PublicationJournal {

    private static final String RUNS_DIR = "runs";
    private static final String ARTICLES_DIR = "articles";
    private static final String CHECKPOINTS_DIR = "checkpoints";
    private static final String JSON_SUFFIX = ".json";

    private final NewsroomProperties properties;
    private final ObjectMapper objectMapper;

    private final Map<String, Object> runLocks = new ConcurrentHashMap<>();
    private final Map<String, EpisodicRecord> articles = new ConcurrentHashMap<>();

    private Path basePath;

    public LocalEpisodicStore(NewsroomProperties properties, ObjectMapper objectMapper) {
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    @PostConstruct
    public void init() {
        String basePathStr = properties.getStore().getBasePath();
        this.basePath = Paths.get(basePathStr.replace("${user.home}", System.getProperty("user.home")))
                .toAbsolutePath().normalize();

        try {
            Files.createDirectories(basePath.resolve(RUNS_DIR));
            Files.createDirectories(basePath.resolve(ARTICLES_DIR));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to create store directory: " + basePath, e);
        }

        loadArticles();
        log.info("[Store] Local episodic store initialized at: {} ({} articles)", basePath, articles.size());
    }

    private void loadArticles() {
        try (Stream<Path> files = Files.list(basePath.resolve(ARTICLES_DIR))) {
            for (Path file : files.filter(p -> p.getFileName().toString().endsWith(JSON_SUFFIX)).toList()) {
                try {
                    EpisodicRecord record = objectMapper.readValue(file.toFile(), EpisodicRecord.class);
                    articles.put(record.runId(), record);
                } catch (IOException e) {
                    log.warn("[Store] Skipping unreadable article {}: {}", file, e.getMessage());
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list articles in " + basePath, e);
        }
    }

    // ==================== CheckpointLog ====================

    @Override
    public void append(Checkpoint checkpoint) {
        synchronized (lockFor(checkpoint.runId())) {
            writeCheckpoint(checkpoint);
        }
        log.debug("[Store] Checkpoint {}#{} ({} -> {})", checkpoint.runId(), checkpoint.step(),
                checkpoint.nodeName(), checkpoint.hint());
    }

    @Override
    public Optional<Checkpoint> loadLatest(String runId) {
        List<Path> files = checkpointFiles(runId);
        if (files.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(readCheckpoint(files.get(files.size() - 1)));
    }

    @Override
    public List<Checkpoint> list(String runId) {
        List<Checkpoint> checkpoints = new ArrayList<>();
        for (Path file : checkpointFiles(runId)) {
            checkpoints.add(readCheckpoint(file));
        }
        return checkpoints;
    }

    // ==================== SimilarityIndex ====================

    @Override
    public void recordArticle(EpisodicRecord record) {
        synchronized (lockFor(record.runId())) {
            writeArticle(record);
            articles.put(record.runId(), record);
        }
    }

    @Override
    public List<NeighborMatch> nearestNeighbor(float[] vector, int k) {
        if (k <= 0 || articles.isEmpty()) {
            return List.of();
        }
        List<NeighborMatch> matches = new ArrayList<>();
        for (EpisodicRecord record : articles.values()) {
            requireComparable(record, vector);
            matches.add(new NeighborMatch(record, cosineSimilarity(vector, record.embedding())));
        }
        return matches.stream()
                .sorted(Comparator.comparingDouble(NeighborMatch::score).reversed())
                .limit(k)
                .toList();
    }

    // ==================== PublicationJournal ====================

    @Override
    public void commit(Checkpoint finalCheckpoint, EpisodicRecord record) {
        synchronized (lockFor(record.runId())) {
            Path checkpointPath = checkpointPath(finalCheckpoint.runId(), finalCheckpoint.step());
            if (Files.exists(checkpointPath)) {
                throw new IllegalStateException("Checkpoint already exists: " + finalCheckpoint.runId()
                        + "#" + finalCheckpoint.step());
            }

            writeArticle(record);
            try {
                writeCheckpoint(finalCheckpoint);
            } catch (RuntimeException e) {
                // Roll back the article so the pair stays all-or-nothing
                deleteQuietly(articlePath(record.runId()));
                throw e;
            }
            articles.put(record.runId(), record);
        }
        log.info("[Store] Publication committed for run {} at step {}", record.runId(), finalCheckpoint.step());
    }

    @Override
    public boolean hasRecord(String runId) {
        return articles.containsKey(runId) || Files.exists(articlePath(runId));
    }

    // ==================== internals ====================

    private void writeCheckpoint(Checkpoint checkpoint) {
        Path target = checkpointPath(checkpoint.runId(), checkpoint.step());
        if (Files.exists(target)) {
            throw new IllegalStateException("Checkpoint already exists: " + checkpoint.runId()
                    + "#" + checkpoint.step());
        }
        writeAtomic(target, toJson(checkpoint));
    }

    private void writeArticle(EpisodicRecord record) {
        writeAtomic(articlePath(record.runId()), toJson(record));
    }

    private Checkpoint readCheckpoint(Path file) {
        try {
            return objectMapper.readValue(file.toFile(), Checkpoint.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read checkpoint: " + file, e);
        }
    }

    private List<Path> checkpointFiles(String runId) {
        Path dir = runDirectory(runId).resolve(CHECKPOINTS_DIR);
        if (!Files.isDirectory(dir)) {
            return List.of();
        }
        try (Stream<Path> files = Files.list(dir)) {
            return files
                    .filter(p -> p.getFileName().toString().endsWith(JSON_SUFFIX))
                    .sorted(Comparator.comparingLong(LocalEpisodicStore::stepOf))
                    .toList();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list checkpoints for run " + runId, e);
        }
    }

    private static long stepOf(Path file) {
        String name = file.getFileName().toString();
        return Long.parseLong(name.substring(0, name.length() - JSON_SUFFIX.length()));
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to serialize " + value.getClass().getSimpleName(), e);
        }
    }

    private void writeAtomic(Path targetPath, String content) {
        Path tempPath = targetPath.resolveSibling(targetPath.getFileName() + ".tmp");

        try {
            Path parent = targetPath.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }

            byte[] bytes = content.getBytes(StandardCharsets.UTF_8);
            try (OutputStream os = Files.newOutputStream(tempPath,
                    StandardOpenOption.CREATE,
                    StandardOpenOption.TRUNCATE_EXISTING,
                    StandardOpenOption.SYNC);
                    FileChannel channel = FileChannel.open(tempPath, StandardOpenOption.WRITE)) {
                os.write(bytes);
                os.flush();
                channel.force(true); // fsync: metadata + data
            }

            try {
                Files.move(tempPath, targetPath,
                        StandardCopyOption.REPLACE_EXISTING,
                        StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                log.warn("[Store] Atomic move not supported, using regular move");
                Files.move(tempPath, targetPath, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            deleteQuietly(tempPath);
            throw new UncheckedIOException("Atomic write failed: " + targetPath, e);
        }
    }

    private void deleteQuietly(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException cleanupEx) {
            log.warn("[Store] Failed to delete {}: {}", path, cleanupEx.getMessage());
        }
    }

    private Object lockFor(String runId) {
        return runLocks.computeIfAbsent(runId, id -> new Object());
    }

    private Path runDirectory(String runId) {
        return resolvePath(RUNS_DIR, runId);
    }

    private Path checkpointPath(String runId, long step) {
        return runDirectory(runId).resolve(CHECKPOINTS_DIR).resolve(String.format("%010d%s", step, JSON_SUFFIX));
    }

    private Path articlePath(String runId) {
        return resolvePath(ARTICLES_DIR, runId + JSON_SUFFIX);
    }

    private Path resolvePath(String directory, String path) {
        Path resolved = basePath.resolve(directory).resolve(path).normalize();
        if (!resolved.startsWith(basePath.resolve(directory)) || resolved.equals(basePath.resolve(directory))) {
            throw new IllegalArgumentException("Path traversal blocked: " + directory + "/" + path);
        }
        return resolved;
    }
}
