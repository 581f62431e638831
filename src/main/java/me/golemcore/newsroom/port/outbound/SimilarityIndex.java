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

import me.golemcore.newsroom.domain.exception.IncompatibleEmbeddingException;
import me.golemcore.newsroom.domain.model.EpisodicRecord;
import me.golemcore.newsroom.domain.model.NeighborMatch;

import java.util.List;

/**
 * Vector index of published articles used for duplicate detection.
 */
public interface SimilarityIndex {

    void recordArticle(EpisodicRecord record);

    /**
     * Returns up to {@code k} stored articles ordered by descending cosine
     * similarity to {@code vector}. Empty when nothing has been published yet.
     *
     * @throws IncompatibleEmbeddingException
     *             if a stored article has no embedding or one of another
     *             dimension
     */
    List<NeighborMatch> nearestNeighbor(float[] vector, int k);

    default void requireComparable(EpisodicRecord record, float[] vector) {
        if (record.embedding() == null || record.embedding().length != vector.length) {
            throw new IncompatibleEmbeddingException(String.format(
                    "Article of run %s has embedding dimension %d, current embeddings have %d",
                    record.runId(), record.embedding() == null ? 0 : record.embedding().length, vector.length));
        }
    }

    /**
     * Calculates cosine similarity between two embedding vectors. Returns a value
     * between -1 and 1, where 1 means identical direction.
     */
    default double cosineSimilarity(float[] a, float[] b) {
        if (a.length != b.length) {
            throw new IllegalArgumentException("Vectors must have same length");
        }

        double dotProduct = 0;
        double normA = 0;
        double normB = 0;

        for (int i = 0; i < a.length; i++) {
            dotProduct += a[i] * b[i];
            normA += a[i] * a[i];
            normB += b[i] * b[i];
        }

        if (normA == 0 || normB == 0) {
            return 0;
        }

        return dotProduct / (Math.sqrt(normA) * Math.sqrt(normB));
    }
}
