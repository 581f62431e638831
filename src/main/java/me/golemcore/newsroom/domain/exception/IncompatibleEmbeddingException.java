package me.golemcore.newsroom.domain.exception;

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

import me.golemcore.newsroom.domain.model.FailureKind;

/**
 * A stored article embedding cannot be compared with the query vector, usually
 * because the embedding model changed. Duplicate detection is impossible until
 * the store and the configured model agree, so this is never retried.
 */
public class IncompatibleEmbeddingException extends WorkflowException {

    private static final long serialVersionUID = 1L;

    public IncompatibleEmbeddingException(String message) {
        super(FailureKind.CONFIGURATION_ERROR, message);
    }
}
