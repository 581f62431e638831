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

import java.util.concurrent.CompletableFuture;

/**
 * Port for single-turn text completion. Agent nodes pass a system prompt and a
 * plain-text context assembled from the run state.
 */
public interface InferencePort {

    /**
     * Completes the given context under the given system prompt.
     *
     * @param systemPrompt
     *            instructions for the model
     * @param context
     *            user-side content (request, research, feedback)
     * @return the completion text
     */
    CompletableFuture<String> complete(String systemPrompt, String context);

    /**
     * Returns the model identifier used for completions.
     */
    String getModel();

    /**
     * Checks if the provider is configured and operational.
     */
    boolean isAvailable();
}
