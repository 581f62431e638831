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
 * Transient failure of an external capability. The engine re-invokes the node
 * from its pre-attempt state with exponential backoff.
 */
public class RetryableToolException extends WorkflowException {

    private static final long serialVersionUID = 1L;

    public RetryableToolException(String message) {
        super(FailureKind.RETRYABLE_TOOL_ERROR, message);
    }

    public RetryableToolException(String message, Throwable cause) {
        super(FailureKind.RETRYABLE_TOOL_ERROR, message, cause);
    }
}
