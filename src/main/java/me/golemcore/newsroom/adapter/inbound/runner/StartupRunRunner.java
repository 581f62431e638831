package me.golemcore.newsroom.adapter.inbound.runner;

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

import me.golemcore.newsroom.domain.exception.RunAbortedException;
import me.golemcore.newsroom.domain.model.RunState;
import me.golemcore.newsroom.domain.workflow.WorkflowEngine;
import me.golemcore.newsroom.infrastructure.config.NewsroomProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Performs a single run with the configured request once the application has
 * started. Enabled with {@code newsroom.run-on-startup=true}.
 */
@Component
@ConditionalOnProperty(prefix = "newsroom", name = "run-on-startup", havingValue = "true")
@RequiredArgsConstructor
@Slf4j
public class StartupRunRunner implements ApplicationRunner {

    private final WorkflowEngine workflowEngine;
    private final NewsroomProperties properties;

    @Override
    public void run(ApplicationArguments args) {
        log.info("[Runner] Starting run: {}", properties.getRequest());
        try {
            RunState state = workflowEngine.start(properties.getRequest());
            log.info("[Runner] Run {} finished with status {}", state.getRunId(), state.getStatus());
            if (state.hasPublication()) {
                log.info("[Runner] Published: {}", state.getPublication().getArticleText());
            }
        } catch (RunAbortedException e) {
            log.error("[Runner] Run {} aborted with {}: {}", e.getRunId(), e.getKind(), e.getMessage());
        }
    }
}
