package me.golemcore.newsroom.domain.model;

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

import lombok.Builder;
import lombok.Data;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Resolved configuration of one capability provider: how to reach it and how
 * long to wait for it.
 */
@Data
@Builder
public class ProviderConfig {

    private String name;
    private TransportType transport;

    // stdio
    private String command;

    @Builder.Default
    private List<String> args = new ArrayList<>();

    @Builder.Default
    private Map<String, String> env = new HashMap<>();

    // http
    private String url;
    private String apiKey;

    @Builder.Default
    private Map<String, String> headers = new HashMap<>();

    @Builder.Default
    private int startupTimeoutSeconds = 30;

    @Builder.Default
    private int requestTimeoutSeconds = 60;
}
