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

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Locale;

/**
 * A single entry of the run history. Agent nodes append assistant messages, the
 * tool dispatch node appends tool messages carrying the originating call id.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Message {

    private String role; // user, assistant, tool
    private String author; // node that produced the entry
    private String content;
    private String toolCallId; // For tool response messages
    private String toolName; // Tool name for tool response messages
    private Instant timestamp;

    public static Message user(String content, Instant timestamp) {
        return Message.builder()
                .role("user")
                .author("user")
                .content(content)
                .timestamp(timestamp)
                .build();
    }

    public static Message assistant(NodeName author, String content, Instant timestamp) {
        return Message.builder()
                .role("assistant")
                .author(author.name().toLowerCase(Locale.ROOT))
                .content(content)
                .timestamp(timestamp)
                .build();
    }

    public static Message tool(ToolCall call, String content, Instant timestamp) {
        return Message.builder()
                .role("tool")
                .author("tool_dispatch")
                .content(content)
                .toolCallId(call.getId())
                .toolName(call.getName())
                .timestamp(timestamp)
                .build();
    }

    /**
     * Checks if this is a tool result message.
     */
    @JsonIgnore
    public boolean isToolMessage() {
        return "tool".equals(role);
    }
}
