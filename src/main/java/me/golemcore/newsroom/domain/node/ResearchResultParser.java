package me.golemcore.newsroom.domain.node;

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

import me.golemcore.newsroom.domain.model.ResearchFinding;
import me.golemcore.newsroom.domain.model.ToolResult;
import me.golemcore.newsroom.infrastructure.config.NewsroomProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Turns raw search tool output into {@link ResearchFinding}s.
 *
 * <p>
 * Accepts either JSON (an array of results or an object with a
 * {@code results} array, each item carrying url/title/text) or the plain-text
 * listing printed by search SDKs, where results are blocks of
 * {@code Title:}/{@code URL:}/{@code Text:} lines separated by blank lines.
 * Failed tool results are skipped.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ResearchResultParser {

    private static final String NO_OUTPUT = "(no output)";
    private static final Pattern METADATA_LINE = Pattern.compile("^[A-Z][A-Za-z ]{0,20}:.*");

    private final ObjectMapper objectMapper;
    private final NewsroomProperties properties;

    public List<ResearchFinding> parse(String query, Map<String, ToolResult> results) {
        List<ResearchFinding> findings = new ArrayList<>();
        for (Map.Entry<String, ToolResult> entry : results.entrySet()) {
            ToolResult result = entry.getValue();
            if (result == null || !result.isSuccess()) {
                log.debug("[Research] Skipping failed result {}: {}", entry.getKey(),
                        result != null ? result.getError() : "missing");
                continue;
            }
            String output = result.getOutput();
            if (output == null || output.isBlank() || NO_OUTPUT.equals(output.trim())) {
                continue;
            }
            findings.addAll(parseOutput(query, entry.getKey(), output.trim()));
        }
        return findings;
    }

    private List<ResearchFinding> parseOutput(String query, String callId, String output) {
        if (output.startsWith("{") || output.startsWith("[")) {
            try {
                return parseJson(query, callId, objectMapper.readTree(output));
            } catch (JsonProcessingException e) {
                log.debug("[Research] Output of {} is not JSON, parsing as text: {}", callId, e.getMessage());
            }
        }
        return parseText(query, callId, output);
    }

    private List<ResearchFinding> parseJson(String query, String callId, JsonNode root) {
        JsonNode items = root.isArray() ? root : root.path("results");
        List<ResearchFinding> findings = new ArrayList<>();
        if (!items.isArray()) {
            String text = firstText(root, "text", "summary", "snippet", "content");
            if (text != null) {
                findings.add(finding(query, firstText(root, "url", "id"), firstText(root, "title"), text, callId));
            }
            return findings;
        }
        for (JsonNode item : items) {
            String text = firstText(item, "text", "summary", "snippet", "content", "highlights");
            String title = firstText(item, "title");
            if (text == null && title == null) {
                continue;
            }
            findings.add(finding(query, firstText(item, "url", "id"), title, text, callId));
        }
        return findings;
    }

    private List<ResearchFinding> parseText(String query, String callId, String output) {
        List<ResearchFinding> findings = new ArrayList<>();
        for (String block : output.split("\\n\\s*\\n")) {
            String title = null;
            String url = null;
            StringBuilder text = new StringBuilder();
            for (String rawLine : block.split("\\n")) {
                String line = rawLine.trim();
                if (line.startsWith("Title:")) {
                    title = line.substring("Title:".length()).trim();
                } else if (line.startsWith("URL:")) {
                    url = line.substring("URL:".length()).trim();
                } else if (line.startsWith("Text:")) {
                    text.append(line.substring("Text:".length()).trim());
                } else if (!line.isEmpty()) {
                    if (text.isEmpty() && METADATA_LINE.matcher(line).matches()) {
                        continue; // Published Date:, Author:, Score: ...
                    }
                    if (!text.isEmpty()) {
                        text.append(' ');
                    }
                    text.append(line);
                }
            }
            String snippet = text.toString().trim();
            if (title == null && snippet.isEmpty()) {
                continue;
            }
            findings.add(finding(query, url, title, snippet.isEmpty() ? null : snippet, callId));
        }
        return findings;
    }

    private ResearchFinding finding(String query, String source, String title, String text, String callId) {
        return ResearchFinding.builder()
                .query(query)
                .source(source != null ? source : callId)
                .title(title)
                .snippet(NodeSupport.truncate(text, properties.getResearch().getMaxSnippetChars()))
                .build();
    }

    private static String firstText(JsonNode node, String... fields) {
        for (String field : fields) {
            JsonNode value = node.get(field);
            if (value == null || value.isNull()) {
                continue;
            }
            if (value.isArray()) {
                List<String> parts = new ArrayList<>();
                value.forEach(part -> parts.add(part.asText()));
                if (!parts.isEmpty()) {
                    return String.join(" ", parts);
                }
            } else if (!value.asText().isBlank()) {
                return value.asText();
            }
        }
        return null;
    }
}
