package me.golemcore.newsroom.adapter.outbound.capability;

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

import me.golemcore.newsroom.domain.model.ProviderConfig;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * MCP client for a capability provider running as a local child process,
 * speaking newline-delimited JSON-RPC over stdin/stdout.
 *
 * <p>
 * The client:
 * <ul>
 * <li>Writes JSON-RPC requests to process stdin
 * <li>Reads JSON-RPC responses from process stdout (in a reader thread)
 * <li>Drains stderr to DEBUG log (in a separate thread)
 * </ul>
 *
 * <p>
 * Not a Spring bean. Created per provider by {@link CapabilityClientFactory}.
 */
public class StdioCapabilityClient extends AbstractMcpClient {

    private static final Logger log = LoggerFactory.getLogger(StdioCapabilityClient.class);

    private Process process;
    private BufferedWriter writer;
    private Thread readerThread;
    private Thread stderrThread;

    private volatile boolean running;

    public StdioCapabilityClient(ProviderConfig config, ObjectMapper objectMapper) {
        super(config, objectMapper);
    }

    @Override
    protected void openTransport() throws IOException {
        log.info("[MCP:{}] Starting server: {} {}", getProviderName(), config.getCommand(), config.getArgs());

        ProcessBuilder pb = new ProcessBuilder(buildCommand());
        pb.redirectErrorStream(false);

        Map<String, String> env = pb.environment();
        if (config.getEnv() != null) {
            env.putAll(config.getEnv());
        }

        process = pb.start();
        attach(process.getInputStream(), process.getOutputStream());

        stderrThread = new Thread(this::stderrDrain, "mcp-stderr-" + getProviderName());
        stderrThread.setDaemon(true);
        stderrThread.start();
    }

    /**
     * Binds the client to the given streams and starts the reader thread.
     */
    void attach(InputStream stdout, OutputStream stdin) {
        writer = new BufferedWriter(new OutputStreamWriter(stdin, StandardCharsets.UTF_8));
        running = true;

        readerThread = new Thread(() -> readLoop(stdout), "mcp-reader-" + getProviderName());
        readerThread.setDaemon(true);
        readerThread.start();
    }

    List<String> buildCommand() {
        if (config.getArgs() == null || config.getArgs().isEmpty()) {
            return List.of("/bin/sh", "-c", config.getCommand());
        }
        List<String> command = new ArrayList<>();
        command.add(config.getCommand());
        command.addAll(config.getArgs());
        return command;
    }

    @Override
    protected void transmit(Integer requestId, String json) throws IOException {
        BufferedWriter out = writer;
        if (out == null || !running) {
            throw new IOException("MCP process not running");
        }
        synchronized (out) {
            out.write(json);
            out.newLine();
            out.flush();
        }
    }

    private void readLoop(InputStream stdout) {
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(stdout, StandardCharsets.UTF_8))) {
            String line;
            while (running && (line = reader.readLine()) != null) {
                line = line.trim();
                if (line.isEmpty()) {
                    continue;
                }
                log.debug("[MCP:{}] ← {}", getProviderName(), line);

                try {
                    JsonNode message = objectMapper.readTree(line);
                    handleMessage(message);
                } catch (JsonProcessingException e) {
                    log.warn("[MCP:{}] Failed to parse response: {}", getProviderName(), e.getMessage());
                }
            }
        } catch (IOException e) {
            if (running) {
                log.warn("[MCP:{}] Reader thread error: {}", getProviderName(), e.getMessage());
            }
        } finally {
            running = false;
            failAllPending("MCP process closed");
        }
    }

    private void stderrDrain() {
        Process p = this.process;
        if (p == null) {
            return;
        }
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(p.getErrorStream(), StandardCharsets.UTF_8))) {
            String line;
            while (running && (line = reader.readLine()) != null) {
                log.debug("[MCP:{}] stderr: {}", getProviderName(), line);
            }
        } catch (IOException e) {
            if (running) {
                log.debug("[MCP:{}] Stderr drain ended: {}", getProviderName(), e.getMessage());
            }
        }
    }

    @Override
    public boolean isRunning() {
        if (!running) {
            return false;
        }
        return process != null ? process.isAlive() : readerThread != null && readerThread.isAlive();
    }

    @Override
    protected void closeTransport() {
        running = false;

        if (writer != null) {
            try {
                writer.close();
            } catch (IOException e) {
                log.debug("[MCP:{}] Error closing writer: {}", getProviderName(), e.getMessage());
            }
        }

        if (process != null && process.isAlive()) {
            process.destroy();
            try {
                if (!process.waitFor(5, TimeUnit.SECONDS)) {
                    process.destroyForcibly();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                process.destroyForcibly();
            }
        }
    }
}
