package me.golemcore.newsroom.testsupport.workflow;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.newsroom.adapter.outbound.store.InMemoryEpisodicStore;
import me.golemcore.newsroom.domain.model.Checkpoint;
import me.golemcore.newsroom.domain.model.EpisodicRecord;
import me.golemcore.newsroom.domain.model.ToolDefinition;
import me.golemcore.newsroom.domain.model.ToolFailureKind;
import me.golemcore.newsroom.domain.model.ToolResult;
import me.golemcore.newsroom.domain.node.PublisherNode;
import me.golemcore.newsroom.domain.node.QualityNode;
import me.golemcore.newsroom.domain.node.ResearchResultParser;
import me.golemcore.newsroom.domain.node.ResearcherNode;
import me.golemcore.newsroom.domain.node.SupervisorNode;
import me.golemcore.newsroom.domain.node.ToolDispatchNode;
import me.golemcore.newsroom.domain.node.WriterNode;
import me.golemcore.newsroom.domain.workflow.RunCancellationRegistry;
import me.golemcore.newsroom.domain.workflow.StateSnapshots;
import me.golemcore.newsroom.domain.workflow.TransitionTable;
import me.golemcore.newsroom.domain.workflow.WorkflowEngine;
import me.golemcore.newsroom.infrastructure.config.NewsroomConfiguration;
import me.golemcore.newsroom.infrastructure.config.NewsroomProperties;
import me.golemcore.newsroom.port.outbound.CapabilityPort;
import me.golemcore.newsroom.port.outbound.CheckpointLog;
import me.golemcore.newsroom.port.outbound.EmbeddingPort;
import me.golemcore.newsroom.port.outbound.InferencePort;
import me.golemcore.newsroom.port.outbound.PublicationJournal;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Wires the real workflow engine and nodes to scripted model, embedding and
 * capability fakes plus an in-memory store.
 */
public final class NewsroomHarness implements AutoCloseable {

    public static final Instant NOW = Instant.parse("2026-03-02T09:30:00Z");
    public static final String SEARCH_TOOL = "search_and_content";
    public static final String PUBLISH_TOOL = "LINKEDIN_CREATE_LINKED_IN_POST";

    private final NewsroomProperties properties = new NewsroomProperties();
    private final ObjectMapper objectMapper = NewsroomConfiguration.objectMapper();
    private final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
    private final ExecutorService executor = Executors.newFixedThreadPool(2);
    private final RunCancellationRegistry cancellations = new RunCancellationRegistry();
    private final InMemoryEpisodicStore store = new InMemoryEpisodicStore(objectMapper);
    private final FlakyJournal journal = new FlakyJournal(store);

    private final ScriptedInference inference = new ScriptedInference();
    private final MappedEmbedding embedding = new MappedEmbedding();
    private final ScriptedCapabilities capabilities = new ScriptedCapabilities();

    private WorkflowEngine engine;

    public NewsroomHarness() {
        properties.getWorkflow().setRetryInitialBackoffMs(0);
        properties.getPublisher().setAuthor("urn:li:person:test");
    }

    public WorkflowEngine engine() {
        if (engine == null) {
            ResearchResultParser parser = new ResearchResultParser(objectMapper, properties);
            engine = new WorkflowEngine(
                    List.of(
                            new SupervisorNode(inference, properties),
                            new ResearcherNode(inference, parser, properties, clock),
                            new WriterNode(inference, properties, clock),
                            new QualityNode(embedding, store, properties, clock),
                            new PublisherNode(properties, clock),
                            new ToolDispatchNode(capabilities, executor, cancellations, properties, clock)),
                    new TransitionTable(),
                    journal,
                    journal,
                    new StateSnapshots(objectMapper),
                    cancellations,
                    properties,
                    clock);
        }
        return engine;
    }

    public NewsroomProperties properties() {
        return properties;
    }

    public InMemoryEpisodicStore store() {
        return store;
    }

    public FlakyJournal journal() {
        return journal;
    }

    public ScriptedInference inference() {
        return inference;
    }

    public MappedEmbedding embedding() {
        return embedding;
    }

    public ScriptedCapabilities capabilities() {
        return capabilities;
    }

    public Clock clock() {
        return clock;
    }

    public void pastArticle(String runId, String text, float[] vector) {
        store.recordArticle(new EpisodicRecord(runId, text, vector, NOW.minusSeconds(86_400)));
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }

    /**
     * Answers query prompts with {@code queries} and writing prompts with
     * {@code drafts}; the last entry repeats once a script runs out. Advisor
     * prompts get {@code advisorAnswer}.
     */
    public static final class ScriptedInference implements InferencePort {

        private final Deque<String> queries = new ArrayDeque<>(List.of("AI in quant trading"));
        private final Deque<String> drafts = new ArrayDeque<>(List.of("Quant funds bet on AI. #Quant #AI"));
        private final AtomicInteger writerCalls = new AtomicInteger();
        private final AtomicInteger writerFailures = new AtomicInteger();
        private final List<String> writerContexts = new ArrayList<>();
        private String advisorAnswer = "WRITE";

        public void queries(String... values) {
            queries.clear();
            queries.addAll(List.of(values));
        }

        public void drafts(String... values) {
            drafts.clear();
            drafts.addAll(List.of(values));
        }

        public void failNextWrites(int count) {
            writerFailures.set(count);
        }

        public void advisorAnswer(String answer) {
            this.advisorAnswer = answer;
        }

        public int writerCalls() {
            return writerCalls.get();
        }

        public synchronized List<String> writerContexts() {
            return new ArrayList<>(writerContexts);
        }

        @Override
        public synchronized CompletableFuture<String> complete(String systemPrompt, String context) {
            if (systemPrompt.contains("expert researcher")) {
                return CompletableFuture.completedFuture(next(queries));
            }
            if (systemPrompt.contains("expert writer")) {
                writerCalls.incrementAndGet();
                writerContexts.add(context);
                if (writerFailures.get() > 0) {
                    writerFailures.decrementAndGet();
                    return CompletableFuture.failedFuture(new IOException("model overloaded"));
                }
                return CompletableFuture.completedFuture(next(drafts));
            }
            return CompletableFuture.completedFuture(advisorAnswer);
        }

        private static String next(Deque<String> script) {
            return script.size() > 1 ? script.poll() : script.peek();
        }

        @Override
        public String getModel() {
            return "scripted";
        }

        @Override
        public boolean isAvailable() {
            return true;
        }
    }

    /**
     * Returns registered vectors per text, {@code (0, 0, 1)} otherwise.
     */
    public static final class MappedEmbedding implements EmbeddingPort {

        private final Map<String, float[]> vectors = new HashMap<>();

        public void register(String text, float[] vector) {
            vectors.put(text, vector);
        }

        @Override
        public CompletableFuture<float[]> embed(String text) {
            return CompletableFuture.completedFuture(vectors.getOrDefault(text, new float[] { 0f, 0f, 1f }));
        }

        @Override
        public String getModel() {
            return "mapped";
        }

        @Override
        public boolean isAvailable() {
            return true;
        }
    }

    /**
     * Search returns one Exa-style text block per query; publish returns a
     * share URN and counts invocations.
     */
    public static final class ScriptedCapabilities implements CapabilityPort {

        private final AtomicInteger searches = new AtomicInteger();
        private final AtomicInteger publishes = new AtomicInteger();
        private volatile boolean searchUnknown;
        private volatile boolean emptySearch;
        private volatile boolean publishFails;
        private volatile Consumer<String> onInvoke = name -> {
        };

        public void searchUnknown() {
            this.searchUnknown = true;
        }

        public void emptySearch() {
            this.emptySearch = true;
        }

        public void publishFails() {
            this.publishFails = true;
        }

        public void onInvoke(Consumer<String> hook) {
            this.onInvoke = hook;
        }

        public int searches() {
            return searches.get();
        }

        public int publishes() {
            return publishes.get();
        }

        @Override
        public CompletableFuture<ToolResult> invoke(String toolName, Map<String, Object> arguments) {
            onInvoke.accept(toolName);
            if (SEARCH_TOOL.equals(toolName)) {
                if (searchUnknown) {
                    return CompletableFuture.completedFuture(ToolResult.failure(ToolFailureKind.UNKNOWN_TOOL,
                            "No capability provider exposes tool: " + toolName));
                }
                searches.incrementAndGet();
                if (emptySearch) {
                    return CompletableFuture.completedFuture(ToolResult.success("(no output)"));
                }
                String query = String.valueOf(arguments.get("query"));
                return CompletableFuture.completedFuture(ToolResult.success("""
                        Title: %s headline
                        URL: https://news.example.com/%d
                        Published Date: 2026-03-01
                        Text: Funds report record inflows tied to %s.
                        """.formatted(query, searches.get(), query)));
            }
            if (PUBLISH_TOOL.equals(toolName)) {
                int count = publishes.incrementAndGet();
                if (publishFails) {
                    return CompletableFuture.completedFuture(ToolResult.failure(ToolFailureKind.PROVIDER_ERROR,
                            "LinkedIn rejected the post"));
                }
                return CompletableFuture.completedFuture(ToolResult.success("urn:li:share:" + count));
            }
            return CompletableFuture.completedFuture(ToolResult.failure(ToolFailureKind.UNKNOWN_TOOL,
                    "No capability provider exposes tool: " + toolName));
        }

        @Override
        public List<ToolDefinition> listTools() {
            return List.of(
                    ToolDefinition.builder().name(SEARCH_TOOL).description("Search news").build(),
                    ToolDefinition.builder().name(PUBLISH_TOOL).description("Create a post").build());
        }
    }

    /**
     * Store wrapper that can fail the next publication commit.
     */
    public static final class FlakyJournal implements CheckpointLog, PublicationJournal {

        private final InMemoryEpisodicStore delegate;
        private final AtomicInteger commitFailures = new AtomicInteger();

        FlakyJournal(InMemoryEpisodicStore delegate) {
            this.delegate = delegate;
        }

        public void failNextCommits(int count) {
            commitFailures.set(count);
        }

        @Override
        public void append(Checkpoint checkpoint) {
            delegate.append(checkpoint);
        }

        @Override
        public Optional<Checkpoint> loadLatest(String runId) {
            return delegate.loadLatest(runId);
        }

        @Override
        public List<Checkpoint> list(String runId) {
            return delegate.list(runId);
        }

        @Override
        public void commit(Checkpoint finalCheckpoint, EpisodicRecord record) {
            if (commitFailures.getAndUpdate(n -> Math.max(0, n - 1)) > 0) {
                throw new IllegalStateException("disk full");
            }
            delegate.commit(finalCheckpoint, record);
        }

        @Override
        public boolean hasRecord(String runId) {
            return delegate.hasRecord(runId);
        }
    }
}
