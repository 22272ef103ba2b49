package com.gentoro.agentflow;

import com.gentoro.agentflow.agent.Agent;
import com.gentoro.agentflow.agent.AgentExecutor;
import com.gentoro.agentflow.config.ConfigurationProvider;
import com.gentoro.agentflow.config.EngineSettings;
import com.gentoro.agentflow.embedding.EmbeddingClient;
import com.gentoro.agentflow.embedding.EmbeddingClientFactory;
import com.gentoro.agentflow.exception.ExceptionUtil;
import com.gentoro.agentflow.knowledge.Chunker;
import com.gentoro.agentflow.knowledge.DocumentLoader;
import com.gentoro.agentflow.knowledge.IngestionPipeline;
import com.gentoro.agentflow.knowledge.KnowledgeLoadReport;
import com.gentoro.agentflow.logging.LoggingService;
import com.gentoro.agentflow.memory.MemoryStore;
import com.gentoro.agentflow.model.LlmClient;
import com.gentoro.agentflow.model.LlmClientFactory;
import com.gentoro.agentflow.orchestrator.Orchestrator;
import com.gentoro.agentflow.orchestrator.RunResult;
import com.gentoro.agentflow.orchestrator.progress.LoggingProgressSink;
import com.gentoro.agentflow.orchestrator.progress.ProgressSink;
import com.gentoro.agentflow.prompt.ClasspathPromptRepository;
import com.gentoro.agentflow.retrieval.ContextAssembler;
import com.gentoro.agentflow.retrieval.RetrievalEngine;
import com.gentoro.agentflow.task.ProcessMode;
import com.gentoro.agentflow.task.Task;
import com.gentoro.agentflow.tool.ToolRegistry;
import com.gentoro.agentflow.utility.TimeBoundedCall;
import com.gentoro.agentflow.vectorstore.CollectionConfig;
import com.gentoro.agentflow.vectorstore.VectorStoreAdapter;
import com.gentoro.agentflow.vectorstore.VectorStoreProviders;
import com.gentoro.agentflow.workflow.Workflow;
import com.gentoro.agentflow.workflow.WorkflowLoader;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import org.apache.commons.configuration2.Configuration;

/**
 * The engine: owns the collaborators (model, embedding, vector store), the knowledge pipeline and
 * the orchestrator, and shares them between runs.
 *
 * <p>Before a run, the knowledge sources of every participating agent are ingested into the
 * agent's collection. Unreadable sources are skipped; an embedding failure aborts the run before
 * any task starts.
 */
public class AgentFlow implements AutoCloseable {
  private static final org.slf4j.Logger log = LoggingService.getLogger(AgentFlow.class);

  private static final String KNOWLEDGE_STAGE = "knowledge";

  private final EngineSettings settings;
  private final ExecutorService blockingCalls;
  private final LlmClient llmClient;
  private final EmbeddingClient embeddingClient;
  private final VectorStoreAdapter vectorStore;
  private final IngestionPipeline ingestion;
  private final RetrievalEngine retrieval;
  private final MemoryStore memory;
  private final ToolRegistry tools = new ToolRegistry();
  private final Orchestrator orchestrator;
  private final ProgressSink progress;
  private final AtomicBoolean closed = new AtomicBoolean(false);

  /** Build the engine from the application configuration at {@code configLocation}. */
  public static AgentFlow create(String configLocation) {
    Configuration configuration = new ConfigurationProvider(configLocation).config();
    LoggingService.applyConfiguration(configuration);
    EngineSettings settings = EngineSettings.from(configuration);
    ExecutorService blockingCalls = newBlockingCallPool();
    try {
      return new AgentFlow(
          settings,
          blockingCalls,
          LlmClientFactory.create(configuration, settings, blockingCalls),
          EmbeddingClientFactory.create(configuration, settings, blockingCalls),
          VectorStoreProviders.load());
    } catch (RuntimeException e) {
      blockingCalls.shutdownNow();
      throw e;
    }
  }

  /**
   * Wire the engine around already built collaborators. The clients are used as given; wrap them
   * with their retry and timeout decorators first when needed.
   */
  public AgentFlow(
      EngineSettings settings,
      ExecutorService blockingCalls,
      LlmClient llmClient,
      EmbeddingClient embeddingClient,
      VectorStoreProviders providers) {
    this.settings = settings;
    this.blockingCalls = blockingCalls;
    this.llmClient = llmClient;
    this.embeddingClient = embeddingClient;
    this.vectorStore = new VectorStoreAdapter(providers);
    this.ingestion =
        new IngestionPipeline(
            new DocumentLoader(),
            new Chunker(settings.chunkMaxTokens(), settings.chunkOverlapTokens()),
            embeddingClient,
            vectorStore,
            settings.embeddingBatchSize());
    this.retrieval = new RetrievalEngine(embeddingClient, vectorStore);
    this.memory = new MemoryStore();
    this.progress = new LoggingProgressSink(log, 1000, 1);
    AgentExecutor executor =
        new AgentExecutor(
            llmClient,
            retrieval,
            new ContextAssembler(settings.contextMaxTokens()),
            memory,
            new ClasspathPromptRepository("prompts").get("agent"),
            settings,
            new TimeBoundedCall("tool", settings.toolTimeout(), blockingCalls));
    this.orchestrator = new Orchestrator(executor, memory, settings, progress);
  }

  /** Thread pool for model, embedding and tool calls run under a time limit. */
  public static ExecutorService newBlockingCallPool() {
    AtomicInteger counter = new AtomicInteger();
    return Executors.newCachedThreadPool(
        r -> {
          Thread t = new Thread(r, "agentflow-io-" + counter.incrementAndGet());
          t.setDaemon(true);
          return t;
        });
  }

  public WorkflowLoader workflowLoader() {
    return new WorkflowLoader(
        tools, vectorStore.providers().ids(), retrieval, settings.retrievalTopK());
  }

  public RunResult run(Workflow workflow) {
    return run(workflow.agents(), workflow.tasks(), workflow.process(), workflow.userId());
  }

  /**
   * Validate the tasks, load the agents' knowledge, then run the tasks. An invalid task graph is
   * rejected before anything is embedded or stored.
   */
  public RunResult run(List<Agent> agents, List<Task> tasks, ProcessMode mode, String userId) {
    orchestrator.validate(agents, tasks, mode);
    loadKnowledge(agents);
    return orchestrator.run(agents, tasks, mode, userId);
  }

  /**
   * Ingest the knowledge sources of the given agents, once per collection and source.
   *
   * @return load report per collection
   * @throws com.gentoro.agentflow.exception.EmbeddingServiceException when the embedding service
   *     keeps failing
   */
  public Map<CollectionConfig, KnowledgeLoadReport> loadKnowledge(List<Agent> agents) {
    Map<CollectionConfig, Set<Path>> sources = new LinkedHashMap<>();
    for (Agent agent : agents) {
      if (agent.knowledgeSources().isEmpty()) continue;
      CollectionConfig scope = agent.knowledgeScope().orElseThrow();
      sources.computeIfAbsent(scope, k -> new LinkedHashSet<>()).addAll(agent.knowledgeSources());
    }
    Map<CollectionConfig, KnowledgeLoadReport> reports = new LinkedHashMap<>();
    if (sources.isEmpty()) return reports;

    long total = sources.values().stream().mapToLong(Set::size).sum();
    progress.beginStage(KNOWLEDGE_STAGE, "Loading knowledge", total);
    long done = 0;
    try {
      for (Map.Entry<CollectionConfig, Set<Path>> e : sources.entrySet()) {
        KnowledgeLoadReport report = ingestion.ingestAll(List.copyOf(e.getValue()), e.getKey());
        reports.put(e.getKey(), report);
        done += e.getValue().size();
        progress.step(
            KNOWLEDGE_STAGE,
            done,
            "collection " + e.getKey().collectionName(),
            Map.of("chunks", report.totalChunks(), "failures", report.failures().size()));
        if (report.hasFailures()) {
          log.warn(
              "Collection {}: {} knowledge sources could not be read: {}",
              e.getKey().collectionName(),
              report.failures().size(),
              report.failures().keySet());
        }
      }
    } catch (RuntimeException e) {
      progress.endStageError(KNOWLEDGE_STAGE, ExceptionUtil.summarize(e), Map.of());
      throw e;
    }
    progress.endStageOk(KNOWLEDGE_STAGE, Map.of("collections", reports.size()));
    return reports;
  }

  public EngineSettings settings() {
    return settings;
  }

  public ToolRegistry tools() {
    return tools;
  }

  public LlmClient llmClient() {
    return llmClient;
  }

  public EmbeddingClient embeddingClient() {
    return embeddingClient;
  }

  public VectorStoreAdapter vectorStore() {
    return vectorStore;
  }

  public IngestionPipeline ingestion() {
    return ingestion;
  }

  public RetrievalEngine retrieval() {
    return retrieval;
  }

  public MemoryStore memory() {
    return memory;
  }

  public Orchestrator orchestrator() {
    return orchestrator;
  }

  /** Stop the worker threads. Safe to call more than once. */
  @Override
  public void close() {
    if (closed.compareAndSet(false, true)) {
      blockingCalls.shutdownNow();
      log.debug("AgentFlow closed");
    }
  }
}
