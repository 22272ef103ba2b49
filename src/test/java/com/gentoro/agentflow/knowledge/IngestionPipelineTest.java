package com.gentoro.agentflow.knowledge;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.agentflow.exception.EmbeddingServiceException;
import com.gentoro.agentflow.testing.FakeEmbeddingClient;
import com.gentoro.agentflow.vectorstore.CollectionConfig;
import com.gentoro.agentflow.vectorstore.RetrievalResult;
import com.gentoro.agentflow.vectorstore.VectorStoreAdapter;
import com.gentoro.agentflow.vectorstore.VectorStoreProviders;
import com.gentoro.agentflow.vectorstore.providers.InMemoryVectorStoreProvider;
import com.gentoro.agentflow.vectorstore.providers.LocalVectorStoreProvider;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class IngestionPipelineTest {

  private static final String THREE_SECTIONS =
      """
      # Product X

      Product X is a compact espresso machine for small offices.

      ## Pricing

      Product X costs 499 dollars and ships with two years of warranty.

      ## Support

      Support tickets are answered within one business day.
      """;

  @TempDir Path tmp;

  private VectorStoreAdapter adapter;
  private CollectionConfig kb1;

  @BeforeEach
  void setUp() {
    adapter =
        new VectorStoreAdapter(
            new VectorStoreProviders(
                List.of(new InMemoryVectorStoreProvider(), new LocalVectorStoreProvider())));
    kb1 = CollectionConfig.of("memory", "kb1", tmp);
  }

  private IngestionPipeline pipeline(FakeEmbeddingClient embedding, int batchSize) {
    return new IngestionPipeline(
        new DocumentLoader(), new Chunker(256, 32), embedding, adapter, batchSize);
  }

  @Test
  @DisplayName("Ingesting the same document twice stores no duplicate vectors")
  void idempotent() {
    FakeEmbeddingClient embedding = new FakeEmbeddingClient();
    IngestionPipeline pipeline = pipeline(embedding, 32);
    Document doc = Document.of("x.md", MediaType.MARKDOWN, THREE_SECTIONS);

    IngestReport first = pipeline.ingest(doc, kb1);
    assertEquals(3, first.totalChunks());
    assertEquals(3, first.embeddedChunks());
    assertEquals(0, first.skippedChunks());
    assertEquals(3, adapter.size(kb1));
    int callsAfterFirst = embedding.calls();

    IngestReport second = pipeline.ingest(doc, kb1);
    assertEquals(first.totalChunks(), second.totalChunks());
    assertEquals(0, second.embeddedChunks());
    assertEquals(3, second.skippedChunks());
    assertEquals(3, adapter.size(kb1));
    assertEquals(callsAfterFirst, embedding.calls(), "no embedding call for known chunks");
  }

  @Test
  @DisplayName("Vectors carry provenance metadata")
  void storesMetadata() {
    IngestionPipeline pipeline = pipeline(new FakeEmbeddingClient(), 32);
    pipeline.ingest(Document.of("docs/x.md", MediaType.MARKDOWN, THREE_SECTIONS), kb1);

    RetrievalResult result =
        adapter.query(kb1, FakeEmbeddingClient.vector("Pricing Product X costs dollars"), 1);
    assertEquals(1, result.size());
    var top = result.items().get(0);
    assertEquals("Product X > Pricing", top.chunk().sectionPath());
    assertEquals("docs/x.md", top.source());
    assertEquals("1", top.metadata().get(VectorStoreAdapter.META_SEQUENCE));
    assertEquals("fake-embedding-v1", top.metadata().get(VectorStoreAdapter.META_MODEL));
    assertEquals(
        top.chunk().span().start() + "-" + top.chunk().span().end(),
        top.metadata().get(VectorStoreAdapter.META_SPAN));
  }

  @Test
  @DisplayName("Chunks are embedded in batches of the configured size")
  void batches() {
    FakeEmbeddingClient embedding = new FakeEmbeddingClient();
    IngestionPipeline pipeline = pipeline(embedding, 2);
    pipeline.ingest(Document.of("x.md", MediaType.MARKDOWN, THREE_SECTIONS), kb1);
    assertEquals(2, embedding.calls());
    assertEquals(3, embedding.embeddedTexts());
  }

  @Test
  @DisplayName("Vectors from another embedding model are re-embedded with the active one")
  void reembedsStaleVectors() {
    Document doc = Document.of("x.md", MediaType.MARKDOWN, THREE_SECTIONS);
    pipeline(new FakeEmbeddingClient("model-a"), 32).ingest(doc, kb1);
    assertEquals(3, adapter.fingerprints(kb1, "model-a").size());

    FakeEmbeddingClient modelB = new FakeEmbeddingClient("model-b");
    IngestReport report = pipeline(modelB, 32).ingest(doc, kb1);

    assertEquals(3, report.reembeddedStale());
    assertEquals(0, report.embeddedChunks());
    assertEquals(3, adapter.size(kb1));
    assertTrue(adapter.fingerprints(kb1, "model-a").isEmpty());
    assertEquals(3, adapter.fingerprints(kb1, "model-b").size());
    assertEquals(3, modelB.embeddedTexts());
  }

  @Test
  @DisplayName("A failed re-embed keeps the vectors of the previous model")
  void failedReembedKeepsVectors() {
    Document product = Document.of("x.md", MediaType.MARKDOWN, THREE_SECTIONS);
    Document faq =
        Document.of("faq.txt", MediaType.TEXT, "Orders placed before noon ship the same day.");
    IngestionPipeline v1 = pipeline(new FakeEmbeddingClient("model-a"), 32);
    v1.ingest(product, kb1);
    v1.ingest(faq, kb1);
    assertEquals(4, adapter.size(kb1));

    FakeEmbeddingClient modelB =
        new FakeEmbeddingClient("model-b")
            .failNext(1, new EmbeddingServiceException("service down"));
    IngestionPipeline v2 = pipeline(modelB, 32);

    assertThrows(EmbeddingServiceException.class, () -> v2.ingest(product, kb1));
    assertEquals(4, adapter.size(kb1));
    assertEquals(4, adapter.fingerprints(kb1, "model-a").size());
    assertTrue(adapter.fingerprints(kb1, "model-b").isEmpty());
    assertEquals(
        1, adapter.query(kb1, FakeEmbeddingClient.vector("orders ship noon"), 1).size());

    IngestReport retry = v2.ingest(product, kb1);
    assertEquals(4, retry.reembeddedStale());
    assertEquals(4, adapter.size(kb1));
    assertEquals(4, adapter.fingerprints(kb1, "model-b").size());
  }

  @Test
  @DisplayName("An embedding failure propagates and stores nothing of the document")
  void embeddingFailurePropagates() {
    FakeEmbeddingClient embedding =
        new FakeEmbeddingClient().failNext(1, new EmbeddingServiceException("service down"));
    IngestionPipeline pipeline = pipeline(embedding, 2);
    Document doc = Document.of("x.md", MediaType.MARKDOWN, THREE_SECTIONS);

    assertThrows(EmbeddingServiceException.class, () -> pipeline.ingest(doc, kb1));
    assertEquals(0, adapter.size(kb1));

    // a later attempt succeeds
    assertEquals(3, pipeline.ingest(doc, kb1).embeddedChunks());
  }

  @Test
  @DisplayName("ingestAll skips unreadable sources and reports why")
  void ingestAllReportsFailures() throws Exception {
    Path good = Files.writeString(tmp.resolve("good.md"), THREE_SECTIONS);
    Path bad = Files.writeString(tmp.resolve("bad.json"), "{ not json");
    Path missing = tmp.resolve("missing.txt");

    KnowledgeLoadReport report =
        pipeline(new FakeEmbeddingClient(), 32).ingestAll(List.of(good, bad, missing), kb1);

    assertEquals(1, report.ingested().size());
    assertEquals(3, report.totalChunks());
    assertTrue(report.hasFailures());
    assertEquals(2, report.failures().size());
    assertTrue(report.failures().containsKey(bad.toString()));
    assertTrue(report.failures().get(missing.toString()).contains("does not exist"));
  }

  @Test
  @DisplayName("The local provider keeps ingested vectors across adapter instances")
  void localPersistence() throws Exception {
    CollectionConfig local = CollectionConfig.of("local", "kb-local", tmp.resolve("vectors"));
    FakeEmbeddingClient embedding = new FakeEmbeddingClient();
    pipeline(embedding, 32)
        .ingest(Document.of("x.md", MediaType.MARKDOWN, THREE_SECTIONS), local);
    assertTrue(Files.isRegularFile(tmp.resolve("vectors").resolve("kb-local.json")));

    VectorStoreAdapter reopened =
        new VectorStoreAdapter(new VectorStoreProviders(List.of(new LocalVectorStoreProvider())));
    assertEquals(3, reopened.size(local));
    IngestReport again =
        new IngestionPipeline(new DocumentLoader(), new Chunker(256, 32), embedding, reopened, 32)
            .ingest(Document.of("x.md", MediaType.MARKDOWN, THREE_SECTIONS), local);
    assertEquals(0, again.embeddedChunks());
  }
}
