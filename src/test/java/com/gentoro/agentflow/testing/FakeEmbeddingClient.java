package com.gentoro.agentflow.testing;

import com.gentoro.agentflow.embedding.EmbeddingClient;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Deterministic embedding client: a hashed bag of words. Texts sharing words get close vectors,
 * which is enough to make retrieval order predictable in tests.
 */
public class FakeEmbeddingClient implements EmbeddingClient {
  public static final int DIMENSION = 256;

  private final String modelId;
  private final AtomicInteger calls = new AtomicInteger();
  private final AtomicInteger embeddedTexts = new AtomicInteger();
  private final AtomicInteger failuresLeft = new AtomicInteger();
  private volatile RuntimeException failure;

  public FakeEmbeddingClient() {
    this("fake-embedding-v1");
  }

  public FakeEmbeddingClient(String modelId) {
    this.modelId = modelId;
  }

  /** Make the next {@code times} calls throw {@code failure}. */
  public FakeEmbeddingClient failNext(int times, RuntimeException failure) {
    this.failure = failure;
    this.failuresLeft.set(times);
    return this;
  }

  public int calls() {
    return calls.get();
  }

  public int embeddedTexts() {
    return embeddedTexts.get();
  }

  @Override
  public String modelId() {
    return modelId;
  }

  @Override
  public List<float[]> embed(List<String> texts) {
    calls.incrementAndGet();
    if (failuresLeft.getAndUpdate(n -> Math.max(0, n - 1)) > 0) {
      throw failure;
    }
    embeddedTexts.addAndGet(texts.size());
    List<float[]> out = new ArrayList<>(texts.size());
    for (String t : texts) {
      out.add(vector(t));
    }
    return out;
  }

  public static float[] vector(String text) {
    float[] v = new float[DIMENSION];
    for (String term : text.toLowerCase(Locale.ROOT).split("[^a-z0-9]+")) {
      if (term.length() < 2) continue;
      v[Math.floorMod(term.hashCode(), DIMENSION)] += 1f;
    }
    return v;
  }
}
