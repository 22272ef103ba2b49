package com.gentoro.agentflow.knowledge;

import java.util.List;
import java.util.Map;

/**
 * Outcome of loading a set of knowledge sources. Sources that could not be read are listed in
 * {@link #failures()} (source path to reason); the others were ingested.
 */
public record KnowledgeLoadReport(List<IngestReport> ingested, Map<String, String> failures) {
  public KnowledgeLoadReport {
    ingested = List.copyOf(ingested);
    failures = Map.copyOf(failures);
  }

  public boolean hasFailures() {
    return !failures.isEmpty();
  }

  public int totalChunks() {
    return ingested.stream().mapToInt(IngestReport::totalChunks).sum();
  }
}
