package com.gentoro.agentflow.knowledge;

/** Outcome of ingesting one document into one collection. */
public record IngestReport(
    String documentId,
    String sourcePath,
    String collection,
    int totalChunks,
    int embeddedChunks,
    int skippedChunks,
    int reembeddedStale) {}
