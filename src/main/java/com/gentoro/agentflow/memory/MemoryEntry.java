package com.gentoro.agentflow.memory;

import java.time.Instant;

/** One remembered fact, usually the output of a completed task. */
public record MemoryEntry(long sequence, String userId, String source, String text, Instant at) {}
