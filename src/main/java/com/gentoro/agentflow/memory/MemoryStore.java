package com.gentoro.agentflow.memory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Conversation memory scoped by user id.
 *
 * <p>Recall ranks entries by the number of query terms they share (terms shorter than three
 * characters are ignored); ties go to the most recent entry. Entries sharing no term are not
 * returned.
 */
public class MemoryStore {
  private static final org.slf4j.Logger log =
      com.gentoro.agentflow.logging.LoggingService.getLogger(MemoryStore.class);

  private final Map<String, List<MemoryEntry>> memory = new ConcurrentHashMap<>();
  private final AtomicLong sequence = new AtomicLong();
  private final int maxEntriesPerUser;

  public MemoryStore() {
    this(500);
  }

  public MemoryStore(int maxEntriesPerUser) {
    this.maxEntriesPerUser = maxEntriesPerUser;
  }

  public MemoryEntry remember(String userId, String source, String text) {
    MemoryEntry entry =
        new MemoryEntry(sequence.incrementAndGet(), userId, source, text, Instant.now());
    List<MemoryEntry> entries =
        memory.computeIfAbsent(userId, k -> new CopyOnWriteArrayList<>());
    entries.add(entry);
    while (entries.size() > maxEntriesPerUser) {
      entries.remove(0);
    }
    log.trace("MemoryStore: remember {} for {}", source, userId);
    return entry;
  }

  public List<MemoryEntry> recall(String userId, String query, int limit) {
    List<MemoryEntry> entries = memory.get(userId);
    if (entries == null || entries.isEmpty() || limit <= 0) return List.of();
    Set<String> queryTerms = terms(query);
    if (queryTerms.isEmpty()) return List.of();

    record Ranked(MemoryEntry entry, int overlap) {}
    List<Ranked> ranked = new ArrayList<>();
    for (MemoryEntry e : entries) {
      Set<String> t = terms(e.text());
      t.retainAll(queryTerms);
      if (!t.isEmpty()) ranked.add(new Ranked(e, t.size()));
    }
    ranked.sort(
        Comparator.comparingInt(Ranked::overlap)
            .reversed()
            .thenComparing(r -> r.entry().sequence(), Comparator.reverseOrder()));
    log.trace("MemoryStore: recall {} for {} -> {}", query, userId, ranked.size());
    return ranked.stream().limit(limit).map(Ranked::entry).toList();
  }

  public List<MemoryEntry> entries(String userId) {
    return List.copyOf(memory.getOrDefault(userId, List.of()));
  }

  public void clear(String userId) {
    memory.remove(userId);
    log.trace("MemoryStore: clear {}", userId);
  }

  static Set<String> terms(String text) {
    Set<String> out = new HashSet<>();
    if (text == null) return out;
    for (String t : text.toLowerCase(Locale.ROOT).split("[^\\p{L}\\p{N}]+")) {
      if (t.length() >= 3) out.add(t);
    }
    return out;
  }
}
