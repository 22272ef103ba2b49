package com.gentoro.agentflow.memory;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class MemoryStoreTest {

  @Test
  @DisplayName("Recall ranks by shared terms, then by recency")
  void ranking() {
    MemoryStore store = new MemoryStore();
    store.remember("alice", "t1", "The revenue report covers Europe");
    store.remember("alice", "t2", "Weather was sunny");
    store.remember("alice", "t3", "Revenue grew in Europe and Asia, report attached");
    store.remember("alice", "t4", "Revenue is up");

    List<MemoryEntry> hits = store.recall("alice", "revenue report for Europe", 5);

    assertEquals(List.of("t3", "t1", "t4"), hits.stream().map(MemoryEntry::source).toList());
  }

  @Test
  @DisplayName("Recall is scoped by user and limited")
  void scopedAndLimited() {
    MemoryStore store = new MemoryStore();
    store.remember("alice", "a", "budget planning notes");
    store.remember("bob", "b", "budget planning draft");
    store.remember("alice", "c", "budget review");

    assertEquals(1, store.recall("alice", "budget", 1).size());
    assertEquals("c", store.recall("alice", "budget", 1).get(0).source());
    assertEquals(
        List.of("b"),
        store.recall("bob", "budget", 5).stream().map(MemoryEntry::source).toList());
    assertTrue(store.recall("carol", "budget", 5).isEmpty());
    assertTrue(store.recall("alice", "budget", 0).isEmpty());
  }

  @Test
  @DisplayName("Terms shorter than three characters do not match")
  void shortTermsIgnored() {
    MemoryStore store = new MemoryStore();
    store.remember("u", "s", "it is ok to go");
    assertTrue(store.recall("u", "is it ok", 3).isEmpty());
  }

  @Test
  @DisplayName("Oldest entries are evicted past the per-user capacity")
  void capacity() {
    MemoryStore store = new MemoryStore(2);
    store.remember("u", "1", "first entry");
    store.remember("u", "2", "second entry");
    store.remember("u", "3", "third entry");

    assertEquals(List.of("2", "3"), store.entries("u").stream().map(MemoryEntry::source).toList());
    store.clear("u");
    assertTrue(store.entries("u").isEmpty());
  }
}
