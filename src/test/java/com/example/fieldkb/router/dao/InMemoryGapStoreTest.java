package com.example.fieldkb.router.dao;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.fieldkb.router.model.GapRecord;
import com.example.fieldkb.router.model.GapStats;
import com.example.fieldkb.router.model.RepairRequest;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class InMemoryGapStoreTest {

  private static final Instant T0 = Instant.parse("2026-01-05T08:00:00Z");

  private final InMemoryGapStore store = new InMemoryGapStore();

  private static RepairRequest repair(String fingerprint, int priority) {
    return RepairRequest.builder()
        .fingerprint(fingerprint)
        .queryText("query " + fingerprint)
        .vendorHint("siemens")
        .equipmentHint("drive")
        .searchTerms(List.of("a", "b", "c", "d"))
        .priority(priority)
        .build();
  }

  @Test
  void repeatedUpsertIncrementsFrequency() {
    GapRecord last = null;
    for (int i = 0; i < 7; i++) {
      last = store.upsert(repair("fp-1", 50 + i), T0.plusSeconds(i));
    }

    assertThat(last.getFrequency()).isEqualTo(7);
    assertThat(last.getPriority()).isEqualTo(56);
    assertThat(last.getFirstSeenAt()).isEqualTo(T0);
    assertThat(last.getLastSeenAt()).isEqualTo(T0.plusSeconds(6));
    assertThat(store.findTop(10, false)).hasSize(1);
  }

  @Test
  void distinctFingerprintsCreateDistinctRecords() {
    for (int i = 0; i < 5; i++) {
      store.upsert(repair("fp-" + i, 50), T0);
    }

    List<GapRecord> all = store.findTop(10, false);
    assertThat(all).hasSize(5);
    assertThat(all).extracting(GapRecord::getId).doesNotHaveDuplicates();
    assertThat(all).allMatch(r -> r.getFrequency() == 1);
  }

  @Test
  void concurrentUpsertsOfSameFingerprintAreNotLost() throws Exception {
    int threads = 8;
    int perThread = 50;
    ExecutorService pool = Executors.newFixedThreadPool(threads);
    CountDownLatch start = new CountDownLatch(1);
    List<Future<?>> futures = new ArrayList<>();
    try {
      for (int t = 0; t < threads; t++) {
        futures.add(pool.submit(() -> {
          start.await();
          for (int i = 0; i < perThread; i++) {
            store.upsert(repair("fp-hot", 60), Instant.now());
          }
          return null;
        }));
      }
      start.countDown();
      for (Future<?> f : futures) {
        f.get(10, TimeUnit.SECONDS);
      }
    } finally {
      pool.shutdownNow();
    }

    assertThat(store.findByFingerprint("fp-hot"))
        .hasValueSatisfying(r -> assertThat(r.getFrequency()).isEqualTo(threads * perThread));
    assertThat(store.stats().totalGaps()).isEqualTo(1);
  }

  @Test
  void markResolvedIsIdempotent() {
    long id = store.upsert(repair("fp-1", 50), T0).getId();

    GapRecord first = store.markResolved(id, List.of("kb-1"), T0.plusSeconds(3600)).orElseThrow();
    GapRecord second = store.markResolved(id, List.of("kb-2"), T0.plusSeconds(7200)).orElseThrow();

    assertThat(first.isResolved()).isTrue();
    assertThat(second.getResolvedAt()).isEqualTo(T0.plusSeconds(3600));
    assertThat(second.getResolutionRefs()).containsExactly("kb-1");
    assertThat(store.markResolved(999L, List.of(), T0)).isEmpty();
  }

  @Test
  void claimResearchHonoursRequeueWindow() {
    long id = store.upsert(repair("fp-1", 50), T0).getId();
    Duration window = Duration.ofHours(24);

    assertThat(store.claimResearch(id, T0, window)).isTrue();
    assertThat(store.claimResearch(id, T0.plusSeconds(60), window)).isFalse();
    assertThat(store.claimResearch(id, T0.plus(window), window)).isTrue();
    assertThat(store.findById(id)).hasValueSatisfying(r ->
        assertThat(r.getResearchQueuedAt()).isEqualTo(T0.plus(window)));
  }

  @Test
  void claimResearchWithoutWindowHappensOnce() {
    long id = store.upsert(repair("fp-1", 50), T0).getId();

    assertThat(store.claimResearch(id, T0, null)).isTrue();
    assertThat(store.claimResearch(id, T0.plus(Duration.ofDays(365)), null)).isFalse();
    assertThat(store.claimResearch(42L, T0, null)).isFalse();
  }

  @Test
  void findTopOrdersByFrequencyThenRecency() {
    store.upsert(repair("rare", 50), T0);
    store.upsert(repair("common", 50), T0);
    store.upsert(repair("common", 50), T0.plusSeconds(1));
    store.upsert(repair("recent", 50), T0.plusSeconds(10));

    assertThat(store.findTop(10, false))
        .extracting(GapRecord::getQueryFingerprint)
        .containsExactly("common", "recent", "rare");
    assertThat(store.findTop(1, false)).hasSize(1);
    assertThat(store.findTop(10, true)).isEmpty();
  }

  @Test
  void statsSummariseResolution() {
    long a = store.upsert(repair("a", 50), T0).getId();
    store.upsert(repair("a", 50), T0);
    store.upsert(repair("b", 50), T0);
    store.markResolved(a, List.of("kb-9"), T0.plus(Duration.ofHours(6)));

    GapStats stats = store.stats();

    assertThat(stats.totalGaps()).isEqualTo(2);
    assertThat(stats.resolvedCount()).isEqualTo(1);
    assertThat(stats.unresolvedCount()).isEqualTo(1);
    assertThat(stats.resolutionRate()).isEqualTo(50.0);
    assertThat(stats.avgFrequency()).isEqualTo(1.5);
    assertThat(stats.avgResolutionHours()).isEqualTo(6.0);
  }

  @Test
  void emptyStoreHasEmptyStats() {
    assertThat(store.stats()).isEqualTo(GapStats.empty());
  }
}
