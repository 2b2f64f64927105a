package dev.harvester.state;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;

class CrawlStateTest {

  private static final Instant T0 = Instant.parse("2026-03-01T10:00:00Z");

  @Test
  void enqueueRejectsPendingAndProcessedUrls() {
    CrawlState state = CrawlState.fresh(T0);

    assertThat(state.enqueue("a")).isTrue();
    assertThat(state.isPending("a")).isTrue();
    assertThat(state.enqueue("a")).isFalse();
    state.markPageProcessed("a");
    assertThat(state.isPending("a")).isFalse();
    assertThat(state.enqueue("a")).isFalse();
    assertThat(state.pendingPages()).isEmpty();
  }

  @Test
  void frontierKeepsInsertionOrder() {
    CrawlState state = CrawlState.fresh(T0);
    state.enqueue("c");
    state.enqueue("a");
    state.enqueue("b");

    assertThat(state.pendingPages()).containsExactly("c", "a", "b");
  }

  @Test
  void markPageProcessedCountsEachPageOnce() {
    CrawlState state = CrawlState.fresh(T0);

    assertThat(state.markPageProcessed("a")).isEqualTo(1);
    assertThat(state.markPageProcessed("a")).isEqualTo(1);
    assertThat(state.markPageProcessed("b")).isEqualTo(2);
    assertThat(state.processedPageCount()).isEqualTo(2);
  }

  @Test
  void recordMemberCountsDistinctIdentities() {
    CrawlState state = CrawlState.fresh(T0);
    state.recordMember("m1");
    state.recordMember("m1");
    state.recordMember("m2");
    state.recordError();

    assertThat(state.isMemberProcessed("m1")).isTrue();
    assertThat(state.statistics().membersHarvested()).isEqualTo(2);
    assertThat(state.statistics().errors()).isEqualTo(1);
  }

  @Test
  void fromSnapshotDropsPendingPagesAlreadyProcessed() {
    var snapshot = new StateSnapshot(List.of("a", "b"), List.of("m1"), List.of("b", "c"), null, null);

    CrawlState state = CrawlState.fromSnapshot(snapshot, T0);

    assertThat(state.pendingPages()).containsExactly("c");
    assertThat(state.isPageProcessed("a")).isTrue();
    assertThat(state.isMemberProcessed("m1")).isTrue();
    assertThat(state.statistics().startTime()).isEqualTo(T0);
  }

  @Test
  void fromSnapshotKeepsCumulativeStatistics() {
    var stats = new CrawlStatistics(T0, 5, 3, 1, 12.5, T0.plusSeconds(12));
    var snapshot = new StateSnapshot(List.of("a"), List.of(), List.of(), stats, T0);

    CrawlState state = CrawlState.fromSnapshot(snapshot, T0.plusSeconds(3600));
    state.markPageProcessed("b");

    assertThat(state.statistics().pagesProcessed()).isEqualTo(4);
    assertThat(state.statistics().startTime()).isEqualTo(T0);
  }

  @Test
  void finishRecordsEndTimeAndDurationInSeconds() {
    CrawlState state = CrawlState.fresh(T0);

    state.finish(T0.plusMillis(2500), Duration.ofMillis(2500));

    assertThat(state.statistics().endTime()).isEqualTo(T0.plusMillis(2500));
    assertThat(state.statistics().totalDuration()).isEqualTo(2.5);
  }

  @Test
  void snapshotIsDetachedCopy() {
    CrawlState state = CrawlState.fresh(T0);
    state.enqueue("a");

    StateSnapshot snapshot = state.snapshot(T0);
    state.markPageProcessed("a");

    assertThat(snapshot.pendingPages()).containsExactly("a");
    assertThat(snapshot.processedPages()).isEmpty();
    assertThat(snapshot.lastUpdated()).isEqualTo(T0);
  }
}
