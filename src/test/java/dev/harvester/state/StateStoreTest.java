package dev.harvester.state;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class StateStoreTest {

  private static final Instant STARTED = Instant.parse("2026-03-01T10:00:00Z");

  @TempDir Path tempDir;

  private StateStore store;

  @BeforeEach
  void setUp() {
    store = new StateStore(tempDir.resolve(StateStore.STATE_FILE), new ObjectMapper());
  }

  @Test
  void load_without_file_is_empty() {
    assertThat(store.load()).isEmpty();
  }

  @Test
  void saved_snapshot_loads_back() {
    var stats = new CrawlStatistics(STARTED, 2, 1, 0, 0.0, null);
    var snapshot =
        new StateSnapshot(List.of("https://x/1"), List.of("m1", "m2"), List.of("https://x/2"), stats, STARTED);

    store.save(snapshot);

    assertThat(store.load()).contains(snapshot);
  }

  @Test
  void file_uses_snake_case_fields_and_iso_timestamps() throws IOException {
    var stats = new CrawlStatistics(STARTED, 2, 1, 0, 0.0, null);
    store.save(new StateSnapshot(List.of("https://x/1"), List.of("m1"), List.of(), stats, STARTED));

    JsonNode json = new ObjectMapper().readTree(store.getStateFile().toFile());

    assertThat(json.fieldNames())
        .toIterable()
        .containsExactlyInAnyOrder(
            "processed_pages", "processed_members", "pending_pages", "stats", "last_updated");
    assertThat(json.get("stats").get("pages_processed").asLong()).isEqualTo(1);
    assertThat(json.get("stats").get("start_time").asText()).isEqualTo("2026-03-01T10:00:00Z");
    assertThat(json.get("last_updated").asText()).isEqualTo("2026-03-01T10:00:00Z");
  }

  @Test
  void save_fully_replaces_previous_state() {
    store.save(new StateSnapshot(List.of("a", "b"), List.of("m1"), List.of("c"), null, STARTED));
    store.save(new StateSnapshot(List.of("z"), List.of(), List.of(), null, STARTED));

    StateSnapshot loaded = store.load().orElseThrow();
    assertThat(loaded.processedPages()).containsExactly("z");
    assertThat(loaded.pendingPages()).isEmpty();
    assertThat(tempDir.resolve(StateStore.STATE_FILE + ".tmp")).doesNotExist();
  }

  @Test
  void corrupt_file_is_treated_as_absent() throws IOException {
    Files.writeString(store.getStateFile(), "{\"processed_pages\": [");

    assertThat(store.load()).isEmpty();
  }

  @Test
  void missing_fields_default_to_empty() throws IOException {
    Files.writeString(store.getStateFile(), "{\"processed_pages\": [\"a\"], \"extra\": 1}");

    StateSnapshot loaded = store.load().orElseThrow();
    assertThat(loaded.processedPages()).containsExactly("a");
    assertThat(loaded.pendingPages()).isEmpty();
    assertThat(loaded.stats()).isNull();
  }

  @Test
  void timestamps_without_offset_are_read_as_utc() throws IOException {
    Files.writeString(
        store.getStateFile(),
        """
        {"processed_pages": ["https://x/1"],
         "processed_members": ["urn:m:1"],
         "pending_pages": ["https://x/2"],
         "stats": {"start_time": "2024-05-01T12:00:00.123456", "members_harvested": 1,
                   "pages_processed": 1, "errors": 0, "total_duration": 3.5,
                   "end_time": "2024-05-01T12:00:03.623456"},
         "last_updated": "2024-05-01T12:00:03.700000"}""");

    StateSnapshot loaded = store.load().orElseThrow();

    assertThat(loaded.processedMembers()).containsExactly("urn:m:1");
    assertThat(loaded.pendingPages()).containsExactly("https://x/2");
    assertThat(loaded.stats().startTime()).isEqualTo(Instant.parse("2024-05-01T12:00:00.123456Z"));
    assertThat(loaded.stats().endTime()).isEqualTo(Instant.parse("2024-05-01T12:00:03.623456Z"));
    assertThat(loaded.lastUpdated()).isEqualTo(Instant.parse("2024-05-01T12:00:03.700Z"));
  }

  @Test
  void timestamps_with_offset_are_normalised() throws IOException {
    Files.writeString(
        store.getStateFile(),
        """
        {"processed_pages": [], "last_updated": "2024-05-01T14:00:00+02:00"}""");

    assertThat(store.load().orElseThrow().lastUpdated())
        .isEqualTo(Instant.parse("2024-05-01T12:00:00Z"));
  }

  @Test
  void unparseable_timestamp_is_treated_as_corrupt() throws IOException {
    Files.writeString(
        store.getStateFile(), """
        {"processed_pages": [], "last_updated": "yesterday"}""");

    assertThat(store.load()).isEmpty();
  }

  @Test
  void unwritable_location_raises_persist_exception() throws IOException {
    Path blocker = Files.writeString(tempDir.resolve("blocker"), "not a directory");
    var blocked = new StateStore(blocker.resolve(StateStore.STATE_FILE), new ObjectMapper());

    assertThatThrownBy(() -> blocked.save(new StateSnapshot(List.of(), List.of(), List.of(), null, STARTED)))
        .isInstanceOf(StatePersistException.class)
        .hasMessageContaining("Failed to save state");
  }
}
