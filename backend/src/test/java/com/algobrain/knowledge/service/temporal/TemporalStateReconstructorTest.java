package com.algobrain.knowledge.service.temporal;

import com.algobrain.knowledge.config.EngineConfig;
import com.algobrain.knowledge.model.EntityType;
import com.algobrain.knowledge.model.EventParticipant;
import com.algobrain.knowledge.model.GraphEntity;
import com.algobrain.knowledge.model.StateSnapshot;
import com.algobrain.knowledge.model.TimelineEvent;
import com.algobrain.knowledge.service.graph.InMemoryEvidenceStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.NoSuchElementException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TemporalStateReconstructorTest {

    private static final String CVE = "ent-cve";

    private InMemoryEvidenceStore store;
    private TemporalStateReconstructor reconstructor;

    @BeforeEach
    void setUp() {
        EngineConfig config = new EngineConfig();
        store = new InMemoryEvidenceStore();
        reconstructor = new TemporalStateReconstructor(store, new StateQueryCache(config), config);
        store.createEntityIfAbsent(GraphEntity.builder()
            .entityId(CVE).typeTag(EntityType.VULNERABILITY).canonicalName("CVE-2025-1")
            .normalizedName("cve 2025 1").externalId("CVE-2025-1").creationKey("ext:CVE-2025-1").build());
    }

    @Test
    void shouldReplayLifecycleRegardlessOfArrivalOrder() {
        record("PATCH", "2024-03-01T00:00:00Z", null);
        record("DISCLOSURE", "2024-01-10T00:00:00Z", null);
        record("EXPLOIT", "2024-02-01T00:00:00Z", null);
        record("ADVISORY_UPDATE", "2024-02-15T00:00:00Z", null);

        assertThat(stateAt("2024-01-01T00:00:00Z")).isEqualTo("undiscovered");
        assertThat(stateAt("2024-01-15T00:00:00Z")).isEqualTo("disclosed");
        assertThat(stateAt("2024-02-20T00:00:00Z")).isEqualTo("exploited");
        assertThat(stateAt("2024-03-15T00:00:00Z")).isEqualTo("patched");
    }

    @Test
    void shouldIncludeEventWhoseEffectiveTimeEqualsQueryTime() {
        record("DISCLOSURE", "2024-01-10T00:00:00Z", null);

        StateSnapshot snapshot = reconstructor.getStateAt(CVE, Instant.parse("2024-01-10T00:00:00Z"));

        assertThat(snapshot.getState()).isEqualTo("disclosed");
        assertThat(snapshot.getEventType()).isEqualTo("DISCLOSURE");
    }

    @Test
    void shouldUseEndTimeAsEffectiveTime() {
        TimelineEvent exploit = TimelineEvent.builder()
            .eventType("EXPLOIT")
            .startTime(Instant.parse("2024-01-20T00:00:00Z"))
            .endTime(Instant.parse("2024-02-05T00:00:00Z"))
            .participants(List.of(new EventParticipant(CVE, "target")))
            .sourceId("honeypot")
            .idempotencyKey("exploit-window")
            .build();
        reconstructor.onEventRecorded(store.appendEvent(exploit).getRecord());

        assertThat(stateAt("2024-02-01T00:00:00Z")).isEqualTo("undiscovered");
        assertThat(stateAt("2024-02-05T00:00:00Z")).isEqualTo("exploited");
    }

    @Test
    void shouldLetLaterRecordedEventWinOnSameEffectiveTime() {
        record("EXPLOIT", "2024-02-01T00:00:00Z", "2024-02-02T00:00:00Z");
        record("PATCH", "2024-02-01T00:00:00Z", "2024-02-03T00:00:00Z");

        assertThat(stateAt("2024-02-10T00:00:00Z")).isEqualTo("patched");
    }

    @Test
    void shouldInvalidateCachedStateWhenEventArrives() {
        record("DISCLOSURE", "2024-01-10T00:00:00Z", null);
        assertThat(stateAt("2024-03-15T00:00:00Z")).isEqualTo("disclosed");

        record("PATCH", "2024-03-01T00:00:00Z", null);

        assertThat(stateAt("2024-03-15T00:00:00Z")).isEqualTo("patched");
    }

    @Test
    void shouldFailForUnknownEntity() {
        assertThatThrownBy(() -> reconstructor.getStateAt("ent-missing", Instant.now()))
            .isInstanceOf(NoSuchElementException.class);
    }

    private void record(String type, String at, String recordedAt) {
        TimelineEvent event = TimelineEvent.builder()
            .eventType(type)
            .startTime(Instant.parse(at))
            .participants(List.of(new EventParticipant(CVE, "target")))
            .sourceId("nvd")
            .recordedAt(recordedAt == null ? null : Instant.parse(recordedAt))
            .idempotencyKey(type + "|" + at)
            .build();
        reconstructor.onEventRecorded(store.appendEvent(event).getRecord());
    }

    private String stateAt(String at) {
        return reconstructor.getStateAt(CVE, Instant.parse(at)).getState();
    }
}
