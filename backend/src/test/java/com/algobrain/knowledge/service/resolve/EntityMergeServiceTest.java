package com.algobrain.knowledge.service.resolve;

import com.algobrain.knowledge.config.EngineConfig;
import com.algobrain.knowledge.exception.MergeConflictException;
import com.algobrain.knowledge.model.EntityType;
import com.algobrain.knowledge.model.EventParticipant;
import com.algobrain.knowledge.model.GraphEntity;
import com.algobrain.knowledge.model.StateSnapshot;
import com.algobrain.knowledge.model.TimelineEvent;
import com.algobrain.knowledge.service.graph.InMemoryEvidenceStore;
import com.algobrain.knowledge.service.temporal.StateQueryCache;
import com.algobrain.knowledge.service.temporal.TemporalStateReconstructor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EntityMergeServiceTest {

    private InMemoryEvidenceStore store;
    private EntityMergeService mergeService;
    private TemporalStateReconstructor temporal;
    private StateQueryCache cache;

    @BeforeEach
    void setUp() {
        EngineConfig config = new EngineConfig();
        store = new InMemoryEvidenceStore();
        cache = new StateQueryCache(config);
        mergeService = new EntityMergeService(store, new EntityLockRegistry(), cache, config);
        temporal = new TemporalStateReconstructor(store, cache, config);

        store.createEntityIfAbsent(GraphEntity.builder()
            .entityId("ent-xz").typeTag(EntityType.VULNERABILITY).canonicalName("XZ backdoor")
            .normalizedName("xz backdoor").creationKey("VULNERABILITY|xz backdoor").build());
        store.createEntityIfAbsent(GraphEntity.builder()
            .entityId("ent-cve").typeTag(EntityType.VULNERABILITY).canonicalName("CVE-2024-3094")
            .normalizedName("cve 2024 3094").externalId("CVE-2024-3094").creationKey("ext:CVE-2024-3094").build());
    }

    @Test
    void shouldMergeDuplicateAndRefreshDerivedState() {
        Instant asOf = Instant.parse("2024-06-01T00:00:00Z");
        assertThat(temporal.getStateAt("ent-cve", asOf).getState()).isEqualTo("undiscovered");

        store.appendEvent(TimelineEvent.builder()
            .eventType("PATCH")
            .startTime(Instant.parse("2024-04-01T00:00:00Z"))
            .participants(List.of(new EventParticipant("ent-xz", "target")))
            .sourceId("vendor")
            .idempotencyKey("evt-patch")
            .build());

        GraphEntity survivor = mergeService.merge("ent-xz", "ent-cve", "same vulnerability");

        assertThat(survivor.getEntityId()).isEqualTo("ent-cve");
        assertThat(store.resolveCanonicalId("ent-xz")).isEqualTo("ent-cve");
        assertThat(temporal.getStateAt("ent-cve", asOf).getState()).isEqualTo("patched");
        assertThat(temporal.getStateAt("ent-xz", asOf).getEntityId()).isEqualTo("ent-cve");
    }

    @Test
    void shouldDiscardStateComputedBeforeMergeButCachedAfterIt() {
        Instant asOf = Instant.parse("2024-06-01T00:00:00Z");
        store.appendEvent(TimelineEvent.builder()
            .eventType("PATCH")
            .startTime(Instant.parse("2024-04-01T00:00:00Z"))
            .participants(List.of(new EventParticipant("ent-xz", "target")))
            .sourceId("vendor")
            .idempotencyKey("evt-patch")
            .build());

        // 合并前开始计算的读请求
        long generation = cache.generation("ent-cve");
        StateSnapshot stale = new StateSnapshot("ent-cve", asOf, "undiscovered", null, null, null);

        mergeService.merge("ent-xz", "ent-cve", "same vulnerability");

        assertThat(cache.put("ent-cve", asOf, stale, generation)).isFalse();
        assertThat(cache.get("ent-cve", asOf)).isEmpty();
        assertThat(temporal.getStateAt("ent-cve", asOf).getState()).isEqualTo("patched");
        assertThat(cache.get("ent-cve", asOf)).hasValueSatisfying(s -> assertThat(s.getState()).isEqualTo("patched"));
    }

    @Test
    void shouldRejectMergingAlreadyMergedEntity() {
        mergeService.merge("ent-xz", "ent-cve", "same vulnerability");

        assertThatThrownBy(() -> mergeService.merge("ent-xz", "ent-cve", "again"))
            .isInstanceOf(MergeConflictException.class);
        assertThatThrownBy(() -> mergeService.merge("ent-unknown", "ent-cve", "missing"))
            .isInstanceOf(MergeConflictException.class);
    }
}
