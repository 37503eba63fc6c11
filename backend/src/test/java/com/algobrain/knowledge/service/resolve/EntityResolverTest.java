package com.algobrain.knowledge.service.resolve;

import com.algobrain.knowledge.config.EngineConfig;
import com.algobrain.knowledge.exception.AmbiguousResolutionException;
import com.algobrain.knowledge.model.Assertion;
import com.algobrain.knowledge.model.EntityDescriptor;
import com.algobrain.knowledge.model.EntityType;
import com.algobrain.knowledge.model.GraphEntity;
import com.algobrain.knowledge.model.ResolutionContext;
import com.algobrain.knowledge.model.ResolutionResult;
import com.algobrain.knowledge.model.ValidationStatus;
import com.algobrain.knowledge.service.graph.InMemoryEvidenceStore;
import com.algobrain.knowledge.service.similarity.LexicalSimilarityService;
import com.algobrain.knowledge.util.NameNormalizer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EntityResolverTest {

    private static final ResolutionContext CONTEXT = ResolutionContext.builder()
        .sourceId("report-a")
        .sourceReliability(0.5)
        .build();

    private InMemoryEvidenceStore store;
    private LexicalSimilarityService similarity;
    private EngineConfig config;

    @BeforeEach
    void setUp() {
        store = new InMemoryEvidenceStore();
        similarity = new LexicalSimilarityService(store);
        config = new EngineConfig();
    }

    @Test
    void shouldCreateOnFirstSightingAndMatchAfterwards() {
        EntityResolver resolver = resolver(new ContextualDisambiguationScorer(store));

        ResolutionResult first = resolver.resolve(descriptor("ScriptX", EntityType.TOOL, null), CONTEXT);
        ResolutionResult second = resolver.resolve(descriptor("scriptx", EntityType.TOOL, null), CONTEXT);

        assertThat(first.getOutcome()).isEqualTo(ResolutionResult.Outcome.CREATED);
        assertThat(second.getOutcome()).isEqualTo(ResolutionResult.Outcome.MATCHED);
        assertThat(second.getEntityId()).isEqualTo(first.getEntityId());
        assertThat(store.listEntities()).hasSize(1);
    }

    @Test
    void shouldMatchByExternalIdAndRecordNewSpelling() {
        EntityResolver resolver = resolver(new ContextualDisambiguationScorer(store));
        String id = resolver.resolve(descriptor("CVE-2024-3094", EntityType.VULNERABILITY, "CVE-2024-3094"), CONTEXT)
            .getEntityId();

        ResolutionResult byAlias = resolver.resolve(
            descriptor("XZ Utils backdoor", EntityType.VULNERABILITY, "CVE-2024-3094"), CONTEXT);

        assertThat(byAlias.getEntityId()).isEqualTo(id);
        assertThat(byAlias.getScore()).isEqualTo(1.0);
        assertThat(store.findByNormalizedName("xz utils backdoor")).extracting(GraphEntity::getEntityId)
            .containsExactly(id);
    }

    @Test
    void shouldFollowPinnedEntityThroughMerge() {
        EntityResolver resolver = resolver(new ContextualDisambiguationScorer(store));
        store.createEntityIfAbsent(entity("ent-a", EntityType.TOOL, "ScriptX"));
        store.createEntityIfAbsent(entity("ent-b", EntityType.MALWARE, "ScriptX"));
        store.mergeEntities("ent-b", "ent-a", "duplicate");

        EntityDescriptor pinned = descriptor("ScriptX", EntityType.TOOL, null).toBuilder()
            .pinnedEntityId("ent-b")
            .build();

        ResolutionResult result = resolver.resolve(pinned, CONTEXT);
        assertThat(result.getOutcome()).isEqualTo(ResolutionResult.Outcome.PINNED);
        assertThat(result.getEntityId()).isEqualTo("ent-a");
    }

    @Test
    void shouldBreakExactScoreTiesByEntityId() {
        store.createEntityIfAbsent(entity("ent-b", EntityType.MALWARE, "ScriptX"));
        store.createEntityIfAbsent(entity("ent-a", EntityType.TOOL, "ScriptX"));
        EntityResolver resolver = resolver((descriptor, candidate, context) -> 0.9);

        for (int i = 0; i < 5; i++) {
            ResolutionResult result = resolver.resolve(descriptor("ScriptX", EntityType.UNKNOWN, null), CONTEXT);
            assertThat(result.getEntityId()).isEqualTo("ent-a");
            assertThat(result.getOutcome()).isEqualTo(ResolutionResult.Outcome.MATCHED);
        }
    }

    @Test
    void shouldEscalateNearTieToReview() {
        store.createEntityIfAbsent(entity("ent-a", EntityType.TOOL, "ScriptX"));
        store.createEntityIfAbsent(entity("ent-b", EntityType.MALWARE, "ScriptX"));
        EntityResolver resolver = resolver((descriptor, candidate, context) ->
            candidate.getEntity().getTypeTag() == EntityType.TOOL ? 0.90 : 0.89);

        assertThatThrownBy(() -> resolver.resolve(descriptor("ScriptX", EntityType.UNKNOWN, null), CONTEXT))
            .isInstanceOfSatisfying(AmbiguousResolutionException.class, e -> {
                assertThat(e.getProvisionalEntityId()).isEqualTo("ent-a");
                assertThat(e.getCandidateEntityIds()).containsExactly("ent-a", "ent-b");
            });
    }

    @Test
    void shouldPreferHistoricallyConfirmedCandidateInNearTie() {
        store.createEntityIfAbsent(entity("ent-a", EntityType.TOOL, "ScriptX"));
        store.createEntityIfAbsent(entity("ent-b", EntityType.MALWARE, "ScriptX"));
        store.commitAssertion(Assertion.builder()
            .subjectEntityId("ent-a")
            .predicate("has-description")
            .objectLiteral("PowerShell loader")
            .confidence(1.0)
            .sourceId("mitre-attack")
            .validationStatus(ValidationStatus.AUTO_COMMITTED)
            .idempotencyKey("k-desc")
            .build());
        EntityResolver resolver = resolver((descriptor, candidate, context) ->
            candidate.getEntity().getTypeTag() == EntityType.TOOL ? 0.90 : 0.89);

        ResolutionResult result = resolver.resolve(descriptor("ScriptX", EntityType.UNKNOWN, null), CONTEXT);

        assertThat(result.getEntityId()).isEqualTo("ent-a");
        assertThat(result.getCandidates()).extracting(c -> c.getConfirmationCount()).containsExactly(1L, 0L);
    }

    @Test
    void shouldCreateExactlyOneEntityUnderConcurrentFirstSightings() throws Exception {
        EntityResolver resolver = resolver(new ContextualDisambiguationScorer(store));
        int threads = 8;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<String>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < threads; i++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    return resolver.resolve(descriptor("Lazarus Group", EntityType.ACTOR, null), CONTEXT)
                        .getEntityId();
                }));
            }
            start.countDown();

            Set<String> ids = futures.stream().map(f -> {
                try {
                    return f.get(10, TimeUnit.SECONDS);
                } catch (Exception e) {
                    throw new IllegalStateException(e);
                }
            }).collect(Collectors.toSet());

            assertThat(ids).hasSize(1);
            assertThat(store.listEntities()).hasSize(1);
        } finally {
            pool.shutdownNow();
        }
    }

    private EntityResolver resolver(DisambiguationScorer scorer) {
        CandidateGenerator generator = new CandidateGenerator(store, similarity, config);
        return new EntityResolver(store, generator, scorer, similarity, new EntityLockRegistry(), config);
    }

    private static EntityDescriptor descriptor(String name, EntityType type, String externalId) {
        return EntityDescriptor.builder()
            .name(name)
            .normalizedName(NameNormalizer.normalize(name))
            .typeTag(type)
            .externalId(externalId)
            .build();
    }

    private static GraphEntity entity(String id, EntityType type, String name) {
        String normalized = NameNormalizer.normalize(name);
        return GraphEntity.builder()
            .entityId(id)
            .typeTag(type)
            .canonicalName(name)
            .normalizedName(normalized)
            .creationKey(type.name() + "|" + normalized)
            .build();
    }
}
