package com.algobrain.knowledge.service.export;

import com.algobrain.knowledge.model.Assertion;
import com.algobrain.knowledge.model.ValidationStatus;
import com.algobrain.knowledge.service.graph.InMemoryEvidenceStore;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;

class CorrectedDatasetExporterTest {

    private static final Instant JAN = Instant.parse("2025-01-10T00:00:00Z");
    private static final Instant MAR = Instant.parse("2025-03-10T00:00:00Z");

    private InMemoryEvidenceStore store;
    private ObjectMapper objectMapper;
    private CorrectedDatasetExporter exporter;

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() {
        store = new InMemoryEvidenceStore();
        objectMapper = new ObjectMapper().findAndRegisterModules();
        exporter = new CorrectedDatasetExporter(store, objectMapper);
        exporter.setExportDirectory(tempDir.toString());
    }

    @Test
    void shouldWriteOnlyHumanValidatedAssertionsAsJsonLines() throws Exception {
        String early = pending("k1", "report#p3");
        String late = pending("k2", "report#p7");
        String rejected = pending("k3", "report#p9");
        store.updateValidationStatus(early, ValidationStatus.HUMAN_VALIDATED, JAN);
        store.updateValidationStatus(late, ValidationStatus.HUMAN_VALIDATED, MAR);
        store.updateValidationStatus(rejected, ValidationStatus.HUMAN_REJECTED, MAR);
        pending("k4", "report#p11");

        ByteArrayOutputStream out = new ByteArrayOutputStream();
        long lines = exporter.writeJsonLines(Instant.EPOCH, out);

        String[] rows = out.toString(StandardCharsets.UTF_8).split("\n");
        assertThat(lines).isEqualTo(2);
        assertThat(rows).hasSize(2);
        JsonNode first = objectMapper.readTree(rows[0]);
        assertThat(first.get("sourceTextRef").asText()).isEqualTo("report#p3");
        assertThat(first.get("assertion").get("assertionId").asText()).isEqualTo(early);
        assertThat(objectMapper.readTree(rows[1]).get("assertion").get("assertionId").asText()).isEqualTo(late);
    }

    @Test
    void shouldFilterBySinceInclusive() {
        String early = pending("k1", "report#p3");
        String late = pending("k2", "report#p7");
        store.updateValidationStatus(early, ValidationStatus.HUMAN_VALIDATED, JAN);
        store.updateValidationStatus(late, ValidationStatus.HUMAN_VALIDATED, MAR);

        assertThat(exporter.exportValidated(MAR))
            .extracting(r -> r.getAssertion().getAssertionId())
            .containsExactly(late);
    }

    @Test
    void shouldWriteFileOnlyWhenThereIsSomethingToExport() throws Exception {
        assertThat(exporter.exportToFile(Instant.EPOCH, MAR)).isNull();
        try (Stream<Path> files = Files.list(tempDir)) {
            assertThat(files).isEmpty();
        }

        store.updateValidationStatus(pending("k1", "report#p3"), ValidationStatus.HUMAN_VALIDATED, JAN);

        Path file = exporter.exportToFile(Instant.EPOCH, MAR);
        assertThat(file).isNotNull();
        assertThat(file.getFileName().toString()).isEqualTo("export-20250310-000000.jsonl");
        assertThat(Files.readAllLines(file)).hasSize(1);
    }

    private String pending(String key, String textRef) {
        return store.commitAssertion(Assertion.builder()
            .subjectEntityId("ent-1").predicate("cvss-score").objectLiteral(key)
            .sourceId("report-a").confidence(0.5)
            .validationStatus(ValidationStatus.PENDING)
            .idempotencyKey(key).sourceTextRef(textRef).build())
            .getRecord().getAssertionId();
    }
}
