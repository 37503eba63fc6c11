package com.algobrain.knowledge.service.normalize;

import com.algobrain.dto.RawCandidateFact;
import com.algobrain.knowledge.exception.MalformedRecordException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StixBundleNormalizerTest {

    private static final String BUNDLE = "{"
        + "\"type\":\"bundle\",\"id\":\"bundle--1\",\"objects\":["
        + "{\"type\":\"attack-pattern\",\"id\":\"attack-pattern--1\",\"name\":\"Command and Scripting Interpreter\","
        + " \"description\":\"Adversaries may abuse interpreters.\",\"modified\":\"2024-04-01T00:00:00.000Z\","
        + " \"external_references\":[{\"source_name\":\"mitre-attack\",\"external_id\":\"T1059\"}],"
        + " \"kill_chain_phases\":[{\"kill_chain_name\":\"mitre-attack\",\"phase_name\":\"execution\"}]},"
        + "{\"type\":\"malware\",\"id\":\"malware--1\",\"name\":\"ScriptX\","
        + " \"external_references\":[{\"source_name\":\"mitre-attack\",\"external_id\":\"S9001\"}]},"
        + "{\"type\":\"malware\",\"id\":\"malware--old\",\"name\":\"OldThing\",\"revoked\":true},"
        + "{\"type\":\"relationship\",\"id\":\"relationship--1\",\"relationship_type\":\"uses\","
        + " \"source_ref\":\"malware--1\",\"target_ref\":\"attack-pattern--1\",\"confidence\":80},"
        + "{\"type\":\"relationship\",\"id\":\"relationship--2\",\"relationship_type\":\"uses\","
        + " \"source_ref\":\"malware--old\",\"target_ref\":\"attack-pattern--1\"}"
        + "]}";

    private static final String DETECTION_BUNDLE = "{"
        + "\"type\":\"bundle\",\"id\":\"bundle--2\",\"objects\":["
        + "{\"type\":\"attack-pattern\",\"id\":\"attack-pattern--1\",\"name\":\"Command and Scripting Interpreter\","
        + " \"external_references\":[{\"source_name\":\"mitre-attack\",\"external_id\":\"T1059\"}],"
        + " \"x_mitre_data_sources\":[\"Process: Process Creation\",\"Command: Command Execution\",\"garbage\"]},"
        + "{\"type\":\"x-mitre-data-source\",\"id\":\"x-mitre-data-source--1\",\"name\":\"Process\","
        + " \"external_references\":[{\"source_name\":\"mitre-attack\",\"external_id\":\"DS0009\"}]},"
        + "{\"type\":\"x-mitre-data-component\",\"id\":\"x-mitre-data-component--1\",\"name\":\"Process Creation\","
        + " \"x_mitre_data_source_ref\":\"x-mitre-data-source--1\"},"
        + "{\"type\":\"relationship\",\"id\":\"relationship--9\",\"relationship_type\":\"detects\","
        + " \"source_ref\":\"x-mitre-data-component--1\",\"target_ref\":\"attack-pattern--1\"}"
        + "]}";

    private final ObjectMapper objectMapper = new ObjectMapper();

    private final StixBundleNormalizer normalizer = new StixBundleNormalizer();

    @Test
    void shouldConvertObjectsAndRelationshipsToCandidateFacts() throws Exception {
        JsonNode bundle = objectMapper.readTree(BUNDLE);

        List<RawCandidateFact> facts = normalizer.toCandidateFacts(bundle, "mitre-attack");

        List<String> predicates = facts.stream().map(RawCandidateFact::getPredicate).collect(Collectors.toList());
        assertThat(predicates).containsExactly("has-stix-id", "has-description", "belongs-to", "has-stix-id", "uses");
        assertThat(facts).allMatch(f -> "mitre-attack".equals(f.getSourceId()));
        assertThat(facts).allMatch(f -> "STRUCTURED_FEED".equals(f.getOrigin()));

        RawCandidateFact tactic = facts.get(2);
        assertThat(tactic.getSubjectExternalId()).isEqualTo("T1059");
        assertThat(tactic.getObject()).isEqualTo("execution");
        assertThat(tactic.getObjectType()).isEqualTo("TACTIC");

        RawCandidateFact uses = facts.get(4);
        assertThat(uses.getSubject()).isEqualTo("ScriptX");
        assertThat(uses.getSubjectExternalId()).isEqualTo("S9001");
        assertThat(uses.getObjectExternalId()).isEqualTo("T1059");
        assertThat(uses.getConfidence()).isEqualTo(0.8);
        assertThat(uses.getSourceTextRef()).isEqualTo("stix:relationship--1");
    }

    @Test
    void shouldLinkTechniquesToDataComponentsAndSources() throws Exception {
        JsonNode bundle = objectMapper.readTree(DETECTION_BUNDLE);

        List<RawCandidateFact> facts = normalizer.toCandidateFacts(bundle, "mitre-attack");

        List<String> links = facts.stream()
            .filter(f -> !f.getPredicate().startsWith("has-stix") && !"has-description".equals(f.getPredicate()))
            .map(f -> f.getSubject() + " -" + f.getPredicate() + "-> " + f.getObject())
            .collect(Collectors.toList());
        // 缺少 Command Execution 组件的条目和格式错误的条目被跳过；has-component 只出现一次
        assertThat(links).containsExactly(
            "Process Creation -detects-> Command and Scripting Interpreter",
            "Process -has-component-> Process Creation",
            "Process Creation -detects-> Command and Scripting Interpreter");

        RawCandidateFact hasComponent = facts.stream()
            .filter(f -> StixBundleNormalizer.PREDICATE_HAS_COMPONENT.equals(f.getPredicate()))
            .findFirst().orElseThrow();
        assertThat(hasComponent.getSubjectType()).isEqualTo("DATA_SOURCE");
        assertThat(hasComponent.getSubjectExternalId()).isEqualTo("DS0009");
        assertThat(hasComponent.getObjectType()).isEqualTo("DATA_COMPONENT");
        assertThat(facts.get(facts.size() - 1).getSourceTextRef()).isEqualTo("stix:relationship--9");
    }

    @Test
    void shouldTreatMissingStixConfidenceAsFullyTrusted() throws Exception {
        JsonNode bundle = objectMapper.readTree(BUNDLE);

        List<RawCandidateFact> facts = normalizer.toCandidateFacts(bundle, "mitre-attack");

        assertThat(facts.get(0).getConfidence()).isEqualTo(1.0);
        assertThat(facts.get(0).getObservedAt()).isNotNull();
    }

    @Test
    void shouldRejectDocumentThatIsNotABundle() throws Exception {
        JsonNode notBundle = objectMapper.readTree("{\"type\":\"malware\",\"name\":\"x\"}");

        assertThatThrownBy(() -> normalizer.toCandidateFacts(notBundle, "mitre-attack"))
            .isInstanceOf(MalformedRecordException.class);
    }
}
