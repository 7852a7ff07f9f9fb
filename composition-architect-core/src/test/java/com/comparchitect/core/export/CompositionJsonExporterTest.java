package com.comparchitect.core.export;

import com.comparchitect.core.composition.Composition;
import com.comparchitect.core.composition.CompositionBuilder;
import com.comparchitect.core.model.BehavioralUnit;
import com.comparchitect.core.model.TriggerKind;
import com.comparchitect.core.renderer.GeneratedFile;
import com.comparchitect.core.testing.CompositionFixtures;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link CompositionJsonExporter}.
 */
class CompositionJsonExporterTest {

    private final CompositionJsonExporter exporter = new CompositionJsonExporter();
    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void toJson_writesDocumentKeys() throws Exception {
        JsonNode root = mapper.readTree(exporter.toJson(CompositionFixtures.powertrain()));

        assertThat(root.get("composition_name").asText()).isEqualTo("Powertrain");
        assertThat(root.get("components")).hasSize(3);

        JsonNode sensor = root.get("components").get(0);
        assertThat(sensor.get("name").asText()).isEqualTo("Sensor");
        assertThat(sensor.get("type").asText()).isEqualTo("Sensor");
        assertThat(sensor.get("ports").get(0).get("name").asText()).isEqualTo("Speed");
        assertThat(sensor.get("ports").get(0).get("type").asText()).isEqualTo("sender");
        assertThat(sensor.get("runnables").get(0).get("trigger").asText()).isEqualTo("periodic");
        assertThat(sensor.get("runnables").get(0).get("period").asInt()).isEqualTo(10);

        JsonNode contract = sensor.get("interfaces").get(0);
        assertThat(contract.get("name").asText()).isEqualTo("SpeedIf");
        assertThat(contract.get("type").asText()).isEqualTo("senderReceiver");
        assertThat(contract.get("associated_ports").get(0).asText()).isEqualTo("Speed");
        assertThat(contract.get("data_elements")).hasSize(2);
        assertThat(contract.get("data_elements").get(1).get("type").asText()).isEqualTo("int");
    }

    @Test
    void toJson_eventDrivenUnit_writesNullPeriod() throws Exception {
        JsonNode root = mapper.readTree(exporter.toJson(CompositionFixtures.powertrain()));

        JsonNode onSpeed = root.get("components").get(1).get("runnables").get(0);
        assertThat(onSpeed.get("name").asText()).isEqualTo("OnSpeed");
        assertThat(onSpeed.get("trigger").asText()).isEqualTo("event-based");
        assertThat(onSpeed.has("period")).isTrue();
        assertThat(onSpeed.get("period").isNull()).isTrue();
    }

    @Test
    void toJson_periodicUnitWithoutPeriod_writesNullPeriod() throws Exception {
        Composition composition = CompositionBuilder.named("Missing")
            .component("A", "").outbound("X")
                .behavioralUnit(new BehavioralUnit("Tick", TriggerKind.PERIODIC, null))
            .build();

        JsonNode runnable = mapper.readTree(exporter.toJson(composition))
            .get("components").get(0).get("runnables").get(0);

        assertThat(runnable.get("period").isNull()).isTrue();
    }

    @Test
    void toJson_indentsWithFourSpaces() {
        String json = exporter.toJson(CompositionFixtures.pair());

        String[] lines = json.split("\n");
        assertThat(lines[0]).isEqualTo("{");
        assertThat(lines[1]).startsWith("    \"composition_name\"");
        assertThat(json).contains("\n        {").doesNotContain("\t");
    }

    @Test
    void toJson_emptyComposition_writesEmptyComponentList() throws Exception {
        JsonNode root = mapper.readTree(exporter.toJson(new Composition("Empty")));

        assertThat(root.get("components").isArray()).isTrue();
        assertThat(root.get("components")).isEmpty();
    }

    @Test
    void toJson_preservesInsertionOrder() throws Exception {
        JsonNode root = mapper.readTree(exporter.toJson(CompositionFixtures.triangle()));

        assertThat(root.get("components")).extracting(n -> n.get("name").asText())
            .containsExactly("A", "B", "C");
    }

    @Test
    void toGeneratedFile_wrapsJson() {
        GeneratedFile file = exporter.toGeneratedFile(CompositionFixtures.pair(), "out/pair.json");

        assertThat(file.relativePath()).isEqualTo("out/pair.json");
        assertThat(file.contentType()).isEqualTo("application/json");
        assertThat(file.content()).isEqualTo(exporter.toJson(CompositionFixtures.pair()));
    }
}
