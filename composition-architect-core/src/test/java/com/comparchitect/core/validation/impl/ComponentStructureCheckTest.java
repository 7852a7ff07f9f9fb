package com.comparchitect.core.validation.impl;

import com.comparchitect.core.composition.Composition;
import com.comparchitect.core.composition.CompositionBuilder;
import com.comparchitect.core.graph.ComponentGraph;
import com.comparchitect.core.model.BehavioralUnit;
import com.comparchitect.core.model.Finding;
import com.comparchitect.core.model.FindingCategory;
import com.comparchitect.core.model.Severity;
import com.comparchitect.core.model.TriggerKind;
import com.comparchitect.core.testing.CompositionFixtures;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link ComponentStructureCheck}.
 */
class ComponentStructureCheckTest {

    private final ComponentStructureCheck check = new ComponentStructureCheck();

    private List<Finding> run(Composition composition) {
        return check.check(composition, ComponentGraph.of(composition));
    }

    @Test
    void check_wellFormedComposition_reportsNothing() {
        assertThat(run(CompositionFixtures.powertrain())).isEmpty();
    }

    @Test
    void check_componentWithoutEndpoints_isReported() {
        Composition composition = CompositionBuilder.named("Bare")
            .component("Empty", "Library").eventDriven("Init")
            .build();

        List<Finding> findings = run(composition);

        assertThat(findings).singleElement().satisfies(f -> {
            assertThat(f.severity()).isEqualTo(Severity.ERROR);
            assertThat(f.category()).isEqualTo(FindingCategory.STRUCTURE);
            assertThat(f.component()).isEqualTo("Empty");
            assertThat(f.subject()).isNull();
            assertThat(f.message()).isEqualTo("Component 'Empty' has no ports defined.");
        });
    }

    @Test
    void check_periodicUnitWithoutPeriod_reportedExactlyOnce() {
        Composition composition = CompositionBuilder.named("MissingPeriod")
            .component("Sensor", "Sensor")
                .outbound("Speed")
                .behavioralUnit(new BehavioralUnit("Sample", TriggerKind.PERIODIC, null))
            .build();

        List<Finding> findings = run(composition);

        assertThat(findings).singleElement().satisfies(f -> {
            assertThat(f.component()).isEqualTo("Sensor");
            assertThat(f.subject()).isEqualTo("Sample");
            assertThat(f.message())
                .isEqualTo("Runnable 'Sample' in component 'Sensor' is periodic but has no period defined.");
        });
    }

    @Test
    void check_eventDrivenUnitWithoutPeriod_isNotReported() {
        Composition composition = CompositionBuilder.named("EventOnly")
            .component("Sensor", "Sensor").outbound("Speed").eventDriven("OnEvent")
            .build();

        assertThat(run(composition)).isEmpty();
    }

    @Test
    void check_reportsInComponentOrder() {
        Composition composition = CompositionBuilder.named("Order")
            .component("First", "")
                .behavioralUnit(new BehavioralUnit("R1", TriggerKind.PERIODIC, null))
            .component("Second", "")
            .build();

        assertThat(run(composition)).extracting(Finding::message).containsExactly(
            "Component 'First' has no ports defined.",
            "Runnable 'R1' in component 'First' is periodic but has no period defined.",
            "Component 'Second' has no ports defined."
        );
    }
}
