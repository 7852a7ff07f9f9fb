package com.comparchitect.core.validation.impl;

import com.comparchitect.core.composition.Composition;
import com.comparchitect.core.composition.CompositionBuilder;
import com.comparchitect.core.graph.ComponentGraph;
import com.comparchitect.core.model.Finding;
import com.comparchitect.core.model.FindingCategory;
import com.comparchitect.core.testing.CompositionFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link TopologyCheck}.
 *
 * <p>Pins the chosen semantics: the edge back to the DFS parent is never a cycle, each component
 * is reported at most once per pass, and parallel shared names between two components do not
 * form a cycle.
 */
class TopologyCheckTest {

    private final TopologyCheck check = new TopologyCheck();

    private List<Finding> run(Composition composition) {
        return check.check(composition, ComponentGraph.of(composition));
    }

    @Test
    @DisplayName("A sender/receiver pair between two components is not a cycle")
    void check_twoComponentLink_isNotACycle() {
        assertThat(run(CompositionFixtures.pair())).isEmpty();
    }

    @Test
    @DisplayName("Three pairwise linked components yield exactly one cycle finding")
    void check_triangle_reportsExactlyOnce() {
        List<Finding> findings = run(CompositionFixtures.triangle());

        assertThat(findings).hasSize(1);
        Finding finding = findings.get(0);
        assertThat(finding.category()).isEqualTo(FindingCategory.TOPOLOGY);
        assertThat(finding.component()).isEqualTo("A");
        assertThat(finding.message()).isEqualTo("Circular dependency detected involving component 'A'.");
    }

    @Test
    void check_severalSharedNamesBetweenTwoComponents_isNotACycle() {
        Composition composition = CompositionBuilder.named("Parallel")
            .component("A", "").outbound("X").inbound("Y")
            .component("B", "").inbound("X").outbound("Y")
            .build();

        assertThat(run(composition)).isEmpty();
    }

    @Test
    void check_chain_isNotACycle() {
        Composition composition = CompositionBuilder.named("Chain")
            .component("A", "").outbound("AB")
            .component("B", "").inbound("AB").outbound("BC")
            .component("C", "").inbound("BC").outbound("CD")
            .component("D", "").inbound("CD")
            .build();

        assertThat(run(composition)).isEmpty();
        assertThat(run(CompositionFixtures.powertrain())).isEmpty();
    }

    @Test
    void check_starAroundHub_isNotACycle() {
        Composition composition = CompositionBuilder.named("Star")
            .component("Hub", "").outbound("X").outbound("Y").outbound("Z")
            .component("L1", "").inbound("X")
            .component("L2", "").inbound("Y")
            .component("L3", "").inbound("Z")
            .build();

        assertThat(run(composition)).isEmpty();
    }

    @Test
    void check_disjointTriangles_reportOnePerTriangle() {
        Composition composition = CompositionBuilder.named("TwoTriangles")
            .component("A", "").outbound("AB").inbound("CA")
            .component("B", "").inbound("AB").outbound("BC")
            .component("C", "").inbound("BC").outbound("CA")
            .component("D", "").outbound("DE").inbound("FD")
            .component("E", "").inbound("DE").outbound("EF")
            .component("F", "").inbound("EF").outbound("FD")
            .build();

        assertThat(run(composition)).extracting(Finding::component).containsExactly("A", "D");
    }

    @Test
    void check_fullyConnectedFour_reportsEachComponentAtMostOnce() {
        Composition composition = CompositionBuilder.named("K4")
            .component("A", "").outbound("AB").outbound("AC").outbound("AD")
            .component("B", "").inbound("AB").outbound("BC").outbound("BD")
            .component("C", "").inbound("AC").inbound("BC").outbound("CD")
            .component("D", "").inbound("AD").inbound("BD").inbound("CD")
            .build();

        List<Finding> findings = run(composition);

        assertThat(findings).extracting(Finding::component).containsExactly("A", "B");
        assertThat(findings).extracting(Finding::component).doesNotHaveDuplicates();
    }

    @Test
    void check_nameSharedByThreeComponents_formsACycle() {
        Composition composition = CompositionBuilder.named("Broadcast")
            .component("A", "").outbound("X")
            .component("B", "").inbound("X")
            .component("C", "").inbound("X")
            .build();

        assertThat(run(composition)).hasSize(1);
    }

    @Test
    void check_cycleReachedFromLaterRoot_isStillReportedOnce() {
        Composition composition = CompositionBuilder.named("LateCycle")
            .component("Isolated", "").outbound("Nothing")
            .component("P", "").outbound("PQ").inbound("RP")
            .component("Q", "").inbound("PQ").outbound("QR")
            .component("R", "").inbound("QR").outbound("RP")
            .build();

        assertThat(run(composition)).extracting(Finding::component).containsExactly("P");
    }

    @Test
    void check_emptyComposition_reportsNothing() {
        assertThat(run(new Composition("Empty"))).isEmpty();
    }
}
