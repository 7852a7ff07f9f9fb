package com.comparchitect.core.composition;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link Composition}.
 */
class CompositionTest {

    @Test
    void addComponent_preservesInsertionOrder() {
        Composition composition = new Composition("Vehicle");
        composition.addComponent(new Component("Zeta", "Sensor"));
        composition.addComponent(new Component("Alpha", "Controller"));
        composition.addComponent(new Component("Mid", "Actuator"));

        assertThat(composition.componentNames()).containsExactly("Zeta", "Alpha", "Mid");
        assertThat(composition.size()).isEqualTo(3);
    }

    @Test
    void addComponent_duplicateName_throwsAndKeepsCount() {
        Composition composition = new Composition("Vehicle");
        composition.addComponent(new Component("Sensor", "Sensor"));

        assertThatThrownBy(() -> composition.addComponent(new Component("Sensor", "Other")))
            .isInstanceOf(DuplicateNameException.class)
            .hasMessageContaining("'Sensor' already exists")
            .satisfies(e -> {
                DuplicateNameException duplicate = (DuplicateNameException) e;
                assertThat(duplicate.getEntityKind()).isEqualTo("SoftwareComponent");
                assertThat(duplicate.getName()).isEqualTo("Sensor");
            });

        assertThat(composition.size()).isEqualTo(1);
        assertThat(composition.getComponent("Sensor")).get()
            .extracting(Component::getType).isEqualTo("Sensor");
    }

    @Test
    void addComponent_namesAreCaseSensitive() {
        Composition composition = new Composition("Vehicle");
        composition.addComponent(new Component("sensor", ""));
        composition.addComponent(new Component("Sensor", ""));

        assertThat(composition.componentNames()).containsExactly("sensor", "Sensor");
    }

    @Test
    void getComponents_isUnmodifiable() {
        Composition composition = new Composition("Vehicle");

        assertThatThrownBy(() -> composition.getComponents().add(new Component("X", "")))
            .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void newComposition_isEmpty() {
        Composition composition = new Composition("Empty");

        assertThat(composition.isEmpty()).isTrue();
        assertThat(composition.componentNames()).isEmpty();
        assertThat(composition.hasComponent("anything")).isFalse();
    }
}
