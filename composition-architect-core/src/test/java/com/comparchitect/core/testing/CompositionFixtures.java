package com.comparchitect.core.testing;

import com.comparchitect.core.composition.Composition;
import com.comparchitect.core.composition.CompositionBuilder;
import com.comparchitect.core.model.ContractKind;
import com.comparchitect.core.model.DataField;

import java.util.List;

/**
 * Shared compositions for core tests.
 */
public final class CompositionFixtures {

    private CompositionFixtures() {
    }

    /**
     * Sensor sends "Speed" to Controller, which sends "Torque" to Actuator. Valid.
     */
    public static Composition powertrain() {
        return CompositionBuilder.named("Powertrain")
            .component("Sensor", "Sensor")
                .outbound("Speed")
                .periodic("Sample", 10)
                .contract("SpeedIf", ContractKind.PUBLISH_SUBSCRIBE, List.of("Speed"),
                    new DataField("speed", "float"), new DataField("timestamp", "int"))
            .component("Controller", "Controller")
                .inbound("Speed")
                .outbound("Torque")
                .eventDriven("OnSpeed")
                .periodic("Regulate", 5)
                .contract("TorqueIf", ContractKind.CLIENT_SERVER, List.of("Torque"))
            .component("Actuator", "Actuator")
                .inbound("Torque")
                .eventDriven("ApplyTorque")
            .build();
    }

    /**
     * A, B and C are pairwise linked through three distinct, matched endpoint names.
     */
    public static Composition triangle() {
        return CompositionBuilder.named("Triangle")
            .component("A", "Node").outbound("AB").inbound("CA")
            .component("B", "Node").inbound("AB").outbound("BC")
            .component("C", "Node").inbound("BC").outbound("CA")
            .build();
    }

    /**
     * A sends "X" to B. The smallest valid, connected composition.
     */
    public static Composition pair() {
        return CompositionBuilder.named("Pair")
            .component("A", "Sender").outbound("X")
            .component("B", "Receiver").inbound("X")
            .build();
    }
}
