package com.comparchitect.core.export;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Serializable snapshot of a composition, mirroring the exported JSON document.
 *
 * <p><b>Example JSON:</b>
 * <pre>{@code
 * {
 *     "composition_name": "Powertrain",
 *     "components": [
 *         {
 *             "name": "Sensor",
 *             "type": "Sensor",
 *             "ports": [ { "name": "Speed", "type": "sender" } ],
 *             "runnables": [ { "name": "Sample", "trigger": "periodic", "period": 10 } ],
 *             "interfaces": [
 *                 {
 *                     "name": "SpeedIf",
 *                     "type": "senderReceiver",
 *                     "associated_ports": [ "Speed" ],
 *                     "data_elements": [ { "name": "speed", "type": "float" } ]
 *                 }
 *             ]
 *         }
 *     ]
 * }
 * }</pre>
 *
 * @param compositionName composition name
 * @param components components in composition order
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CompositionDocument(
    @JsonProperty("composition_name") String compositionName,
    @JsonProperty("components") List<ComponentEntry> components
) {

    /**
     * One component of the document.
     *
     * @param name component name
     * @param type component type label
     * @param ports endpoints
     * @param runnables behavioral units
     * @param interfaces contracts
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ComponentEntry(
        @JsonProperty("name") String name,
        @JsonProperty("type") String type,
        @JsonProperty("ports") List<PortEntry> ports,
        @JsonProperty("runnables") List<RunnableEntry> runnables,
        @JsonProperty("interfaces") List<InterfaceEntry> interfaces
    ) {}

    /**
     * @param name endpoint name
     * @param type "sender" or "receiver"
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record PortEntry(
        @JsonProperty("name") String name,
        @JsonProperty("type") String type
    ) {}

    /**
     * @param name unit name
     * @param trigger "periodic" or "event-based"
     * @param period period in milliseconds, null unless periodic
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record RunnableEntry(
        @JsonProperty("name") String name,
        @JsonProperty("trigger") String trigger,
        @JsonProperty("period") Integer period
    ) {}

    /**
     * @param name contract name
     * @param type "clientServer" or "senderReceiver"
     * @param associatedPorts names of associated endpoints
     * @param dataElements data fields
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record InterfaceEntry(
        @JsonProperty("name") String name,
        @JsonProperty("type") String type,
        @JsonProperty("associated_ports") List<String> associatedPorts,
        @JsonProperty("data_elements") List<DataElementEntry> dataElements
    ) {}

    /**
     * @param name field name
     * @param type free-form type tag
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record DataElementEntry(
        @JsonProperty("name") String name,
        @JsonProperty("type") String type
    ) {}
}
