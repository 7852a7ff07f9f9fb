package com.comparchitect.core.export;

import com.comparchitect.core.composition.Component;
import com.comparchitect.core.composition.Composition;
import com.comparchitect.core.model.BehavioralUnit;
import com.comparchitect.core.model.ContractKind;
import com.comparchitect.core.model.DataField;
import com.comparchitect.core.model.EndpointDirection;
import com.comparchitect.core.model.TriggerKind;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Reads a composition document back into a {@link Composition}.
 *
 * <p>The document is rebuilt through the registration methods of {@link Composition} and
 * {@link Component}, so duplicate names and unknown endpoint references raise the same
 * construction errors as programmatic building. Within a component, ports are registered before
 * runnables and interfaces.
 */
public class CompositionJsonReader {

    private static final Logger log = LoggerFactory.getLogger(CompositionJsonReader.class);
    private static final ObjectMapper JSON_MAPPER = new ObjectMapper()
        .disable(DeserializationFeature.ACCEPT_FLOAT_AS_INT);

    /**
     * Reads a composition from a JSON file.
     *
     * @param path path to the JSON document
     * @return rebuilt composition
     * @throws IOException if the file cannot be read
     * @throws CompositionFormatException if the document is malformed
     * @throws com.comparchitect.core.composition.CompositionException on construction errors
     */
    public Composition read(Path path) throws IOException {
        log.debug("Reading composition from: {}", path);
        return read(Files.readString(path));
    }

    /**
     * Reads a composition from a JSON string.
     *
     * @param json JSON document
     * @return rebuilt composition
     * @throws CompositionFormatException if the document is malformed
     * @throws com.comparchitect.core.composition.CompositionException on construction errors
     */
    public Composition read(String json) {
        CompositionDocument document;
        try {
            document = JSON_MAPPER.readValue(json, CompositionDocument.class);
        } catch (JsonProcessingException e) {
            throw new CompositionFormatException("Invalid composition document: " + e.getOriginalMessage(), e);
        }
        if (document == null) {
            throw new CompositionFormatException("Composition document is empty");
        }
        return fromDocument(document);
    }

    /**
     * Rebuilds a composition from its document form.
     *
     * @param document document snapshot
     * @return rebuilt composition
     */
    public Composition fromDocument(CompositionDocument document) {
        String name = require(document.compositionName(), "composition_name");
        Composition composition = new Composition(name);

        for (CompositionDocument.ComponentEntry entry : entries(document.components(), "component")) {
            composition.addComponent(toComponent(entry));
        }
        log.info("Read composition '{}' with {} components", name, composition.size());
        return composition;
    }

    private Component toComponent(CompositionDocument.ComponentEntry entry) {
        Component component = new Component(require(entry.name(), "component name"), entry.type());

        for (CompositionDocument.PortEntry port : entries(entry.ports(), "port")) {
            component.addEndpoint(require(port.name(), "port name"), parse(() -> EndpointDirection.fromExternalName(port.type())));
        }
        for (CompositionDocument.RunnableEntry runnable : entries(entry.runnables(), "runnable")) {
            TriggerKind trigger = parse(() -> TriggerKind.fromExternalName(runnable.trigger()));
            Integer period = trigger == TriggerKind.PERIODIC ? runnable.period() : null;
            component.addBehavioralUnit(parse(() -> new BehavioralUnit(require(runnable.name(), "runnable name"), trigger, period)));
        }
        for (CompositionDocument.InterfaceEntry contract : entries(entry.interfaces(), "interface")) {
            ContractKind kind = parse(() -> ContractKind.fromExternalName(contract.type()));
            List<DataField> fields = entries(contract.dataElements(), "data element").stream()
                .map(d -> new DataField(require(d.name(), "data element name"), d.type() == null ? "" : d.type()))
                .toList();
            component.addContract(require(contract.name(), "interface name"), kind,
                entries(contract.associatedPorts(), "associated port"), fields);
        }
        return component;
    }

    private static <T> T parse(Supplier<T> parser) {
        try {
            return parser.get();
        } catch (IllegalArgumentException e) {
            throw new CompositionFormatException(e.getMessage(), e);
        }
    }

    private static String require(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new CompositionFormatException("Missing required value: " + field);
        }
        return value;
    }

    /**
     * Returns the entries of an optional list. A missing list reads as empty; a null entry is
     * rejected.
     */
    private static <T> List<T> entries(List<T> values, String kind) {
        if (values == null) {
            return List.of();
        }
        if (values.stream().anyMatch(Objects::isNull)) {
            throw new CompositionFormatException("Missing required value: " + kind);
        }
        return values;
    }
}
