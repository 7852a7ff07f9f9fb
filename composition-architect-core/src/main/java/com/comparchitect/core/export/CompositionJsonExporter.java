package com.comparchitect.core.export;

import com.comparchitect.core.composition.Component;
import com.comparchitect.core.composition.Composition;
import com.comparchitect.core.model.BehavioralUnit;
import com.comparchitect.core.model.Contract;
import com.comparchitect.core.model.TriggerKind;
import com.comparchitect.core.renderer.GeneratedFile;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Exports a composition as a JSON document indented with four spaces.
 *
 * <p>The exporter only reads the composition; a failed export leaves it untouched.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * CompositionJsonExporter exporter = new CompositionJsonExporter();
 * GeneratedFile file = exporter.toGeneratedFile(composition, "composition.json");
 * new FileSystemRenderer().render(new GeneratedOutput(List.of(file)), context);
 * }</pre>
 *
 * @see CompositionDocument
 * @see CompositionJsonReader
 */
public class CompositionJsonExporter {

    private static final Logger log = LoggerFactory.getLogger(CompositionJsonExporter.class);

    static final String CONTENT_TYPE = "application/json";

    private static final DefaultIndenter INDENTER = new DefaultIndenter("    ", "\n");
    private static final ObjectWriter JSON_WRITER = new ObjectMapper().writer(
        new DefaultPrettyPrinter()
            .withObjectIndenter(INDENTER)
            .withArrayIndenter(INDENTER));

    /**
     * Converts a composition into its document form.
     *
     * @param composition composition to convert
     * @return document snapshot
     */
    public CompositionDocument toDocument(Composition composition) {
        Objects.requireNonNull(composition, "composition must not be null");
        return new CompositionDocument(
            composition.getName(),
            composition.getComponents().stream().map(this::toEntry).toList()
        );
    }

    /**
     * Serializes a composition to a JSON string.
     *
     * @param composition composition to serialize
     * @return JSON document
     * @throws IllegalStateException if serialization fails
     */
    public String toJson(Composition composition) {
        CompositionDocument document = toDocument(composition);
        try {
            String json = JSON_WRITER.writeValueAsString(document);
            log.debug("Serialized composition '{}' ({} components, {} chars)",
                composition.getName(), composition.size(), json.length());
            return json;
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize composition: " + composition.getName(), e);
        }
    }

    /**
     * Serializes a composition into a file ready for rendering.
     *
     * @param composition composition to serialize
     * @param relativePath target path relative to the output directory
     * @return generated file
     */
    public GeneratedFile toGeneratedFile(Composition composition, String relativePath) {
        return new GeneratedFile(relativePath, toJson(composition), CONTENT_TYPE);
    }

    private CompositionDocument.ComponentEntry toEntry(Component component) {
        return new CompositionDocument.ComponentEntry(
            component.getName(),
            component.getType(),
            component.getEndpoints().stream()
                .map(e -> new CompositionDocument.PortEntry(e.name(), e.direction().externalName()))
                .toList(),
            component.getBehavioralUnits().stream().map(this::toEntry).toList(),
            component.getContracts().stream().map(this::toEntry).toList()
        );
    }

    private CompositionDocument.RunnableEntry toEntry(BehavioralUnit unit) {
        Integer period = unit.trigger() == TriggerKind.PERIODIC ? unit.periodMillis() : null;
        return new CompositionDocument.RunnableEntry(unit.name(), unit.trigger().externalName(), period);
    }

    private CompositionDocument.InterfaceEntry toEntry(Contract contract) {
        return new CompositionDocument.InterfaceEntry(
            contract.name(),
            contract.kind().externalName(),
            contract.endpointNames(),
            contract.dataFields().stream()
                .map(f -> new CompositionDocument.DataElementEntry(f.name(), f.type()))
                .toList()
        );
    }
}
