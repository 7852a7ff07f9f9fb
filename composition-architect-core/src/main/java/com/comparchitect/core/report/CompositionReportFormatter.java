package com.comparchitect.core.report;

import com.comparchitect.core.composition.Component;
import com.comparchitect.core.composition.Composition;
import com.comparchitect.core.model.BehavioralUnit;
import com.comparchitect.core.model.Contract;
import com.comparchitect.core.model.DataField;
import com.comparchitect.core.model.Endpoint;
import com.comparchitect.core.model.TriggerKind;
import com.comparchitect.core.renderer.GeneratedFile;
import com.comparchitect.core.validation.ValidationReport;

import java.util.List;
import java.util.Objects;

/**
 * Formats a composition and its validation report as indented plain text.
 *
 * <p>Nesting depth is shown with leading dashes:
 * <pre>
 * SOFTWARE Composition: Powertrain
 * --Software Component 1: Sensor (Type: Sensor)
 * ---Ports Associated:
 * ----Speed (Type: sender)
 * ---Runnables Associated:
 * ----Sample (Trigger: periodic, Period: 10)
 * ---Interfaces Associated:
 * ----SpeedIf (Type: senderReceiver, Associated with ports: Speed)
 * ------Data Elements:
 * -------speed (Type: float)
 * </pre>
 */
public class CompositionReportFormatter {

    private static final String NEWLINE = "\n";
    private static final String COMPOSITION_HEADER = "SOFTWARE Composition: ";
    private static final String COMPONENT_PREFIX = "--Software Component ";
    private static final String PORTS_HEADER = "---Ports Associated:";
    private static final String RUNNABLES_HEADER = "---Runnables Associated:";
    private static final String INTERFACES_HEADER = "---Interfaces Associated:";
    private static final String DATA_ELEMENTS_HEADER = "------Data Elements:";
    private static final String ITEM = "----";
    private static final String DATA_ITEM = "-------";
    private static final String NOT_APPLICABLE = "N/A";

    private static final String VALID = "Configuration is valid.";
    private static final String ERRORS_HEADER = "Validation Errors:";

    /**
     * Formats the composition tree.
     *
     * @param composition composition to format
     * @return formatted text
     */
    public String formatComposition(Composition composition) {
        Objects.requireNonNull(composition, "composition must not be null");
        StringBuilder sb = new StringBuilder();
        sb.append(COMPOSITION_HEADER).append(composition.getName()).append(NEWLINE);

        List<Component> components = composition.getComponents();
        for (int i = 0; i < components.size(); i++) {
            Component component = components.get(i);
            sb.append(COMPONENT_PREFIX).append(i + 1).append(": ").append(component.getName())
                .append(" (Type: ").append(component.getType()).append(")").append(NEWLINE);
            appendComponent(sb, component);
        }
        return sb.toString();
    }

    /**
     * Formats the outcome of a validation pass.
     *
     * @param report validation report
     * @return "Configuration is valid." or a bulleted list of findings
     */
    public String formatReport(ValidationReport report) {
        Objects.requireNonNull(report, "report must not be null");
        if (report.isValid()) {
            return VALID + NEWLINE;
        }
        StringBuilder sb = new StringBuilder(ERRORS_HEADER).append(NEWLINE);
        report.messages().forEach(m -> sb.append("- ").append(m).append(NEWLINE));
        return sb.toString();
    }

    /**
     * Wraps the composition tree and its validation report into one text file.
     *
     * @param composition composition
     * @param report validation report of the same composition
     * @param relativePath target path
     * @return generated file
     */
    public GeneratedFile toGeneratedFile(Composition composition, ValidationReport report, String relativePath) {
        String content = formatComposition(composition) + NEWLINE + formatReport(report);
        return GeneratedFile.text(relativePath, content);
    }

    private void appendComponent(StringBuilder sb, Component component) {
        sb.append(PORTS_HEADER).append(NEWLINE);
        if (component.getEndpoints().isEmpty()) {
            sb.append(ITEM).append("No ports associated.").append(NEWLINE);
        }
        for (Endpoint endpoint : component.getEndpoints()) {
            sb.append(ITEM).append(endpoint.name())
                .append(" (Type: ").append(endpoint.direction().externalName()).append(")").append(NEWLINE);
        }

        sb.append(RUNNABLES_HEADER).append(NEWLINE);
        if (component.getBehavioralUnits().isEmpty()) {
            sb.append(ITEM).append("No runnables associated.").append(NEWLINE);
        }
        for (BehavioralUnit unit : component.getBehavioralUnits()) {
            sb.append(ITEM).append(unit.name())
                .append(" (Trigger: ").append(unit.trigger().externalName())
                .append(", Period: ").append(periodText(unit)).append(")").append(NEWLINE);
        }

        sb.append(INTERFACES_HEADER).append(NEWLINE);
        if (component.getContracts().isEmpty()) {
            sb.append(ITEM).append("No interfaces associated.").append(NEWLINE);
        }
        for (Contract contract : component.getContracts()) {
            appendContract(sb, contract);
        }
    }

    private void appendContract(StringBuilder sb, Contract contract) {
        sb.append(ITEM).append(contract.name())
            .append(" (Type: ").append(contract.kind().externalName())
            .append(", Associated with ports: ").append(String.join(", ", contract.endpointNames()))
            .append(")").append(NEWLINE);
        if (contract.dataFields().isEmpty()) {
            sb.append("------No data elements associated.").append(NEWLINE);
            return;
        }
        sb.append(DATA_ELEMENTS_HEADER).append(NEWLINE);
        for (DataField field : contract.dataFields()) {
            sb.append(DATA_ITEM).append(field.name())
                .append(" (Type: ").append(field.type()).append(")").append(NEWLINE);
        }
    }

    private static String periodText(BehavioralUnit unit) {
        if (unit.trigger() != TriggerKind.PERIODIC) {
            return NOT_APPLICABLE;
        }
        return unit.periodMillis() == null ? "None" : String.valueOf(unit.periodMillis());
    }
}
