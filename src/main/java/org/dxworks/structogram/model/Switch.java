package org.dxworks.structogram.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonTypeName;

import java.util.ArrayList;
import java.util.List;

/**
 * Multi-way branch on the discriminant in {@code text}.
 * <p>
 * {@code defaultCase} is always present; {@code defaultEnabled} decides whether it is rendered
 * and generated. {@code columnWidths}, when present, has one entry per visible column.
 */
@JsonTypeName("CaseNode")
public final class Switch implements Node {
    public final String id;
    public final String text;
    public final List<CaseLabel> cases;
    @JsonProperty("defaultOn")
    public final boolean defaultEnabled;
    @JsonProperty("defaultNode")
    public final CaseLabel defaultCase;
    public final List<Double> columnWidths;
    public final Node followElement;

    @JsonCreator
    public Switch(@JsonProperty("id") String id,
                  @JsonProperty("text") String text,
                  @JsonProperty("cases") List<CaseLabel> cases,
                  @JsonProperty("defaultOn") boolean defaultEnabled,
                  @JsonProperty("defaultNode") CaseLabel defaultCase,
                  @JsonProperty("columnWidths") List<Double> columnWidths,
                  @JsonProperty("followElement") Node followElement) {
        this.id = id;
        this.text = text;
        this.cases = cases == null ? List.of() : Nodes.copyWithoutNulls(cases);
        this.defaultEnabled = defaultEnabled;
        this.defaultCase = defaultCase;
        this.columnWidths = Nodes.copyWithoutNulls(columnWidths);
        this.followElement = followElement;
    }

    /** Number of rendered columns: one per case plus the default when enabled. */
    public int columnCount() {
        return cases.size() + (defaultEnabled ? 1 : 0);
    }

    /** Returns a copy without the case at {@code index}; column widths no longer fit and are dropped. */
    public Switch withoutCase(int index) {
        List<CaseLabel> remaining = new ArrayList<>(cases);
        remaining.remove(index);
        return new Switch(id, text, remaining, defaultEnabled, defaultCase, null, followElement);
    }

    public Switch withDefault(boolean enabled, CaseLabel defaultCase) {
        List<Double> widths = enabled == defaultEnabled ? columnWidths : null;
        return new Switch(id, text, cases, enabled, defaultCase, widths, followElement);
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public String text() {
        return text;
    }

    @Override
    public Node follow() {
        return followElement;
    }

    @Override
    public String typeName() {
        return "CaseNode";
    }

    @Override
    public List<NodeSlot> slots() {
        List<NodeSlot> slots = new ArrayList<>(cases.size() + 2);
        slots.add(NodeSlot.of(Slot.FOLLOW, followElement));
        for (int i = 0; i < cases.size(); i++) {
            slots.add(new NodeSlot(Slot.CASE, i, cases.get(i)));
        }
        slots.add(NodeSlot.of(Slot.DEFAULT_CASE, defaultCase));
        return slots;
    }

    @Override
    public Switch withSlot(Slot slot, int index, Node node) {
        return switch (slot) {
            case FOLLOW -> new Switch(id, text, cases, defaultEnabled, defaultCase, columnWidths, node);
            case CASE -> {
                List<CaseLabel> replaced = new ArrayList<>(cases);
                replaced.set(index, asCaseLabel(node));
                yield new Switch(id, text, replaced, defaultEnabled, defaultCase, columnWidths, followElement);
            }
            case DEFAULT_CASE -> new Switch(id, text, cases, defaultEnabled, asCaseLabel(node), columnWidths, followElement);
            default -> throw new IllegalArgumentException("CaseNode has no slot " + slot.getFieldName());
        };
    }

    private static CaseLabel asCaseLabel(Node node) {
        if (node instanceof CaseLabel caseLabel) {
            return caseLabel;
        }
        throw new IllegalArgumentException("Switch columns must be InsertCase nodes, got "
                + (node == null ? "null" : node.typeName()));
    }

    @Override
    public Switch withId(String id) {
        return new Switch(id, text, cases, defaultEnabled, defaultCase, columnWidths, followElement);
    }

    @Override
    public Switch withText(String text) {
        return new Switch(id, text, cases, defaultEnabled, defaultCase, columnWidths, followElement);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitSwitch(this);
    }
}
