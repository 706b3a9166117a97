package com.raava.concierge.dialogue.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * What the current stage asked the user for. Set by the domain machine at the end of a turn
 * and read by the extractor on the next one.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class StageExpectation {

    private ExpectationKind kind = ExpectationKind.NOTHING;

    /**
     * Number of options offered when {@code kind} is OPTION_CHOICE.
     */
    private int optionCount;

    /**
     * Field answered by free text when {@code kind} is FREE_TEXT.
     */
    private SlotField freeTextField;

    /**
     * Fields the stage is still missing.
     */
    private Set<SlotField> expectedFields = EnumSet.noneOf(SlotField.class);

    public static StageExpectation nothing() {
        return new StageExpectation(ExpectationKind.NOTHING, 0, null, EnumSet.noneOf(SlotField.class));
    }

    public static StageExpectation choice(int optionCount, SlotField field) {
        return new StageExpectation(ExpectationKind.OPTION_CHOICE, optionCount, null, EnumSet.of(field));
    }

    public static StageExpectation freeText(SlotField field) {
        return new StageExpectation(ExpectationKind.FREE_TEXT, 0, field, EnumSet.of(field));
    }

    public static StageExpectation confirmation(SlotField field) {
        return new StageExpectation(ExpectationKind.CONFIRMATION, 0, null, EnumSet.of(field));
    }

    public static StageExpectation fields(List<SlotField> fields) {
        Set<SlotField> expected = fields.isEmpty() ? EnumSet.noneOf(SlotField.class) : EnumSet.copyOf(fields);
        return new StageExpectation(ExpectationKind.FIELDS, 0, null, expected);
    }

    public boolean expects(SlotField field) {
        return expectedFields != null && expectedFields.contains(field);
    }

    public boolean awaitsChoice() {
        return kind == ExpectationKind.OPTION_CHOICE && optionCount > 0;
    }
}
