package com.tedu.juryportal.modules.evaluation;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.tedu.juryportal.exception.BusinessException;

import java.util.Arrays;
import java.util.Locale;

public enum EvaluationStatus {
    IN_PROGRESS("in_progress", 1),
    GROUP_SUBMITTED("group_submitted", 2),
    ALL_SUBMITTED("all_submitted", 3);

    private final String wireValue;
    private final int priority;

    EvaluationStatus(String wireValue, int priority) {
        this.wireValue = wireValue;
        this.priority = priority;
    }

    @JsonValue
    public String getWireValue() {
        return wireValue;
    }

    /** Precedence used when several records compete for the same group. */
    public int getPriority() {
        return priority;
    }

    /** Missing status means a final submission. */
    @JsonCreator
    public static EvaluationStatus fromWire(String value) {
        if (value == null || value.isBlank()) {
            return ALL_SUBMITTED;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(s -> s.wireValue.equals(normalized))
                .findFirst()
                .orElseThrow(() -> new BusinessException("Unknown evaluation status: " + value));
    }

    public static int priorityOf(EvaluationStatus status) {
        return status == null ? 0 : status.priority;
    }
}
