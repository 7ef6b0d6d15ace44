package com.tedu.juryportal.modules.evaluation;

/**
 * Cosmetic row colour stored next to each record for spreadsheet-style
 * exports. Nothing reads it back when resolving submissions.
 */
public final class StatusHighlight {

    public static final String PALE_YELLOW = "#fef9c3";
    public static final String PALE_GREEN = "#dcfce7";
    public static final String GREEN = "#bbf7d0";
    public static final String NONE = "#ffffff";

    private StatusHighlight() {
    }

    public static String forStatus(EvaluationStatus status) {
        if (status == null) {
            return NONE;
        }
        return switch (status) {
            case IN_PROGRESS -> PALE_YELLOW;
            case GROUP_SUBMITTED -> PALE_GREEN;
            case ALL_SUBMITTED -> GREEN;
        };
    }
}
