package com.tedu.juryportal.modules.evaluation;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Picks one record per group: highest status priority first, then the later
 * timestamp.
 */
public final class ScorePrecedence {

    /** Numeric group ids sort numerically, anything else falls back to text order. */
    public static final Comparator<String> GROUP_ORDER = (a, b) -> {
        Long na = parseLong(a);
        Long nb = parseLong(b);
        if (na != null && nb != null) {
            return Long.compare(na, nb);
        }
        return String.valueOf(a).compareTo(String.valueOf(b));
    };

    private ScorePrecedence() {
    }

    public static List<EvaluationRecord> bestPerGroup(List<EvaluationRecord> records) {
        Map<String, EvaluationRecord> best = new LinkedHashMap<>();
        for (EvaluationRecord record : records) {
            String groupId = record.getGroupId() == null ? "" : record.getGroupId().trim();
            if (groupId.isEmpty()) {
                continue;
            }
            best.merge(groupId, record, (prev, next) -> outranks(next, prev) ? next : prev);
        }
        List<EvaluationRecord> result = new ArrayList<>(best.values());
        result.sort(Comparator.comparing((EvaluationRecord r) -> r.getGroupId().trim(), GROUP_ORDER));
        return result;
    }

    static boolean outranks(EvaluationRecord candidate, EvaluationRecord current) {
        int cp = EvaluationStatus.priorityOf(candidate.getStatus());
        int pp = EvaluationStatus.priorityOf(current.getStatus());
        if (cp != pp) {
            return cp > pp;
        }
        return nvl(candidate.getTimestamp()).compareTo(nvl(current.getTimestamp())) > 0;
    }

    private static String nvl(String s) {
        return s == null ? "" : s;
    }

    private static Long parseLong(String s) {
        if (s == null) {
            return null;
        }
        try {
            return Long.parseLong(s.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
