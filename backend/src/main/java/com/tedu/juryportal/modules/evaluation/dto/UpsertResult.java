package com.tedu.juryportal.modules.evaluation.dto;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class UpsertResult {
    private int updated;
    private int added;
    private int skippedStale;
    // all_submitted rows that kept their status because no reset window was open
    private int regressionsIgnored;
    // rows claiming another juror's identity
    private int dropped;
}
