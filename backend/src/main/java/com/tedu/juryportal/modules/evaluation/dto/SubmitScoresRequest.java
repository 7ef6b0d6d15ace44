package com.tedu.juryportal.modules.evaluation.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.util.List;

@Data
public class SubmitScoresRequest {

    @NotNull(message = "rows is required")
    private List<@Valid ScoreRow> rows;
}
