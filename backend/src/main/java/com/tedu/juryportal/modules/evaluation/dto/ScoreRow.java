package com.tedu.juryportal.modules.evaluation.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** One incoming score submission for a single group. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScoreRow {

    private String jurorId;

    @Size(max = 100)
    private String jurorName;

    @Size(max = 100)
    private String jurorDept;

    @Size(max = 40)
    private String timestamp;

    @NotBlank(message = "Group id is required")
    @Size(max = 50)
    private String groupId;

    @Size(max = 200)
    private String groupName;

    @Min(0) @Max(30)
    private Integer design;

    @Min(0) @Max(30)
    private Integer technical;

    @Min(0) @Max(30)
    private Integer delivery;

    @Min(0) @Max(10)
    private Integer teamwork;

    @Min(0) @Max(100)
    private Integer total;

    @Size(max = 5000)
    private String comments;

    // in_progress | group_submitted | all_submitted; blank means all_submitted
    private String status;
}
