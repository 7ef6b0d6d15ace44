package com.tedu.juryportal.modules.evaluation.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.tedu.juryportal.modules.evaluation.EvaluationRecord;
import com.tedu.juryportal.modules.evaluation.EvaluationStatus;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;

@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class EvaluationRecordDto {
    private String jurorId;
    private String jurorName;
    private String jurorDept;
    private String timestamp;
    private String groupId;
    private String groupName;
    private Integer design;
    private Integer technical;
    private Integer delivery;
    private Integer teamwork;
    private Integer total;
    private String comments;
    private EvaluationStatus status;
    private String editingFlag;
    private Instant updatedAt;

    // export-only fields
    private String jurorSecret;
    private String highlightColor;

    public static EvaluationRecordDto from(EvaluationRecord r) {
        return base(r).build();
    }

    public static EvaluationRecordDto forExport(EvaluationRecord r) {
        return base(r)
                .jurorSecret(r.getJurorSecret())
                .highlightColor(r.getHighlightColor())
                .build();
    }

    private static EvaluationRecordDtoBuilder base(EvaluationRecord r) {
        return EvaluationRecordDto.builder()
                .jurorId(r.getJurorId())
                .jurorName(r.getJurorName())
                .jurorDept(r.getJurorDept())
                .timestamp(r.getTimestamp())
                .groupId(r.getGroupId())
                .groupName(r.getGroupName())
                .design(r.getDesign())
                .technical(r.getTechnical())
                .delivery(r.getDelivery())
                .teamwork(r.getTeamwork())
                .total(r.getTotal())
                .comments(r.getComments())
                .status(r.getStatus())
                .editingFlag(r.getEditingFlag() == null ? "" : r.getEditingFlag())
                .updatedAt(r.getUpdatedAt());
    }
}
