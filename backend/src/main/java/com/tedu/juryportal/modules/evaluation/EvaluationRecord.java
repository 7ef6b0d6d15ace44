package com.tedu.juryportal.modules.evaluation;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "evaluation_records",
        uniqueConstraints = @UniqueConstraint(name = "uk_evaluation_juror_group",
                columnNames = { "juror_id", "group_id" }),
        indexes = @Index(name = "idx_evaluation_juror", columnList = "juror_id"))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class EvaluationRecord {

    public static final String EDITING_FLAG = "editing";

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "juror_id", nullable = false, length = 200)
    private String jurorId;

    @Column(name = "juror_name", length = 100)
    private String jurorName;

    @Column(name = "juror_dept", length = 100)
    private String jurorDept;

    /** ISO-8601 string supplied by the client; compared lexicographically. */
    @Column(name = "submitted_at", length = 40)
    @Builder.Default
    private String timestamp = "";

    @Column(name = "group_id", nullable = false, length = 50)
    private String groupId;

    @Column(name = "group_name", length = 200)
    private String groupName;

    // Written communication
    private Integer design;

    private Integer technical;

    // Oral communication
    private Integer delivery;

    private Integer teamwork;

    private Integer total;

    @Column(columnDefinition = "TEXT")
    private String comments;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private EvaluationStatus status;

    @Column(name = "editing_flag", nullable = false, length = 10)
    @Builder.Default
    private String editingFlag = "";

    /** Copy of the juror's secret at write time, for exports only. */
    @Column(name = "juror_secret", length = 64)
    private String jurorSecret;

    @Column(name = "highlight_color", length = 7)
    private String highlightColor;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private Instant updatedAt;
}
