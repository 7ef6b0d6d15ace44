package com.tedu.juryportal.modules.evaluation;

import com.tedu.juryportal.exception.BusinessException;
import com.tedu.juryportal.modules.credential.JurorAccountStore;
import com.tedu.juryportal.modules.evaluation.dto.ScoreRow;
import com.tedu.juryportal.modules.evaluation.dto.UpsertResult;
import com.tedu.juryportal.modules.unlock.ResetUnlockService;
import com.tedu.juryportal.support.InMemoryCredentialStore;
import com.tedu.juryportal.support.InMemoryEvaluationRecords;
import com.tedu.juryportal.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EvaluationUpsertServiceTest {

    private static final String JUROR = "j1";

    private InMemoryEvaluationRecords records;
    private JurorAccountStore accounts;
    private MutableClock clock;
    private ResetUnlockService resetUnlockService;
    private EvaluationUpsertService service;

    @BeforeEach
    void setUp() {
        records = new InMemoryEvaluationRecords();
        accounts = new JurorAccountStore(new InMemoryCredentialStore());
        clock = new MutableClock(Instant.parse("2025-06-01T10:00:00Z"));
        resetUnlockService = new ResetUnlockService(accounts, records.repository(), clock, 20);
        service = new EvaluationUpsertService(records.repository(), accounts, resetUnlockService);

        accounts.setSecret(JUROR, "secret-1");
        accounts.setDisplayInfo(JUROR, "Ada", "EE");
    }

    private static ScoreRow row(String groupId, String timestamp, String status, int total) {
        return ScoreRow.builder()
                .jurorId(JUROR)
                .groupId(groupId)
                .groupName("Group " + groupId)
                .timestamp(timestamp)
                .design(total / 4)
                .technical(total / 4)
                .delivery(total / 4)
                .teamwork(Math.min(10, total - 3 * (total / 4)))
                .total(total)
                .comments("ok")
                .status(status)
                .build();
    }

    private UpsertResult submit(ScoreRow... rows) {
        return service.submit(JUROR, List.of(rows));
    }

    @Nested
    @DisplayName("composite key upsert")
    class CompositeKey {

        @Test
        @DisplayName("should keep one record reflecting the later of two submissions")
        void laterSubmissionWins() {
            UpsertResult first = submit(row("1", "2025-06-01T10:00:00Z", "in_progress", 40));
            UpsertResult second = submit(row("1", "2025-06-01T10:05:00Z", "group_submitted", 80));

            assertThat(first.getAdded()).isEqualTo(1);
            assertThat(first.getUpdated()).isZero();
            assertThat(second.getAdded()).isZero();
            assertThat(second.getUpdated()).isEqualTo(1);

            EvaluationRecord stored = records.only(JUROR, "1");
            assertThat(stored.getTotal()).isEqualTo(80);
            assertThat(stored.getStatus()).isEqualTo(EvaluationStatus.GROUP_SUBMITTED);
            assertThat(stored.getTimestamp()).isEqualTo("2025-06-01T10:05:00Z");
        }

        @Test
        @DisplayName("should treat an identical resubmission as an update, not a new record")
        void idempotentRetry() {
            ScoreRow r = row("2", "2025-06-01T10:00:00Z", "group_submitted", 70);

            submit(r);
            UpsertResult retry = submit(r);

            assertThat(retry.getUpdated()).isEqualTo(1);
            assertThat(retry.getAdded()).isZero();
            assertThat(records.byJuror(JUROR)).hasSize(1);
        }

        @Test
        @DisplayName("should collapse duplicates within a batch to the last occurrence")
        void intraBatchLastWins() {
            UpsertResult result = submit(
                    row("1", "2025-06-01T10:00:00Z", "in_progress", 10),
                    row("2", "2025-06-01T10:00:00Z", "in_progress", 20),
                    row("1", "2025-06-01T09:00:00Z", "group_submitted", 30));

            assertThat(result.getAdded()).isEqualTo(2);
            assertThat(records.only(JUROR, "1").getTotal()).isEqualTo(30);
            assertThat(records.only(JUROR, "1").getStatus()).isEqualTo(EvaluationStatus.GROUP_SUBMITTED);
        }

        @Test
        @DisplayName("should drop rows claiming another juror's identity")
        void dropsForeignRows() {
            ScoreRow forged = row("1", "2025-06-01T10:00:00Z", "all_submitted", 100);
            forged.setJurorId("someone-else");

            UpsertResult result = submit(forged, row("2", "2025-06-01T10:00:00Z", "in_progress", 20));

            assertThat(result.getDropped()).isEqualTo(1);
            assertThat(result.getAdded()).isEqualTo(1);
            assertThat(records.all()).extracting(EvaluationRecord::getJurorId).containsOnly(JUROR);
            assertThat(records.all()).extracting(EvaluationRecord::getGroupId).containsExactly("2");
        }

        @Test
        @DisplayName("should copy the current secret and fall back to account metadata for name/dept")
        void fillsRecordMetadata() {
            submit(row("1", "2025-06-01T10:00:00Z", "in_progress", 10));

            EvaluationRecord stored = records.only(JUROR, "1");
            assertThat(stored.getJurorSecret()).isEqualTo("secret-1");
            assertThat(stored.getJurorName()).isEqualTo("Ada");
            assertThat(stored.getJurorDept()).isEqualTo("EE");
        }

        @Test
        @DisplayName("should default a missing status to all_submitted")
        void defaultStatus() {
            submit(row("1", "2025-06-01T10:00:00Z", null, 90));

            assertThat(records.only(JUROR, "1").getStatus()).isEqualTo(EvaluationStatus.ALL_SUBMITTED);
        }

        @Test
        @DisplayName("should reject the whole batch on an unknown status before writing anything")
        void unknownStatus() {
            assertThatThrownBy(() -> submit(
                    row("1", "2025-06-01T10:00:00Z", "in_progress", 10),
                    row("2", "2025-06-01T10:00:00Z", "finished", 10)))
                    .isInstanceOf(BusinessException.class)
                    .hasMessageContaining("finished");

            assertThat(records.all()).isEmpty();
        }
    }

    @Nested
    @DisplayName("stale writes")
    class StaleWrites {

        @Test
        @DisplayName("should skip an older submission and not count it as updated")
        void olderIsSkipped() {
            submit(row("1", "2025-06-01T10:05:00Z", "group_submitted", 80));

            UpsertResult result = submit(row("1", "2025-06-01T10:00:00Z", "in_progress", 10));

            assertThat(result.getUpdated()).isZero();
            assertThat(result.getAdded()).isZero();
            assertThat(result.getSkippedStale()).isEqualTo(1);
            assertThat(records.only(JUROR, "1").getTotal()).isEqualTo(80);
        }

        @Test
        @DisplayName("should accept any timestamp when the stored one is empty")
        void emptyStoredTimestamp() {
            submit(row("1", "", "in_progress", 10));

            UpsertResult result = submit(row("1", "2000-01-01T00:00:00Z", "in_progress", 20));

            assertThat(result.getUpdated()).isEqualTo(1);
            assertThat(records.only(JUROR, "1").getTotal()).isEqualTo(20);
        }

        @Test
        @DisplayName("should accept an equal timestamp")
        void equalTimestamp() {
            submit(row("1", "2025-06-01T10:00:00Z", "in_progress", 10));

            UpsertResult result = submit(row("1", "2025-06-01T10:00:00Z", "in_progress", 15));

            assertThat(result.getUpdated()).isEqualTo(1);
        }

        @Test
        @DisplayName("isStale compares ISO strings lexicographically and ignores blanks")
        void isStale() {
            assertThat(EvaluationUpsertService.isStale("2025-06-01T10:00:00Z", "2025-06-01T09:59:59Z")).isTrue();
            assertThat(EvaluationUpsertService.isStale("2025-06-01T10:00:00Z", "2025-06-01T10:00:01Z")).isFalse();
            assertThat(EvaluationUpsertService.isStale("", "2025-06-01T10:00:00Z")).isFalse();
            assertThat(EvaluationUpsertService.isStale("2025-06-01T10:00:00Z", null)).isFalse();
        }
    }

    @Nested
    @DisplayName("status monotonicity and editing flag")
    class Monotonicity {

        @BeforeEach
        void finalizeGroupOne() {
            submit(row("1", "2025-06-01T10:00:00Z", "all_submitted", 90));
        }

        @Test
        @DisplayName("should clamp a regression back to all_submitted without a window")
        void clampsWithoutWindow() {
            UpsertResult result = submit(row("1", "2025-06-01T10:01:00Z", "in_progress", 50));

            EvaluationRecord stored = records.only(JUROR, "1");
            assertThat(stored.getStatus()).isEqualTo(EvaluationStatus.ALL_SUBMITTED);
            assertThat(stored.getEditingFlag()).isEmpty();
            assertThat(stored.getHighlightColor()).isEqualTo(StatusHighlight.GREEN);
            assertThat(result.getRegressionsIgnored()).isEqualTo(1);
            assertThat(result.getUpdated()).isEqualTo(1);
        }

        @Test
        @DisplayName("should honor a regression while the window is active and mark the record editing")
        void regressesWithWindow() {
            accounts.setResetUnlockAt(JUROR, clock.instant());

            UpsertResult result = submit(row("1", "2025-06-01T10:01:00Z", "in_progress", 50));

            EvaluationRecord stored = records.only(JUROR, "1");
            assertThat(stored.getStatus()).isEqualTo(EvaluationStatus.IN_PROGRESS);
            assertThat(stored.getEditingFlag()).isEqualTo("editing");
            assertThat(stored.getHighlightColor()).isEqualTo(StatusHighlight.PALE_YELLOW);
            assertThat(result.getRegressionsIgnored()).isZero();
        }

        @Test
        @DisplayName("should clamp again once the window has expired")
        void clampsAfterExpiry() {
            accounts.setResetUnlockAt(JUROR, clock.instant());
            clock.advance(Duration.ofMinutes(21));

            submit(row("1", "2025-06-01T10:30:00Z", "group_submitted", 50));

            assertThat(records.only(JUROR, "1").getStatus()).isEqualTo(EvaluationStatus.ALL_SUBMITTED);
        }

        @Test
        @DisplayName("should clear the editing flag when the group is finalized again")
        void finalizeClearsFlag() {
            resetUnlockService.open(JUROR);
            assertThat(records.only(JUROR, "1").getEditingFlag()).isEqualTo("editing");

            submit(row("1", "2025-06-01T10:02:00Z", "all_submitted", 95));

            EvaluationRecord stored = records.only(JUROR, "1");
            assertThat(stored.getStatus()).isEqualTo(EvaluationStatus.ALL_SUBMITTED);
            assertThat(stored.getEditingFlag()).isEmpty();
            assertThat(stored.getTotal()).isEqualTo(95);
        }

        @Test
        @DisplayName("should carry the editing flag over after the window expires")
        void carriesFlag() {
            resetUnlockService.open(JUROR);
            clock.advance(Duration.ofMinutes(30));

            submit(row("1", "2025-06-01T10:40:00Z", "group_submitted", 60));

            EvaluationRecord stored = records.only(JUROR, "1");
            assertThat(stored.getStatus()).isEqualTo(EvaluationStatus.GROUP_SUBMITTED);
            assertThat(stored.getEditingFlag()).isEqualTo("editing");
        }

        @Test
        @DisplayName("should create new records with an empty flag outside a window")
        void newRecordFlag() {
            submit(row("2", "2025-06-01T10:00:00Z", "in_progress", 10));

            assertThat(records.only(JUROR, "2").getEditingFlag()).isEmpty();
            assertThat(records.only(JUROR, "2").getHighlightColor()).isEqualTo(StatusHighlight.PALE_YELLOW);
        }
    }

    @Nested
    @DisplayName("concurrent first write for the same group")
    class ConcurrentFirstWrite {

        private EvaluationRecord committedElsewhere(String timestamp, EvaluationStatus status, int total) {
            return EvaluationRecord.builder()
                    .jurorId(JUROR)
                    .groupId("1")
                    .timestamp(timestamp)
                    .status(status)
                    .total(total)
                    .build();
        }

        @Test
        @DisplayName("should drop the older write without error when a newer one won the insert")
        void olderLoserIsDropped() {
            records.commitConcurrentlyOnNextInsert(
                    committedElsewhere("2025-06-01T10:05:00Z", EvaluationStatus.GROUP_SUBMITTED, 80));

            UpsertResult result = submit(row("1", "2025-06-01T10:00:00Z", "in_progress", 10));

            assertThat(result.getSkippedStale()).isEqualTo(1);
            assertThat(result.getAdded()).isZero();
            assertThat(result.getUpdated()).isZero();
            EvaluationRecord stored = records.only(JUROR, "1");
            assertThat(stored.getTotal()).isEqualTo(80);
            assertThat(stored.getStatus()).isEqualTo(EvaluationStatus.GROUP_SUBMITTED);
        }

        @Test
        @DisplayName("should merge a newer write into the record that won the insert")
        void newerLoserUpdates() {
            records.commitConcurrentlyOnNextInsert(
                    committedElsewhere("2025-06-01T10:00:00Z", EvaluationStatus.IN_PROGRESS, 10));

            UpsertResult result = submit(row("1", "2025-06-01T10:05:00Z", "group_submitted", 80));

            assertThat(result.getUpdated()).isEqualTo(1);
            assertThat(result.getAdded()).isZero();
            assertThat(records.byJuror(JUROR)).hasSize(1);
            assertThat(records.only(JUROR, "1").getTotal()).isEqualTo(80);
        }

        @Test
        @DisplayName("should clamp against a finalized record that won the insert")
        void clampsAgainstWinner() {
            records.commitConcurrentlyOnNextInsert(
                    committedElsewhere("2025-06-01T10:00:00Z", EvaluationStatus.ALL_SUBMITTED, 90));

            UpsertResult result = submit(row("1", "2025-06-01T10:01:00Z", "in_progress", 50));

            assertThat(result.getRegressionsIgnored()).isEqualTo(1);
            assertThat(records.only(JUROR, "1").getStatus()).isEqualTo(EvaluationStatus.ALL_SUBMITTED);
        }
    }
}
