package com.tedu.juryportal.modules.evaluation;

import com.tedu.juryportal.modules.credential.JurorAccountStore;
import com.tedu.juryportal.modules.evaluation.dto.ScoreRow;
import com.tedu.juryportal.modules.evaluation.dto.UpsertResult;
import com.tedu.juryportal.modules.unlock.ResetUnlockService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Merges score submissions into the record store keyed by
 * {@code (jurorId, groupId)}.
 *
 * <p>Per batch: rows for other jurors are dropped, duplicates collapse to the
 * last occurrence, stale rows (older timestamp than stored) are skipped, and an
 * {@code all_submitted} record keeps its status unless the juror's reset-unlock
 * window is open.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EvaluationUpsertService {

    private final EvaluationRecordRepository recordRepository;
    private final JurorAccountStore accounts;
    private final ResetUnlockService resetUnlockService;

    @Transactional
    public UpsertResult submit(String jurorId, List<ScoreRow> rows) {
        Map<String, PendingRow> latestByGroup = new LinkedHashMap<>();
        int dropped = 0;

        for (ScoreRow row : rows) {
            if (row == null) {
                continue;
            }
            if (!jurorId.equals(trim(row.getJurorId()))) {
                dropped++;
                continue;
            }
            String groupId = trim(row.getGroupId());
            // Parsing up front rejects the whole batch before anything is written
            EvaluationStatus status = EvaluationStatus.fromWire(row.getStatus());
            latestByGroup.remove(groupId);
            latestByGroup.put(groupId, new PendingRow(row, status));
        }
        if (dropped > 0) {
            log.warn("Dropped {} row(s) claiming another juror's identity in batch from {}", dropped, jurorId);
        }

        Map<String, EvaluationRecord> index = new HashMap<>();
        for (EvaluationRecord existing : recordRepository.findByJurorId(jurorId)) {
            index.putIfAbsent(existing.getGroupId(), existing);
        }

        boolean unlockActive = resetUnlockService.isActive(jurorId);
        String secret = accounts.getSecret(jurorId).orElse(null);
        String accountName = accounts.getName(jurorId).orElse(null);
        String accountDept = accounts.getDept(jurorId).orElse(null);

        int updated = 0;
        int added = 0;
        int skippedStale = 0;
        int regressionsIgnored = 0;

        for (Map.Entry<String, PendingRow> entry : latestByGroup.entrySet()) {
            String groupId = entry.getKey();
            ScoreRow row = entry.getValue().row();
            EvaluationStatus status = entry.getValue().status();
            EvaluationRecord existing = index.get(groupId);
            boolean created = false;

            if (existing == null) {
                created = recordRepository.insertIfAbsent(UUID.randomUUID(), jurorId, groupId) > 0;
                existing = recordRepository.findByJurorIdAndGroupId(jurorId, groupId)
                        .orElseThrow(() -> new IllegalStateException(
                                "Evaluation record vanished after insert: " + jurorId + "/" + groupId));
                index.put(groupId, existing);
                if (!created) {
                    log.info("Juror {} group {} was written concurrently, merging against stored record",
                            jurorId, groupId);
                }
            }

            if (isStale(existing.getTimestamp(), row.getTimestamp())) {
                skippedStale++;
                continue;
            }

            if (existing.getStatus() == EvaluationStatus.ALL_SUBMITTED
                    && status != EvaluationStatus.ALL_SUBMITTED
                    && !unlockActive) {
                status = EvaluationStatus.ALL_SUBMITTED;
                regressionsIgnored++;
            }

            String editingFlag;
            if (status == EvaluationStatus.ALL_SUBMITTED) {
                editingFlag = "";
            } else if (unlockActive) {
                editingFlag = EvaluationRecord.EDITING_FLAG;
            } else {
                editingFlag = existing.getEditingFlag() != null ? existing.getEditingFlag() : "";
            }

            EvaluationRecord record = existing;

            record.setJurorName(StringUtils.hasText(row.getJurorName()) ? row.getJurorName().trim() : accountName);
            record.setJurorDept(StringUtils.hasText(row.getJurorDept()) ? row.getJurorDept().trim() : accountDept);
            record.setTimestamp(row.getTimestamp() == null ? "" : row.getTimestamp().trim());
            record.setGroupName(row.getGroupName());
            record.setDesign(row.getDesign());
            record.setTechnical(row.getTechnical());
            record.setDelivery(row.getDelivery());
            record.setTeamwork(row.getTeamwork());
            record.setTotal(row.getTotal());
            record.setComments(row.getComments());
            record.setStatus(status);
            record.setEditingFlag(editingFlag);
            record.setJurorSecret(secret);
            record.setHighlightColor(StatusHighlight.forStatus(status));

            recordRepository.save(record);
            if (created) {
                added++;
            } else {
                updated++;
            }
        }

        log.info("Scores from juror {}: {} updated, {} added, {} stale, {} regression(s) ignored",
                jurorId, updated, added, skippedStale, regressionsIgnored);

        return UpsertResult.builder()
                .updated(updated)
                .added(added)
                .skippedStale(skippedStale)
                .regressionsIgnored(regressionsIgnored)
                .dropped(dropped)
                .build();
    }

    /** ISO-8601 strings sort chronologically, so plain string order is enough. */
    static boolean isStale(String existingTimestamp, String incomingTimestamp) {
        String existing = trim(existingTimestamp);
        String incoming = trim(incomingTimestamp);
        return !existing.isEmpty() && !incoming.isEmpty() && incoming.compareTo(existing) < 0;
    }

    private static String trim(String s) {
        return s == null ? "" : s.trim();
    }

    private record PendingRow(ScoreRow row, EvaluationStatus status) {
    }
}
