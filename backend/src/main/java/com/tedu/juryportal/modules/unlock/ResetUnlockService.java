package com.tedu.juryportal.modules.unlock;

import com.tedu.juryportal.modules.credential.JurorAccountStore;
import com.tedu.juryportal.modules.evaluation.EvaluationRecord;
import com.tedu.juryportal.modules.evaluation.EvaluationRecordRepository;
import com.tedu.juryportal.modules.evaluation.EvaluationStatus;
import com.tedu.juryportal.modules.evaluation.StatusHighlight;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Time-boxed grace period during which a juror may downgrade finalized
 * records. Expiry is computed on each check; there is no close operation.
 */
@Slf4j
@Service
public class ResetUnlockService {

    private final JurorAccountStore accounts;
    private final EvaluationRecordRepository recordRepository;
    private final Clock clock;
    private final Duration window;

    public ResetUnlockService(JurorAccountStore accounts,
            EvaluationRecordRepository recordRepository,
            Clock clock,
            @Value("${jury.reset-unlock.minutes:20}") long windowMinutes) {
        this.accounts = accounts;
        this.recordRepository = recordRepository;
        this.clock = clock;
        this.window = Duration.ofMinutes(windowMinutes);
    }

    /**
     * Opens the window and rewrites every record of the juror to
     * {@code in_progress} / {@code editing} right away.
     *
     * @return number of records rewritten
     */
    @Transactional
    public int open(String jurorId) {
        accounts.setResetUnlockAt(jurorId, Instant.now(clock));

        List<EvaluationRecord> records = recordRepository.findByJurorId(jurorId);
        for (EvaluationRecord record : records) {
            record.setStatus(EvaluationStatus.IN_PROGRESS);
            record.setEditingFlag(EvaluationRecord.EDITING_FLAG);
            record.setHighlightColor(StatusHighlight.PALE_YELLOW);
        }
        recordRepository.saveAll(records);

        log.info("Reset-unlock window opened for juror {} ({} record(s) reopened, {} min)",
                jurorId, records.size(), window.toMinutes());
        return records.size();
    }

    public boolean isActive(String jurorId) {
        return accounts.getResetUnlockAt(jurorId)
                .map(openedAt -> Duration.between(openedAt, Instant.now(clock)).compareTo(window) <= 0)
                .orElse(false);
    }
}
