package com.tedu.juryportal.modules.evaluation;

import com.tedu.juryportal.modules.draft.DraftService;
import com.tedu.juryportal.modules.evaluation.dto.EvaluationRecordDto;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.stream.Collectors;

@Slf4j
@Service
@RequiredArgsConstructor
public class EvaluationService {

    private final EvaluationRecordRepository recordRepository;
    private final DraftService draftService;

    @Transactional(readOnly = true)
    public List<EvaluationRecordDto> listMyScores(String jurorId) {
        return ScorePrecedence.bestPerGroup(recordRepository.findByJurorId(jurorId))
                .stream().map(EvaluationRecordDto::from).collect(Collectors.toList());
    }

    @Transactional(readOnly = true)
    public long countFinalized(String jurorId) {
        return recordRepository.countByJurorIdAndStatus(jurorId, EvaluationStatus.ALL_SUBMITTED);
    }

    /** Removes the juror's draft and every evaluation record. */
    @Transactional
    public long deleteJurorData(String jurorId) {
        draftService.delete(jurorId);
        long deleted = recordRepository.deleteByJurorId(jurorId);
        log.info("Deleted draft and {} evaluation record(s) for juror {}", deleted, jurorId);
        return deleted;
    }

    @Transactional(readOnly = true)
    public List<EvaluationRecordDto> exportAll() {
        return recordRepository.findAllByOrderByJurorIdAscGroupIdAsc()
                .stream().map(EvaluationRecordDto::forExport).collect(Collectors.toList());
    }
}
