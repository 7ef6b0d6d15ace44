package com.tedu.juryportal.modules.evaluation;

import com.tedu.juryportal.modules.evaluation.dto.EvaluationRecordDto;
import com.tedu.juryportal.modules.evaluation.dto.SubmitScoresRequest;
import com.tedu.juryportal.modules.evaluation.dto.UpsertResult;
import com.tedu.juryportal.modules.unlock.ResetUnlockService;
import com.tedu.juryportal.security.SecurityUtils;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/juror")
@RequiredArgsConstructor
@Tag(name = "Evaluations", description = "Score submission and lookup for the authenticated juror")
public class EvaluationController {

    private final EvaluationUpsertService upsertService;
    private final EvaluationService evaluationService;
    private final ResetUnlockService resetUnlockService;
    private final SecurityUtils securityUtils;

    @PostMapping("/scores")
    @Operation(summary = "Upsert score rows keyed by (juror, group)")
    public ResponseEntity<UpsertResult> submitScores(@Valid @RequestBody SubmitScoresRequest request) {
        return ResponseEntity.ok(upsertService.submit(securityUtils.getCurrentJurorId(), request.getRows()));
    }

    @GetMapping("/scores")
    @Operation(summary = "My scores, one record per group")
    public ResponseEntity<List<EvaluationRecordDto>> listMyScores() {
        return ResponseEntity.ok(evaluationService.listMyScores(securityUtils.getCurrentJurorId()));
    }

    @GetMapping("/scores/finalized-count")
    @Operation(summary = "How many of my groups are all_submitted")
    public ResponseEntity<Map<String, Long>> countFinalized() {
        return ResponseEntity.ok(Map.of("submittedCount",
                evaluationService.countFinalized(securityUtils.getCurrentJurorId())));
    }

    @PostMapping("/reset-window")
    @Operation(summary = "Reopen my finalized scores for a limited time")
    public ResponseEntity<Map<String, Integer>> openResetWindow() {
        return ResponseEntity.ok(Map.of("reset", resetUnlockService.open(securityUtils.getCurrentJurorId())));
    }

    @DeleteMapping("/data")
    @Operation(summary = "Delete my draft and all my evaluation records")
    public ResponseEntity<Map<String, Long>> deleteJurorData() {
        return ResponseEntity.ok(Map.of("deleted",
                evaluationService.deleteJurorData(securityUtils.getCurrentJurorId())));
    }
}
