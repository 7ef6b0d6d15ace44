package com.tedu.juryportal.modules.admin;

import com.tedu.juryportal.modules.admin.dto.JurorStatusDto;
import com.tedu.juryportal.modules.auth.PinAuthService;
import com.tedu.juryportal.modules.evaluation.EvaluationService;
import com.tedu.juryportal.modules.evaluation.dto.EvaluationRecordDto;
import com.tedu.juryportal.modules.unlock.ResetUnlockService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/admin")
@RequiredArgsConstructor
@Tag(name = "Admin", description = "Credential overrides and exports (admin password)")
public class AdminController {

    private final AdminService adminService;
    private final PinAuthService pinAuthService;
    private final ResetUnlockService resetUnlockService;
    private final EvaluationService evaluationService;

    @GetMapping("/jurors/{jurorId}")
    @Operation(summary = "Credential status of a juror")
    public ResponseEntity<JurorStatusDto> getJurorStatus(@PathVariable String jurorId) {
        return ResponseEntity.ok(adminService.getJurorStatus(jurorId.trim()));
    }

    @PostMapping("/jurors/{jurorId}/reset-pin")
    @Operation(summary = "Clear PIN and lock; a new PIN is issued on next login")
    public ResponseEntity<Map<String, String>> resetPin(@PathVariable String jurorId) {
        pinAuthService.resetPin(jurorId.trim());
        return ResponseEntity.ok(Map.of("message", "PIN cleared for " + jurorId.trim()));
    }

    @DeleteMapping("/jurors/{jurorId}/credentials")
    @Operation(summary = "Return the account to Unset and revoke its tokens")
    public ResponseEntity<Map<String, String>> clearAccount(@PathVariable String jurorId) {
        pinAuthService.clear(jurorId.trim());
        return ResponseEntity.ok(Map.of("message", "Account cleared for " + jurorId.trim()));
    }

    @PostMapping("/jurors/{jurorId}/reset-window")
    @Operation(summary = "Reopen a juror's finalized scores for a limited time")
    public ResponseEntity<Map<String, Integer>> openResetWindow(@PathVariable String jurorId) {
        return ResponseEntity.ok(Map.of("reset", resetUnlockService.open(jurorId.trim())));
    }

    @GetMapping("/evaluations")
    @Operation(summary = "Every evaluation record, ordered by juror and group")
    public ResponseEntity<List<EvaluationRecordDto>> exportEvaluations() {
        return ResponseEntity.ok(evaluationService.exportAll());
    }
}
