package com.tedu.juryportal.modules.auth;

import com.tedu.juryportal.exception.BusinessException;
import com.tedu.juryportal.modules.auth.dto.*;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/api/auth/pin")
@RequiredArgsConstructor
@Tag(name = "PIN authentication", description = "PIN issuance and verification (shared API secret)")
public class AuthController {

    private final PinAuthService pinAuthService;

    @PostMapping
    @Operation(summary = "Get or create the juror's PIN and a bearer token")
    public ResponseEntity<IssuePinResponse> issuePin(@Valid @RequestBody IssuePinRequest request) {
        return ResponseEntity.ok(pinAuthService.issue(
                request.getJurorId().trim(), request.getName(), request.getDept()));
    }

    @GetMapping("/exists")
    @Operation(summary = "Whether a PIN is on record for the juror")
    public ResponseEntity<Map<String, Boolean>> checkPinExists(@RequestParam String jurorId) {
        if (!StringUtils.hasText(jurorId)) {
            throw new BusinessException("jurorId is required");
        }
        return ResponseEntity.ok(Map.of("exists", pinAuthService.exists(jurorId.trim())));
    }

    @PostMapping("/verify")
    @Operation(summary = "Verify a PIN; locks the account after repeated failures")
    public ResponseEntity<VerifyPinResponse> verifyPin(@Valid @RequestBody VerifyPinRequest request) {
        return ResponseEntity.ok(pinAuthService.verify(request.getJurorId().trim(), request.getPin()));
    }
}
