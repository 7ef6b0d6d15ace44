package com.tedu.juryportal.modules.draft;

import com.fasterxml.jackson.databind.JsonNode;
import com.tedu.juryportal.security.SecurityUtils;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/api/juror/draft")
@RequiredArgsConstructor
@Tag(name = "Drafts", description = "Autosaved in-progress evaluation")
public class DraftController {

    private final DraftService draftService;
    private final SecurityUtils securityUtils;

    @PutMapping
    @Operation(summary = "Save (overwrite) my draft")
    public ResponseEntity<DraftService.DraftDto> saveDraft(@RequestBody(required = false) JsonNode payload) {
        return ResponseEntity.ok(draftService.save(securityUtils.getCurrentJurorId(), payload));
    }

    @GetMapping
    @Operation(summary = "Load my draft (404 when none is saved)")
    public ResponseEntity<DraftService.DraftDto> loadDraft() {
        return ResponseEntity.ok(draftService.load(securityUtils.getCurrentJurorId()));
    }

    @DeleteMapping
    @Operation(summary = "Delete my draft")
    public ResponseEntity<Map<String, String>> deleteDraft() {
        draftService.delete(securityUtils.getCurrentJurorId());
        return ResponseEntity.ok(Map.of("message", "Draft deleted"));
    }
}
