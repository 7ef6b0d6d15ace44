package com.tedu.juryportal.modules.draft;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tedu.juryportal.exception.MalformedPayloadException;
import com.tedu.juryportal.exception.ResourceNotFoundException;
import lombok.*;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;

/** One autosaved draft per juror, last write wins. */
@Slf4j
@Service
@RequiredArgsConstructor
public class DraftService {

    private final DraftRepository draftRepository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Transactional
    public DraftDto save(String jurorId, JsonNode payload) {
        String json;
        try {
            json = objectMapper.writeValueAsString(payload == null ? objectMapper.createObjectNode() : payload);
        } catch (JsonProcessingException e) {
            throw new MalformedPayloadException("Draft payload cannot be serialized", e);
        }

        Draft draft = draftRepository.findById(jurorId)
                .orElse(Draft.builder().jurorId(jurorId).build());
        draft.setPayload(json);
        draft.setUpdatedAt(Instant.now(clock));
        draftRepository.save(draft);

        log.debug("Draft saved for juror {} ({} chars)", jurorId, json.length());
        return new DraftDto(payload, draft.getUpdatedAt());
    }

    @Transactional(readOnly = true)
    public DraftDto load(String jurorId) {
        Draft draft = draftRepository.findById(jurorId)
                .orElseThrow(() -> new ResourceNotFoundException("Draft", jurorId));
        try {
            return new DraftDto(objectMapper.readTree(draft.getPayload()), draft.getUpdatedAt());
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.warn("Corrupt draft JSON for juror {}: {}", jurorId, e.getMessage());
            throw new MalformedPayloadException("Corrupt draft JSON", e);
        }
    }

    /** No-op when the juror has no draft. */
    @Transactional
    public void delete(String jurorId) {
        if (draftRepository.existsById(jurorId)) {
            draftRepository.deleteById(jurorId);
            log.debug("Draft deleted for juror {}", jurorId);
        }
    }

    @Data
    @AllArgsConstructor
    public static class DraftDto {
        private JsonNode draft;
        private Instant updatedAt;
    }
}
