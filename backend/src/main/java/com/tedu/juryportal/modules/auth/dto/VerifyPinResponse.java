package com.tedu.juryportal.modules.auth.dto;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class VerifyPinResponse {
    private boolean valid;
    private boolean locked;
    private int attemptsLeft;
    private String token; // only set when valid
}
