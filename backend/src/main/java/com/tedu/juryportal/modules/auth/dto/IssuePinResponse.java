package com.tedu.juryportal.modules.auth.dto;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class IssuePinResponse {
    private String pin;
    private String token;
    private boolean locked;
}
