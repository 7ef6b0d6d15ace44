package com.tedu.juryportal.modules.admin.dto;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;

@Data
@Builder
public class JurorStatusDto {
    private String jurorId;
    private String name;
    private String dept;
    private boolean pinSet;
    private boolean locked;
    private int failedAttempts;
    private int attemptsLeft;
    private Instant resetUnlockAt;
    private boolean resetWindowActive;
}
