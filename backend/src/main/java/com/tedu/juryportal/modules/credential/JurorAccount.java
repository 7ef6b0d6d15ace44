package com.tedu.juryportal.modules.credential;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/** Snapshot of everything the credential store holds for one juror. */
@Value
@Builder
public class JurorAccount {
    String jurorId;
    String pin;
    String secret;
    int failedAttempts;
    boolean locked;
    Instant resetUnlockAt;
    String displayName;
    String displayDept;

    public boolean hasPin() {
        return pin != null;
    }
}
