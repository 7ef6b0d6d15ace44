package com.tedu.juryportal.modules.auth;

import com.tedu.juryportal.modules.auth.dto.IssuePinResponse;
import com.tedu.juryportal.modules.auth.dto.VerifyPinResponse;
import com.tedu.juryportal.modules.credential.JurorAccountStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Optional;

/**
 * PIN lifecycle and brute-force lockout, tracked per juror id so the counter
 * survives client restarts.
 *
 * <pre>
 *   Unset --issue--> Active --max wrong attempts--> Locked
 *     ^                                               |
 *     +------------------- clear --------------------+
 * </pre>
 */
@Slf4j
@Service
public class PinAuthService {

    private final JurorAccountStore accounts;
    private final TokenService tokenService;
    private final CredentialGenerator generator;
    private final int maxAttempts;

    public PinAuthService(JurorAccountStore accounts,
            TokenService tokenService,
            CredentialGenerator generator,
            @Value("${jury.pin.max-attempts:3}") int maxAttempts) {
        this.accounts = accounts;
        this.tokenService = tokenService;
        this.generator = generator;
        this.maxAttempts = maxAttempts;
    }

    /**
     * Get-or-create: an existing PIN is returned unchanged so a registered
     * juror never has their PIN replaced behind their back. A locked account
     * gets neither PIN nor token.
     */
    public IssuePinResponse issue(String jurorId, String name, String dept) {
        if (accounts.isLocked(jurorId)) {
            log.warn("PIN issue refused for locked juror {}", jurorId);
            return IssuePinResponse.builder().locked(true).build();
        }

        Optional<String> existing = accounts.getPin(jurorId);
        accounts.setDisplayInfo(jurorId, name, dept);

        if (existing.isPresent()) {
            String secret = accounts.getSecret(jurorId).orElseGet(() -> {
                String fresh = generator.newSecret();
                accounts.setSecret(jurorId, fresh);
                return fresh;
            });
            return IssuePinResponse.builder()
                    .pin(existing.get())
                    .token(tokenService.mint(jurorId, secret))
                    .build();
        }

        String pin = generator.newPin();
        String secret = generator.newSecret();
        accounts.setPin(jurorId, pin);
        accounts.setSecret(jurorId, secret);
        accounts.setAttempts(jurorId, 0);
        log.info("PIN issued for juror {}", jurorId);

        return IssuePinResponse.builder()
                .pin(pin)
                .token(tokenService.mint(jurorId, secret))
                .build();
    }

    public boolean exists(String jurorId) {
        return accounts.getPin(jurorId).isPresent();
    }

    public VerifyPinResponse verify(String jurorId, String candidatePin) {
        if (accounts.isLocked(jurorId)) {
            return VerifyPinResponse.builder().valid(false).locked(true).attemptsLeft(0).build();
        }

        Optional<String> storedPin = accounts.getPin(jurorId);
        if (storedPin.isEmpty()) {
            // Accounts migrated without a PIN are let through
            log.info("Juror {} has no PIN on record, accepting", jurorId);
            return success(jurorId);
        }

        String candidate = candidatePin == null ? "" : candidatePin.trim();
        if (pinEquals(storedPin.get(), candidate)) {
            accounts.setAttempts(jurorId, 0);
            return success(jurorId);
        }

        int attempts = accounts.getAttempts(jurorId) + 1;
        accounts.setAttempts(jurorId, attempts);
        int left = Math.max(0, maxAttempts - attempts);
        if (left == 0) {
            accounts.lock(jurorId);
            log.warn("Juror {} locked after {} failed PIN attempts", jurorId, attempts);
        }
        return VerifyPinResponse.builder().valid(false).locked(left == 0).attemptsLeft(left).build();
    }

    /** Drops the PIN and lock; the next {@link #issue} starts from Unset. */
    public void resetPin(String jurorId) {
        accounts.deletePin(jurorId);
        accounts.clearLock(jurorId);
        log.info("PIN reset for juror {}", jurorId);
    }

    /** Returns the account to Unset and revokes every outstanding token. */
    public void clear(String jurorId) {
        accounts.deletePin(jurorId);
        accounts.deleteSecret(jurorId);
        accounts.clearLock(jurorId);
        accounts.deleteResetUnlockAt(jurorId);
        log.info("Credentials cleared for juror {}", jurorId);
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    private VerifyPinResponse success(String jurorId) {
        String secret = generator.newSecret();
        accounts.setSecret(jurorId, secret);
        return VerifyPinResponse.builder()
                .valid(true)
                .locked(false)
                .attemptsLeft(maxAttempts)
                .token(tokenService.mint(jurorId, secret))
                .build();
    }

    private static boolean pinEquals(String stored, String candidate) {
        return MessageDigest.isEqual(
                stored.getBytes(StandardCharsets.UTF_8),
                candidate.getBytes(StandardCharsets.UTF_8));
    }
}
