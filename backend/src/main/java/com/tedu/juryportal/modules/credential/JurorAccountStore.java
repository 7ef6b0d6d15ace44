package com.tedu.juryportal.modules.credential;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Optional;

/**
 * Typed view over {@link CredentialStore}. Every juror attribute is its own
 * key under {@code juror:{jurorId}:}, so single-attribute writes never race
 * with each other.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JurorAccountStore {

    private static final String PREFIX = "juror:";

    static final String PIN = "pin";
    static final String SECRET = "secret";
    static final String ATTEMPTS = "attempts";
    static final String LOCKED = "locked";
    static final String RESET_UNLOCK_AT = "reset-unlock-at";
    static final String NAME = "name";
    static final String DEPT = "dept";

    private final CredentialStore store;

    public JurorAccount load(String jurorId) {
        return JurorAccount.builder()
                .jurorId(jurorId)
                .pin(getPin(jurorId).orElse(null))
                .secret(getSecret(jurorId).orElse(null))
                .failedAttempts(getAttempts(jurorId))
                .locked(isLocked(jurorId))
                .resetUnlockAt(getResetUnlockAt(jurorId).orElse(null))
                .displayName(getName(jurorId).orElse(null))
                .displayDept(getDept(jurorId).orElse(null))
                .build();
    }

    // PIN

    public Optional<String> getPin(String jurorId) {
        return store.get(key(jurorId, PIN));
    }

    public void setPin(String jurorId, String pin) {
        store.set(key(jurorId, PIN), pin);
    }

    public void deletePin(String jurorId) {
        store.delete(key(jurorId, PIN));
    }

    // Secret

    public Optional<String> getSecret(String jurorId) {
        return store.get(key(jurorId, SECRET));
    }

    public void setSecret(String jurorId, String secret) {
        store.set(key(jurorId, SECRET), secret);
    }

    public void deleteSecret(String jurorId) {
        store.delete(key(jurorId, SECRET));
    }

    // Attempts and lock

    public int getAttempts(String jurorId) {
        String raw = store.get(key(jurorId, ATTEMPTS)).orElse("0");
        try {
            return Math.max(0, Integer.parseInt(raw.trim()));
        } catch (NumberFormatException e) {
            log.warn("Unreadable attempt counter for juror {}: '{}', treating as 0", jurorId, raw);
            return 0;
        }
    }

    public void setAttempts(String jurorId, int attempts) {
        store.set(key(jurorId, ATTEMPTS), String.valueOf(attempts));
    }

    public boolean isLocked(String jurorId) {
        return store.get(key(jurorId, LOCKED)).map("1"::equals).orElse(false);
    }

    public void lock(String jurorId) {
        store.set(key(jurorId, LOCKED), "1");
    }

    public void clearLock(String jurorId) {
        store.delete(key(jurorId, LOCKED));
        store.delete(key(jurorId, ATTEMPTS));
    }

    // Reset-unlock window

    public Optional<Instant> getResetUnlockAt(String jurorId) {
        return store.get(key(jurorId, RESET_UNLOCK_AT)).flatMap(raw -> {
            try {
                return Optional.of(Instant.ofEpochMilli(Long.parseLong(raw.trim())));
            } catch (NumberFormatException e) {
                log.warn("Unreadable reset-unlock timestamp for juror {}: '{}'", jurorId, raw);
                return Optional.empty();
            }
        });
    }

    public void setResetUnlockAt(String jurorId, Instant at) {
        store.set(key(jurorId, RESET_UNLOCK_AT), String.valueOf(at.toEpochMilli()));
    }

    public void deleteResetUnlockAt(String jurorId) {
        store.delete(key(jurorId, RESET_UNLOCK_AT));
    }

    // Display metadata

    public Optional<String> getName(String jurorId) {
        return store.get(key(jurorId, NAME));
    }

    public Optional<String> getDept(String jurorId) {
        return store.get(key(jurorId, DEPT));
    }

    public void setDisplayInfo(String jurorId, String name, String dept) {
        if (name != null && !name.isBlank()) {
            store.set(key(jurorId, NAME), name.trim());
        }
        if (dept != null && !dept.isBlank()) {
            store.set(key(jurorId, DEPT), dept.trim());
        }
    }

    static String key(String jurorId, String attribute) {
        return PREFIX + jurorId + ":" + attribute;
    }
}
