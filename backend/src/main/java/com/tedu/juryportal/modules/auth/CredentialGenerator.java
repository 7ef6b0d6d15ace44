package com.tedu.juryportal.modules.auth;

import org.springframework.stereotype.Component;

import java.security.SecureRandom;
import java.util.Base64;

@Component
public class CredentialGenerator {

    private static final int SECRET_BYTES = 24;

    private final SecureRandom random = new SecureRandom();

    /** Four decimal digits, "0000" to "9999". */
    public String newPin() {
        return String.format("%04d", random.nextInt(10_000));
    }

    public String newSecret() {
        byte[] bytes = new byte[SECRET_BYTES];
        random.nextBytes(bytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }
}
