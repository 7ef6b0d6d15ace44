package com.tedu.juryportal.modules.auth;

import com.tedu.juryportal.modules.credential.JurorAccountStore;
import com.tedu.juryportal.security.AuthenticatedJuror;
import com.tedu.juryportal.security.JurorTokenProvider;
import com.tedu.juryportal.support.InMemoryCredentialStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TokenServiceTest {

    private JurorAccountStore accounts;
    private JurorTokenProvider provider;
    private TokenService tokenService;

    @BeforeEach
    void setUp() {
        accounts = new JurorAccountStore(new InMemoryCredentialStore());
        provider = new JurorTokenProvider(PinAuthServiceTest.SIGNING_KEY);
        tokenService = new TokenService(provider, accounts);
        accounts.setSecret("alice", "secret-a");
        accounts.setSecret("bob", "secret-b");
    }

    @Test
    @DisplayName("should authenticate a token bound to the current secret")
    void validToken() {
        String token = tokenService.mint("alice", "secret-a");

        assertThat(tokenService.authenticate(token))
                .map(AuthenticatedJuror::getJurorId)
                .contains("alice");
    }

    @Test
    @DisplayName("should encode the same pair to the same token")
    void deterministic() {
        assertThat(tokenService.mint("alice", "secret-a")).isEqualTo(tokenService.mint("alice", "secret-a"));
    }

    @Test
    @DisplayName("should never authenticate juror A's secret as juror B")
    void crossJuror() {
        String forged = provider.mint("bob", "secret-a");

        assertThat(tokenService.authenticate(forged)).isEmpty();
    }

    @Test
    @DisplayName("should reject a token whose secret has since been rotated")
    void staleSecret() {
        String token = tokenService.mint("alice", "secret-a");

        accounts.setSecret("alice", "secret-a2");

        assertThat(tokenService.authenticate(token)).isEmpty();
    }

    @Test
    @DisplayName("should reject tokens for jurors without a secret")
    void noSecret() {
        accounts.deleteSecret("alice");

        assertThat(tokenService.authenticate(tokenService.mint("alice", "secret-a"))).isEmpty();
    }

    @Test
    @DisplayName("should reject malformed and foreign-signed tokens")
    void malformed() {
        JurorTokenProvider otherKey = new JurorTokenProvider("another-signing-key-another-signing-key-42");

        assertThat(tokenService.authenticate("not-a-token")).isEmpty();
        assertThat(tokenService.authenticate("")).isEmpty();
        assertThat(tokenService.authenticate(null)).isEmpty();
        assertThat(tokenService.authenticate(otherKey.mint("alice", "secret-a"))).isEmpty();
    }

    @Test
    @DisplayName("should reject a token whose payload was edited")
    void tampered() {
        String token = tokenService.mint("alice", "secret-a");
        String[] parts = token.split("\\.");
        String otherPayload = provider.mint("bob", "secret-b").split("\\.")[1];

        String spliced = parts[0] + "." + otherPayload + "." + parts[2];

        assertThat(tokenService.authenticate(spliced)).isEmpty();
    }
}
