package com.tedu.juryportal.modules.auth;

import com.tedu.juryportal.modules.credential.JurorAccountStore;
import com.tedu.juryportal.security.AuthenticatedJuror;
import com.tedu.juryportal.security.JurorTokenProvider;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Optional;

/**
 * Issues bearer tokens bound to the juror's current secret and checks
 * presented tokens against it. Rotating the secret revokes every older token.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TokenService {

    private final JurorTokenProvider tokenProvider;
    private final JurorAccountStore accounts;

    public String mint(String jurorId, String secret) {
        return tokenProvider.mint(jurorId, secret);
    }

    public Optional<AuthenticatedJuror> authenticate(String token) {
        return tokenProvider.decode(token).flatMap(claims -> {
            Optional<String> stored = accounts.getSecret(claims.jurorId());
            if (stored.isEmpty()) {
                log.debug("Token for juror {} rejected: no secret on record", claims.jurorId());
                return Optional.empty();
            }
            if (!MessageDigest.isEqual(
                    stored.get().getBytes(StandardCharsets.UTF_8),
                    claims.secret().getBytes(StandardCharsets.UTF_8))) {
                log.debug("Token for juror {} rejected: stale secret", claims.jurorId());
                return Optional.empty();
            }
            return Optional.of(new AuthenticatedJuror(claims.jurorId()));
        });
    }
}
