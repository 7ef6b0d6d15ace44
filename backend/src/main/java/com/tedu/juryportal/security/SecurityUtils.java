package com.tedu.juryportal.security;

import org.springframework.security.authentication.BadCredentialsException;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;

@Component
public class SecurityUtils {

    public AuthenticatedJuror getCurrentJuror() {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        if (authentication != null && authentication.getPrincipal() instanceof AuthenticatedJuror juror) {
            return juror;
        }
        throw new BadCredentialsException("No authenticated juror in security context");
    }

    public String getCurrentJurorId() {
        return getCurrentJuror().getJurorId();
    }
}
