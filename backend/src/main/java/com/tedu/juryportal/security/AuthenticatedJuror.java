package com.tedu.juryportal.security;

import lombok.Getter;

@Getter
public class AuthenticatedJuror {
    private final String jurorId;

    public AuthenticatedJuror(String jurorId) {
        this.jurorId = jurorId;
    }
}
