package com.tedu.juryportal.security;

/** Authorities granted by the three independent credential classes. */
public final class Roles {

    public static final String API_CLIENT = "API_CLIENT";
    public static final String ADMIN = "ADMIN";
    public static final String JUROR = "JUROR";

    private Roles() {
    }
}
