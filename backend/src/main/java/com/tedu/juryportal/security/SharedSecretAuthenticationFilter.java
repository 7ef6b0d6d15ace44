package com.tedu.juryportal.security;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.lang.NonNull;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.ArrayList;
import java.util.List;

/**
 * Grants {@code API_CLIENT} for a matching {@code X-Api-Secret} header and
 * {@code ADMIN} for a matching {@code X-Admin-Password} header. An empty
 * configured value never matches.
 */
@Slf4j
@Component
public class SharedSecretAuthenticationFilter extends OncePerRequestFilter {

    public static final String API_SECRET_HEADER = "X-Api-Secret";
    public static final String ADMIN_PASSWORD_HEADER = "X-Admin-Password";

    private final String apiSecret;
    private final String adminPassword;

    public SharedSecretAuthenticationFilter(
            @Value("${jury.security.api-secret:}") String apiSecret,
            @Value("${jury.security.admin-password:}") String adminPassword) {
        this.apiSecret = apiSecret;
        this.adminPassword = adminPassword;
    }

    @Override
    protected void doFilterInternal(@NonNull HttpServletRequest request,
            @NonNull HttpServletResponse response,
            @NonNull FilterChain filterChain) throws ServletException, IOException {

        List<GrantedAuthority> authorities = new ArrayList<>();
        String principal = null;

        String presentedSecret = request.getHeader(API_SECRET_HEADER);
        if (presentedSecret != null) {
            if (matches(apiSecret, presentedSecret)) {
                authorities.add(new SimpleGrantedAuthority("ROLE_" + Roles.API_CLIENT));
                principal = Roles.API_CLIENT;
            } else {
                log.debug("Wrong API secret on {} {}", request.getMethod(), request.getRequestURI());
            }
        }

        String presentedPassword = request.getHeader(ADMIN_PASSWORD_HEADER);
        if (presentedPassword != null) {
            if (matches(adminPassword, presentedPassword)) {
                authorities.add(new SimpleGrantedAuthority("ROLE_" + Roles.ADMIN));
                principal = Roles.ADMIN;
            } else {
                log.warn("Wrong admin password on {} {}", request.getMethod(), request.getRequestURI());
            }
        }

        if (!authorities.isEmpty()) {
            SecurityContextHolder.getContext().setAuthentication(
                    new UsernamePasswordAuthenticationToken(principal, null, authorities));
        }

        filterChain.doFilter(request, response);
    }

    static boolean matches(String expected, String presented) {
        if (!StringUtils.hasLength(expected) || presented == null) {
            return false;
        }
        return MessageDigest.isEqual(
                expected.getBytes(StandardCharsets.UTF_8),
                presented.getBytes(StandardCharsets.UTF_8));
    }
}
