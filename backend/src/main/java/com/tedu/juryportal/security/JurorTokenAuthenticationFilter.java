package com.tedu.juryportal.security;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tedu.juryportal.exception.GlobalExceptionHandler.ErrorResponse;
import com.tedu.juryportal.modules.auth.TokenService;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.lang.NonNull;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

@Slf4j
@Component
@RequiredArgsConstructor
public class JurorTokenAuthenticationFilter extends OncePerRequestFilter {

    private final TokenService tokenService;
    private final ObjectMapper objectMapper;

    @Override
    protected void doFilterInternal(@NonNull HttpServletRequest request,
            @NonNull HttpServletResponse response,
            @NonNull FilterChain filterChain) throws ServletException, IOException {

        String token = extractTokenFromRequest(request);

        if (token != null) {
            Optional<AuthenticatedJuror> juror;
            try {
                juror = tokenService.authenticate(token);
            } catch (DataAccessException e) {
                // Runs before dispatch, so the controller advice never sees this
                log.error("[503 STORAGE_UNAVAILABLE] {} {} — {}", request.getMethod(), request.getRequestURI(),
                        e.getMessage(), e);
                writeStorageUnavailable(request, response);
                return;
            }

            if (juror.isPresent()) {
                SecurityContextHolder.getContext().setAuthentication(withJurorRole(juror.get()));
            } else {
                log.debug("Bearer token rejected on {} {}", request.getMethod(), request.getRequestURI());
            }
        }

        filterChain.doFilter(request, response);
    }

    /** Keeps roles already granted by the shared-secret headers. */
    private Authentication withJurorRole(AuthenticatedJuror juror) {
        List<GrantedAuthority> authorities = new ArrayList<>();
        Authentication existing = SecurityContextHolder.getContext().getAuthentication();
        if (existing != null) {
            authorities.addAll(existing.getAuthorities());
        }
        authorities.add(new SimpleGrantedAuthority("ROLE_" + Roles.JUROR));
        return new UsernamePasswordAuthenticationToken(juror, null, authorities);
    }

    private void writeStorageUnavailable(HttpServletRequest request, HttpServletResponse response)
            throws IOException {
        response.setStatus(HttpStatus.SERVICE_UNAVAILABLE.value());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.setCharacterEncoding(StandardCharsets.UTF_8.name());
        objectMapper.writeValue(response.getWriter(), new ErrorResponse(
                HttpStatus.SERVICE_UNAVAILABLE.value(), "Storage unavailable", request.getRequestURI()));
    }

    private String extractTokenFromRequest(HttpServletRequest request) {
        String bearerToken = request.getHeader("Authorization");
        if (StringUtils.hasText(bearerToken) && bearerToken.startsWith("Bearer ")) {
            return bearerToken.substring(7);
        }
        return null;
    }
}
