package com.memoryvault.infrastructure.security;

import com.memoryvault.application.SessionGuard;
import com.memoryvault.domain.model.AuthSession;
import com.memoryvault.domain.model.SessionResolution;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.List;

/**
 * Authenticates requests carrying a live session id in {@value #SESSION_HEADER}.
 *
 * <p>The resolved {@link AuthSession} becomes the Spring Security principal,
 * with one {@code FACTOR_*} authority per satisfied factor. Requests without
 * a usable session pass through unauthenticated.
 */
@Slf4j
@RequiredArgsConstructor
public class SessionAuthenticationFilter extends OncePerRequestFilter {

    public static final String SESSION_HEADER = "X-Auth-Session";

    private final SessionGuard sessionGuard;

    @Override
    protected void doFilterInternal(
            HttpServletRequest request,
            HttpServletResponse response,
            FilterChain filterChain) throws ServletException, IOException {

        String sessionId = request.getHeader(SESSION_HEADER);
        if (sessionId != null && !sessionId.isBlank()) {
            SessionResolution resolution = sessionGuard.resolve(sessionId.strip());
            if (resolution instanceof SessionResolution.Active active) {
                AuthSession session = active.getSession();
                List<SimpleGrantedAuthority> authorities = session.getFactors().stream()
                    .map(factor -> new SimpleGrantedAuthority("FACTOR_" + factor.name()))
                    .toList();
                UsernamePasswordAuthenticationToken authentication =
                    UsernamePasswordAuthenticationToken.authenticated(session, null, authorities);
                SecurityContextHolder.getContext().setAuthentication(authentication);
            } else if (resolution instanceof SessionResolution.Rejected rejected) {
                log.debug("Ignoring unusable session header on {}: {}", request.getRequestURI(), rejected.getReason());
            }
        }
        filterChain.doFilter(request, response);
    }
}
