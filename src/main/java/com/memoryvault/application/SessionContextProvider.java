package com.memoryvault.application;

import com.memoryvault.domain.model.AuthSession;
import org.springframework.security.authentication.AuthenticationCredentialsNotFoundException;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Provider for the current request's authentication session.
 *
 * Reads the {@link AuthSession} that {@code SessionAuthenticationFilter}
 * placed in Spring Security's SecurityContextHolder.
 */
@Component
public class SessionContextProvider {

    public Optional<AuthSession> currentSession() {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        if (authentication != null
                && authentication.isAuthenticated()
                && authentication.getPrincipal() instanceof AuthSession session) {
            return Optional.of(session);
        }
        return Optional.empty();
    }

    /**
     * @throws AuthenticationCredentialsNotFoundException if the request has no live session
     */
    public AuthSession requireSession() {
        return currentSession()
            .orElseThrow(() -> new AuthenticationCredentialsNotFoundException("No active session"));
    }

    public String currentPrincipalId() {
        return requireSession().getPrincipalId();
    }
}
