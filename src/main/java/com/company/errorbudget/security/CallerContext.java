package com.company.errorbudget.security;

import lombok.extern.slf4j.Slf4j;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.stereotype.Component;

/**
 * Resolves who is calling from the authenticated JWT. Used to default
 * requested_by on release checks and acknowledged_by on alerts.
 */
@Component
@Slf4j
public class CallerContext {

    public static final String ANONYMOUS = "anonymous";

    public String getCurrentCaller() {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();

        if (authentication == null || !authentication.isAuthenticated()) {
            return ANONYMOUS;
        }

        if (authentication.getPrincipal() instanceof Jwt jwt) {
            String caller = jwt.getClaimAsString("preferred_username");
            if (caller == null) {
                caller = jwt.getClaimAsString("email");
            }
            if (caller == null) {
                caller = jwt.getSubject();
            }
            return caller != null ? caller : ANONYMOUS;
        }

        String name = authentication.getName();
        return name != null ? name : ANONYMOUS;
    }

    /**
     * Explicit value when given, otherwise the authenticated caller.
     */
    public String resolve(String explicit) {
        if (explicit != null && !explicit.isBlank()) {
            return explicit.trim();
        }
        return getCurrentCaller();
    }
}
