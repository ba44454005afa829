package com.whisk.shopkeeper.config;

import com.whisk.shopkeeper.service.AuditService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.security.authentication.event.AbstractAuthenticationFailureEvent;
import org.springframework.security.authentication.event.AuthenticationSuccessEvent;
import org.springframework.stereotype.Component;

/**
 * Audits password logins made through {@code /api/token}. Bearer token checks
 * bypass the authentication manager and are not recorded here.
 */
@Component
@Slf4j
public class AuthenticationEventListener {

    private final AuditService auditService;

    public AuthenticationEventListener(AuditService auditService) {
        this.auditService = auditService;
    }

    @EventListener
    public void onSuccess(AuthenticationSuccessEvent event) {
        String username = event.getAuthentication().getName();
        String roles = String.join(",", event.getAuthentication().getAuthorities().stream()
                .map(Object::toString)
                .toList());
        auditService.log(username, "LOGIN_SUCCESS", "Roles: " + roles);
    }

    @EventListener
    public void onFailure(AbstractAuthenticationFailureEvent event) {
        Object principal = event.getAuthentication().getPrincipal();
        String username = principal instanceof String ? (String) principal : "Unknown";
        String reason = event.getException().getClass().getSimpleName();
        log.debug("Login failure for {}: {}", username, reason);
        auditService.log(username, "LOGIN_FAILURE", reason);
    }
}
