package com.whisk.shopkeeper.service;

import com.whisk.shopkeeper.model.AuditLog;
import com.whisk.shopkeeper.repository.AuditLogRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Service;

@Service
@Slf4j
public class AuditService {

    static final String SYSTEM_USER = "SYSTEM";

    private final AuditLogRepository auditLogRepository;

    public AuditService(AuditLogRepository auditLogRepository) {
        this.auditLogRepository = auditLogRepository;
    }

    /** Records an action on behalf of the caller in the current security context. */
    public void log(String action, String details) {
        Authentication auth = SecurityContextHolder.getContext().getAuthentication();
        log(auth != null ? auth.getName() : SYSTEM_USER, action, details);
    }

    public void log(String username, String action, String details) {
        try {
            auditLogRepository.save(new AuditLog(username, action, details));
        } catch (RuntimeException e) {
            // An audit failure never fails the business write it describes
            log.warn("Failed to write audit log {} for {}: {}", action, username, e.getMessage());
        }
    }
}
