package com.whisk.shopkeeper.model;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * One row per state-changing action: stock purchases, customer creation,
 * invoice writes, logins.
 */
@Entity
@Table(name = "audit_logs", indexes = @Index(name = "idx_audit_action", columnList = "action"))
@Data
@NoArgsConstructor
public class AuditLog {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String username;

    @Column(nullable = false, length = 64)
    private String action;

    @Column(length = 1000)
    private String details;

    @Column(nullable = false)
    private Instant timestamp;

    public AuditLog(String username, String action, String details) {
        this.username = username;
        this.action = action;
        // Column is bounded; long item lists are cut rather than failing the write
        this.details = details != null && details.length() > 1000 ? details.substring(0, 1000) : details;
    }

    @PrePersist
    protected void onCreate() {
        if (timestamp == null) {
            timestamp = Instant.now();
        }
    }
}
