package com.equorum.governance.domain;

import jakarta.annotation.Nullable;
import jakarta.persistence.*;

import java.time.Instant;

/**
 * The timelock's admin role. Exactly one row; every timelock mutation locks it,
 * which makes the queue single-writer.
 */
@Entity
@Table(name = "timelock_admin")
public class TimelockAdmin {

    public static final int SINGLETON_ID = 1;

    @Id
    private Integer id = SINGLETON_ID;

    @Column(nullable = false, length = 128)
    private String admin;

    @Nullable
    @Column(name = "pending_admin", length = 128)
    private String pendingAdmin;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    public TimelockAdmin() {}

    public TimelockAdmin(String admin, Instant now) {
        this.admin = admin;
        this.updatedAt = now;
    }

    public Integer getId() { return id; }

    public String getAdmin() { return admin; }
    public void setAdmin(String admin) { this.admin = admin; }

    @Nullable
    public String getPendingAdmin() { return pendingAdmin; }
    public void setPendingAdmin(@Nullable String pendingAdmin) { this.pendingAdmin = pendingAdmin; }

    public Instant getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }
}
