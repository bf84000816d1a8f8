package com.equorum.governance.domain;

import jakarta.annotation.Nullable;
import jakarta.persistence.*;

import java.time.Instant;

/** Append-only audit record of a governance state change. */
@Entity
@Table(name = "governance_events")
public class GovernanceEvent {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "event_type", nullable = false, length = 64)
    private String type;

    @Nullable
    @Column(length = 128)
    private String actor;

    @Nullable
    @Column(length = 128)
    private String subject;

    @Column(nullable = false, length = 4000)
    private String payload = "{}";

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    public GovernanceEvent() {}

    public Long getId() { return id; }
    public String getType() { return type; }
    @Nullable public String getActor() { return actor; }
    @Nullable public String getSubject() { return subject; }
    public String getPayload() { return payload; }
    public Instant getCreatedAt() { return createdAt; }

    public void setType(String type) { this.type = type; }
    public void setActor(@Nullable String actor) { this.actor = actor; }
    public void setSubject(@Nullable String subject) { this.subject = subject; }
    public void setPayload(String payload) { this.payload = payload; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }
}
