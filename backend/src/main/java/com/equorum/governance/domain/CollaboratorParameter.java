package com.equorum.governance.domain;

import jakarta.persistence.*;

import java.math.BigInteger;
import java.time.Instant;

/** A parameter value written to an external collaborator by an executed action. */
@Entity
@Table(name = "collaborator_parameters",
       uniqueConstraints = @UniqueConstraint(name = "uq_collaborator_parameter", columnNames = {"collaborator", "name"}))
public class CollaboratorParameter {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 64)
    private String collaborator;

    @Column(nullable = false, length = 128)
    private String name;

    @Column(name = "param_value", nullable = false, precision = 78, scale = 0)
    private BigInteger value;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    public CollaboratorParameter() {}

    public CollaboratorParameter(String collaborator, String name) {
        this.collaborator = collaborator;
        this.name = name;
    }

    public Long getId() { return id; }

    public String getCollaborator() { return collaborator; }
    public String getName() { return name; }

    public BigInteger getValue() { return value; }
    public void setValue(BigInteger value) { this.value = value; }

    public Instant getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }
}
