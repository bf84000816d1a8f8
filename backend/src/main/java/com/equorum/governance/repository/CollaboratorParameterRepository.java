package com.equorum.governance.repository;

import com.equorum.governance.domain.CollaboratorParameter;
import io.micronaut.data.annotation.Repository;
import io.micronaut.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

@Repository
public interface CollaboratorParameterRepository extends JpaRepository<CollaboratorParameter, Long> {

    Optional<CollaboratorParameter> findByCollaboratorAndName(String collaborator, String name);

    List<CollaboratorParameter> findByCollaboratorOrderByNameAsc(String collaborator);
}
