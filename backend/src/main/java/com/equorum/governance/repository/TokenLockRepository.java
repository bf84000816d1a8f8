package com.equorum.governance.repository;

import com.equorum.governance.domain.TokenLock;
import io.micronaut.data.annotation.Repository;
import io.micronaut.data.jpa.repository.JpaRepository;

@Repository
public interface TokenLockRepository extends JpaRepository<TokenLock, String> {
}
