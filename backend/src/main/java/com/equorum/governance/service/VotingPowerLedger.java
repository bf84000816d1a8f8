package com.equorum.governance.service;

import com.equorum.governance.config.GovernanceProperties;
import com.equorum.governance.domain.TokenLock;
import com.equorum.governance.dto.LockResponse;
import com.equorum.governance.error.ErrorCode;
import com.equorum.governance.error.GovernanceException;
import com.equorum.governance.ledger.TokenLedger;
import com.equorum.governance.repository.TokenLockRepository;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import jakarta.persistence.EntityManager;
import jakarta.persistence.LockModeType;
import jakarta.persistence.PersistenceException;
import jakarta.transaction.Transactional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Instant;
import java.util.Map;

/**
 * Locked balances and the voting power derived from them.
 *
 * Power is {@code floor(sqrt(locked))}, computed on every read and never stored.
 * Locked tokens sit in the custody account (the orchestrator principal) on the
 * external token ledger until the principal unlocks.
 */
@Singleton
public class VotingPowerLedger {

    private static final Logger log = LoggerFactory.getLogger(VotingPowerLedger.class);

    @Inject TokenLockRepository lockRepository;
    @Inject TokenLedger tokenLedger;
    @Inject GovernanceProperties properties;
    @Inject Principals principals;
    @Inject EventLogService eventLog;
    @Inject EntityManager entityManager;
    @Inject Clock clock;

    public static BigInteger powerOf(BigInteger amount) {
        return amount == null || amount.signum() <= 0 ? BigInteger.ZERO : amount.sqrt();
    }

    @Transactional
    public LockResponse lock(String principal, BigInteger amount) {
        Principals.require(principal);
        if (amount == null || amount.signum() <= 0) {
            throw new GovernanceException(ErrorCode.INVALID_AMOUNT, "Lock amount must be > 0");
        }
        if (principals.isExcluded(principal)) {
            throw new GovernanceException(ErrorCode.EXCLUDED_PRINCIPAL,
                "Principal '" + principal + "' may not take part in governance");
        }

        Instant now = clock.instant();
        TokenLock lock = lockForUpdate(principal);
        boolean created = lock == null;
        BigInteger newTotal = created ? amount : lock.getAmount().add(amount);
        if (newTotal.compareTo(properties.getVoting().minimumLockAmount()) < 0) {
            throw new GovernanceException(ErrorCode.BELOW_MINIMUM_LOCK,
                "Locked total " + newTotal + " is below the minimum lock of " + properties.getVoting().getMinimumLock());
        }
        BigInteger balance = tokenLedger.balanceOf(principal);
        if (balance.compareTo(amount) < 0) {
            throw new GovernanceException(ErrorCode.INSUFFICIENT_BALANCE,
                "Balance " + balance + " is less than " + amount);
        }

        if (created) {
            lock = new TokenLock(principal, now);
        }
        lock.setAmount(newTotal);
        lock.setUpdatedAt(now);
        persistLock(lock, created);

        // custody transfer last, after the row is written
        if (!tokenLedger.transferFrom(principal, custody(), amount)) {
            throw new GovernanceException(ErrorCode.TRANSFER_FAILED, "Token ledger refused the custody transfer");
        }

        log.info("Tokens locked: principal={} amount={} total={} power={}", principal, amount, newTotal, powerOf(newTotal));
        eventLog.record("tokens_locked", principal, "lock:" + principal,
            Map.of("amount", amount.toString(), "total", newTotal.toString()));
        return toResponse(principal, lock);
    }

    @Transactional
    public LockResponse unlock(String principal) {
        Principals.require(principal);
        TokenLock lock = lockForUpdate(principal);
        if (lock == null) {
            throw new GovernanceException(ErrorCode.NO_LOCK, "No tokens locked by " + principal);
        }
        Instant now = clock.instant();
        if (lock.isCommittedAt(now)) {
            throw new GovernanceException(ErrorCode.LOCK_COMMITTED,
                "Lock is committed to an open proposal until " + lock.getCommittedUntil());
        }

        BigInteger amount = lock.getAmount();
        entityManager.remove(lock);
        entityManager.flush();
        if (!tokenLedger.transferFrom(custody(), principal, amount)) {
            throw new GovernanceException(ErrorCode.TRANSFER_FAILED, "Token ledger refused the release transfer");
        }

        log.info("Tokens unlocked: principal={} amount={}", principal, amount);
        eventLog.record("tokens_unlocked", principal, "lock:" + principal, Map.of("amount", amount.toString()));
        return toResponse(principal, null);
    }

    @Transactional
    public BigInteger votingPowerOf(String principal) {
        return lockRepository.findById(principal).map(l -> powerOf(l.getAmount())).orElse(BigInteger.ZERO);
    }

    @Transactional
    public LockResponse lockOf(String principal) {
        Principals.require(principal);
        return toResponse(principal, lockRepository.findById(principal).orElse(null));
    }

    /** Live sum of all locks. */
    @Transactional
    public BigInteger totalLocked() {
        BigInteger sum = entityManager
            .createQuery("SELECT SUM(l.amount) FROM TokenLock l", BigInteger.class)
            .getSingleResult();
        return sum != null ? sum : BigInteger.ZERO;
    }

    /**
     * Row-locks and returns the principal's lock, or null when it has none.
     * Must run inside the caller's transaction.
     */
    public TokenLock lockForUpdate(String principal) {
        return entityManager.find(TokenLock.class, principal, LockModeType.PESSIMISTIC_WRITE);
    }

    /**
     * Rejects principals that may not propose or vote with the given lock:
     * excluded identities and locks increased less than min-lock-age ago.
     */
    public void requireEligible(String principal, TokenLock lock, Instant now) {
        if (principals.isExcluded(principal)) {
            throw new GovernanceException(ErrorCode.EXCLUDED_PRINCIPAL,
                "Principal '" + principal + "' may not take part in governance");
        }
        if (lock != null && lock.getUpdatedAt().plus(properties.getVoting().getMinLockAge()).isAfter(now)) {
            throw new GovernanceException(ErrorCode.LOCK_TOO_NEW,
                "Lock last increased at " + lock.getUpdatedAt() + " is younger than " + properties.getVoting().getMinLockAge());
        }
    }

    /** Extends the principal's commitment so the lock cannot be released before {@code until}. */
    public void commit(TokenLock lock, Instant until) {
        lock.commitUntil(until);
        log.debug("Lock committed: principal={} until={}", lock.getPrincipal(), lock.getCommittedUntil());
    }

    private String custody() {
        return properties.getOrchestratorPrincipal();
    }

    private void persistLock(TokenLock lock, boolean created) {
        if (!created) {
            return;
        }
        try {
            entityManager.persist(lock);
            entityManager.flush();
        } catch (PersistenceException e) {
            log.debug("Concurrent first lock for principal={}: {}", lock.getPrincipal(), e.getMessage());
            throw new GovernanceException(ErrorCode.CONCURRENT_MODIFICATION,
                "Another lock for " + lock.getPrincipal() + " was created concurrently", e);
        }
    }

    private LockResponse toResponse(String principal, TokenLock lock) {
        if (lock == null) {
            return new LockResponse(principal, BigInteger.ZERO, BigInteger.ZERO, null, null, null);
        }
        return new LockResponse(
            principal,
            lock.getAmount(),
            powerOf(lock.getAmount()),
            lock.getLockedAt(),
            lock.getUpdatedAt(),
            lock.getCommittedUntil()
        );
    }
}
