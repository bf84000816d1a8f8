package com.equorum.governance.service;

import com.equorum.governance.config.GovernanceProperties;
import com.equorum.governance.domain.EntryState;
import com.equorum.governance.domain.EntryStatus;
import com.equorum.governance.domain.TimelockAdmin;
import com.equorum.governance.domain.TimelockEntry;
import com.equorum.governance.dto.AdminResponse;
import com.equorum.governance.dto.TimelockEntryResponse;
import com.equorum.governance.error.ErrorCode;
import com.equorum.governance.error.GovernanceException;
import com.equorum.governance.repository.TimelockEntryRepository;
import com.equorum.governance.target.ActionCall;
import com.equorum.governance.target.TargetRegistry;
import io.micronaut.context.event.StartupEvent;
import io.micronaut.http.HttpStatus;
import io.micronaut.http.exceptions.HttpStatusException;
import io.micronaut.runtime.event.annotation.EventListener;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import jakarta.persistence.EntityManager;
import jakarta.persistence.LockModeType;
import jakarta.transaction.Transactional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Delayed-execution gate.
 *
 * Entries are keyed by {@link ContentHash}. Queue, execute and cancel are
 * restricted to the current admin, read from the admin row on every call.
 * Every mutation row-locks that single admin row first, so the queue has
 * exactly one writer at a time.
 *
 * Readiness ({@code now >= eta}) and expiry ({@code now > eta + grace}) are
 * pure clock comparisons; nothing sweeps expired entries.
 */
@Singleton
public class TimelockQueue {

    private static final Logger log = LoggerFactory.getLogger(TimelockQueue.class);

    @Inject TimelockEntryRepository entryRepository;
    @Inject TargetRegistry targetRegistry;
    @Inject GovernanceProperties properties;
    @Inject EventLogService eventLog;
    @Inject EntityManager entityManager;
    @Inject Clock clock;

    @EventListener
    @Transactional
    public void onStartup(StartupEvent event) {
        TimelockAdmin admin = lockAdmin();
        log.info("Timelock ready: admin={} pendingAdmin={} minDelay={} gracePeriod={}",
            admin.getAdmin(), admin.getPendingAdmin(), minDelay(), gracePeriod());
    }

    @Transactional
    public TimelockEntryResponse queueEntry(String caller, String target, BigInteger value,
                                            String signature, String calldata, Instant eta) {
        return queueEntry(caller, target, value, signature, calldata, eta, null);
    }

    /**
     * @param proposalId proposal the entry belongs to, null for entries queued directly by the admin
     */
    @Transactional
    public TimelockEntryResponse queueEntry(String caller, String target, BigInteger value,
                                            String signature, String calldata, Instant eta, Long proposalId) {
        requireAdmin(lockAdmin(), caller);
        Instant now = clock.instant();
        if (eta == null) {
            throw new GovernanceException(ErrorCode.ETA_OUT_OF_RANGE, "eta is required");
        }
        Instant earliest = now.plus(minDelay());
        Instant latest = earliest.plus(gracePeriod());
        if (eta.isBefore(earliest) || eta.isAfter(latest)) {
            throw new GovernanceException(ErrorCode.ETA_OUT_OF_RANGE,
                "eta " + eta + " must lie between " + earliest + " and " + latest);
        }
        BigInteger callValue = value != null ? value : BigInteger.ZERO;
        ActionCall call = targetRegistry.validate(caller, target, callValue, signature,
            calldata != null ? calldata : "[]");
        String callSignature = call.signature().canonical();
        String callData = targetRegistry.canonicalCalldata(call);

        String hash = ContentHash.of(target, callValue, callSignature, callData, eta);
        TimelockEntry entry = entityManager.find(TimelockEntry.class, hash, LockModeType.PESSIMISTIC_WRITE);
        if (entry != null && entry.getStatus() == EntryStatus.QUEUED) {
            throw new GovernanceException(ErrorCode.ALREADY_QUEUED, "Entry already queued: " + hash);
        }
        if (entry != null && entry.getStatus() == EntryStatus.EXECUTED) {
            throw new GovernanceException(ErrorCode.ALREADY_EXECUTED, "Entry already executed: " + hash);
        }
        boolean requeued = entry != null;
        if (!requeued) {
            entry = new TimelockEntry();
            entry.setHash(hash);
            entry.setTarget(target);
            entry.setValue(callValue);
            entry.setSignature(callSignature);
            entry.setCalldata(callData);
            entry.setEta(eta);
        }
        entry.setStatus(EntryStatus.QUEUED);
        entry.setProposalId(proposalId);
        entry.setQueuedAt(now);
        entry.setCanceledAt(null);
        if (!requeued) {
            entityManager.persist(entry);
        }

        log.info("Timelock entry queued: hash={} target={} signature={} eta={} proposal={}",
            hash, target, callSignature, eta, proposalId);
        Map<String, Object> payload = new HashMap<>();
        payload.put("target", target);
        payload.put("signature", callSignature);
        payload.put("eta", eta.toString());
        payload.put("proposalId", proposalId);
        eventLog.record("timelock_entry_queued", caller, subject(hash), payload);
        return toResponse(entry, now);
    }

    @Transactional
    public TimelockEntryResponse executeEntry(String caller, String hash) {
        requireAdmin(lockAdmin(), caller);
        TimelockEntry entry = lockEntry(hash);
        if (entry.getStatus() == EntryStatus.EXECUTED) {
            throw new GovernanceException(ErrorCode.ALREADY_EXECUTED, "Entry already executed: " + hash);
        }
        Instant now = clock.instant();
        if (now.isBefore(entry.getEta())) {
            throw new GovernanceException(ErrorCode.NOT_READY,
                "Entry " + hash + " cannot execute before " + entry.getEta());
        }
        if (now.isAfter(entry.getEta().plus(gracePeriod()))) {
            throw new GovernanceException(ErrorCode.STALE_TRANSACTION,
                "Entry " + hash + " expired at " + entry.getEta().plus(gracePeriod()));
        }

        ActionCall call = targetRegistry.validate(timelockPrincipal(), entry.getTarget(), entry.getValue(),
            entry.getSignature(), entry.getCalldata());
        try {
            targetRegistry.resolve(entry.getTarget()).invoke(call);
        } catch (GovernanceException e) {
            if (e.getCode() == ErrorCode.TARGET_REVERTED) {
                throw e;
            }
            throw new GovernanceException(ErrorCode.TARGET_REVERTED,
                entry.getTarget() + "." + call.signature() + " reverted: " + e.getMessage(), e);
        }

        entry.setStatus(EntryStatus.EXECUTED);
        entry.setExecutedAt(now);

        log.info("Timelock entry executed: hash={} target={} signature={}", hash, entry.getTarget(), entry.getSignature());
        eventLog.record("timelock_entry_executed", caller, subject(hash),
            Map.of("target", entry.getTarget(), "signature", entry.getSignature()));
        return toResponse(entry, now);
    }

    @Transactional
    public TimelockEntryResponse cancelEntry(String caller, String hash) {
        requireAdmin(lockAdmin(), caller);
        TimelockEntry entry = lockEntry(hash);
        if (entry.getStatus() == EntryStatus.EXECUTED) {
            throw new GovernanceException(ErrorCode.ALREADY_EXECUTED, "Entry already executed: " + hash);
        }
        Instant now = clock.instant();
        entry.setStatus(EntryStatus.CANCELED);
        entry.setCanceledAt(now);

        log.info("Timelock entry canceled: hash={} target={}", hash, entry.getTarget());
        eventLog.record("timelock_entry_canceled", caller, subject(hash), Map.of("target", entry.getTarget()));
        return toResponse(entry, now);
    }

    /**
     * First half of the admin handover. Allowed for the admin, and for the
     * timelock itself while it executes a queued self-call. The timelock's own
     * identity can never be nominated: nothing outside a queued entry can act as it.
     */
    @Transactional
    public AdminResponse changeAdmin(String caller, String newAdmin) {
        TimelockAdmin admin = lockAdmin();
        if (!caller.equals(admin.getAdmin()) && !caller.equals(timelockPrincipal())) {
            throw new GovernanceException(ErrorCode.NOT_ADMIN, caller + " is not the timelock admin");
        }
        Principals.require(newAdmin);
        if (newAdmin.equals(timelockPrincipal())) {
            throw new GovernanceException(ErrorCode.INVALID_PRINCIPAL,
                "The timelock cannot be nominated as its own admin");
        }
        admin.setPendingAdmin(newAdmin);
        admin.setUpdatedAt(clock.instant());

        log.info("Timelock admin nominated: admin={} pendingAdmin={} by={}", admin.getAdmin(), newAdmin, caller);
        eventLog.record("timelock_admin_nominated", caller, "timelock:admin",
            Map.of("admin", admin.getAdmin(), "pendingAdmin", newAdmin));
        return new AdminResponse(admin.getAdmin(), admin.getPendingAdmin());
    }

    @Transactional
    public AdminResponse acceptAdmin(String caller) {
        TimelockAdmin admin = lockAdmin();
        if (admin.getPendingAdmin() == null || !admin.getPendingAdmin().equals(caller)) {
            throw new GovernanceException(ErrorCode.NOT_PENDING_ADMIN, caller + " is not the pending timelock admin");
        }
        String previous = admin.getAdmin();
        admin.setAdmin(caller);
        admin.setPendingAdmin(null);
        admin.setUpdatedAt(clock.instant());

        log.info("Timelock admin accepted: admin={} previous={}", caller, previous);
        eventLog.record("timelock_admin_accepted", caller, "timelock:admin",
            Map.of("admin", caller, "previous", previous));
        return new AdminResponse(admin.getAdmin(), null);
    }

    @Transactional
    public AdminResponse admin() {
        TimelockAdmin admin = entityManager.find(TimelockAdmin.class, TimelockAdmin.SINGLETON_ID);
        if (admin == null) {
            return new AdminResponse(properties.getTimelock().getInitialAdmin(), null);
        }
        return new AdminResponse(admin.getAdmin(), admin.getPendingAdmin());
    }

    @Transactional
    public TimelockEntryResponse entry(String hash) {
        TimelockEntry entry = entryRepository.findById(hash)
            .orElseThrow(() -> new HttpStatusException(HttpStatus.NOT_FOUND, "Timelock entry not found: " + hash));
        return toResponse(entry, clock.instant());
    }

    @Transactional
    public List<TimelockEntryResponse> entriesForProposal(Long proposalId) {
        Instant now = clock.instant();
        return entryRepository.findByProposalId(proposalId).stream().map(e -> toResponse(e, now)).toList();
    }

    public EntryState stateOf(TimelockEntry entry, Instant now) {
        return EntryState.derive(entry, now, gracePeriod());
    }

    private TimelockAdmin lockAdmin() {
        TimelockAdmin admin = entityManager.find(TimelockAdmin.class, TimelockAdmin.SINGLETON_ID, LockModeType.PESSIMISTIC_WRITE);
        if (admin == null) {
            admin = new TimelockAdmin(properties.getTimelock().getInitialAdmin(), clock.instant());
            entityManager.persist(admin);
            entityManager.flush();
            log.info("Timelock admin seeded: admin={}", admin.getAdmin());
        }
        return admin;
    }

    private void requireAdmin(TimelockAdmin admin, String caller) {
        if (!admin.getAdmin().equals(caller)) {
            throw new GovernanceException(ErrorCode.NOT_ADMIN, caller + " is not the timelock admin");
        }
    }

    private TimelockEntry lockEntry(String hash) {
        TimelockEntry entry = hash == null ? null
            : entityManager.find(TimelockEntry.class, hash, LockModeType.PESSIMISTIC_WRITE);
        if (entry == null || entry.getStatus() == EntryStatus.CANCELED) {
            throw new GovernanceException(ErrorCode.MISSING_ENTRY, "No queued entry with hash " + hash);
        }
        return entry;
    }

    private TimelockEntryResponse toResponse(TimelockEntry e, Instant now) {
        return new TimelockEntryResponse(
            e.getHash(),
            e.getTarget(),
            e.getValue(),
            e.getSignature(),
            e.getCalldata(),
            e.getEta(),
            stateOf(e, now).name(),
            e.getProposalId(),
            e.getQueuedAt(),
            e.getExecutedAt(),
            e.getCanceledAt()
        );
    }

    private Duration minDelay() {
        return properties.getTimelock().getMinDelay();
    }

    private Duration gracePeriod() {
        return properties.getTimelock().getGracePeriod();
    }

    private String timelockPrincipal() {
        return properties.getTimelock().getPrincipal();
    }

    static String subject(String hash) {
        return "entry:" + hash;
    }
}
