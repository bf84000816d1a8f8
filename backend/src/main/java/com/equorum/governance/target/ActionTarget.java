package com.equorum.governance.target;

/**
 * Something a queued timelock entry can call into.
 *
 * Implementations:
 *   TimelockTarget     - self-calls on the timelock (admin handover)
 *   GovernanceTarget   - the orchestrator accepting the admin role
 *   CollaboratorTarget - one per configured collaborator, setParameter(string,uint256)
 */
public interface ActionTarget {

    /** Target identifier used in proposal actions and entries. */
    String name();

    boolean supports(CallSignature signature);

    /**
     * Performs the call. Runs inside the executing transaction, so any
     * exception undoes the writes of every call made in that execution.
     *
     * @throws com.equorum.governance.error.GovernanceException with TARGET_REVERTED when the target refuses
     */
    void invoke(ActionCall call);
}
