package com.equorum.governance.target;

import com.equorum.governance.service.TimelockQueue;
import jakarta.inject.Inject;
import jakarta.inject.Provider;
import jakarta.inject.Singleton;

import java.util.Set;

/**
 * Self-calls on the timelock. Queued entries run as the timelock's own
 * identity, which is what lets an approved proposal nominate a new admin.
 * Accepting stays with the nominee.
 */
@Singleton
public class TimelockTarget implements ActionTarget {

    static final String NAME = "timelock";
    private static final Set<String> SIGNATURES = Set.of("changeAdmin(string)");

    @Inject Provider<TimelockQueue> timelockQueue;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public boolean supports(CallSignature signature) {
        return SIGNATURES.contains(signature.canonical());
    }

    @Override
    public void invoke(ActionCall call) {
        switch (call.signature().function()) {
            case "changeAdmin" -> timelockQueue.get().changeAdmin(call.caller(), call.argument(0));
            default -> throw new IllegalStateException("Unsupported timelock call: " + call.signature());
        }
    }
}
