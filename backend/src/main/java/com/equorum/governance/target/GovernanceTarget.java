package com.equorum.governance.target;

import com.equorum.governance.service.GovernanceOrchestrator;
import jakarta.inject.Inject;
import jakarta.inject.Provider;
import jakarta.inject.Singleton;

/** Lets a queued entry make the orchestrator accept a pending timelock admin nomination. */
@Singleton
public class GovernanceTarget implements ActionTarget {

    static final String NAME = "governance";

    @Inject Provider<GovernanceOrchestrator> orchestrator;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public boolean supports(CallSignature signature) {
        return "acceptAdmin()".equals(signature.canonical());
    }

    @Override
    public void invoke(ActionCall call) {
        orchestrator.get().acceptTimelockAdmin();
    }
}
