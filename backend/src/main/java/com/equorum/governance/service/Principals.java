package com.equorum.governance.service;

import com.equorum.governance.config.GovernanceProperties;
import com.equorum.governance.error.ErrorCode;
import com.equorum.governance.error.GovernanceException;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;

import java.util.regex.Pattern;

/**
 * Validates caller identities arriving over the API.
 *
 * The orchestrator and timelock identities act only from inside the service,
 * so external callers cannot claim them.
 */
@Singleton
public class Principals {

    static final Pattern PRINCIPAL = Pattern.compile("^[A-Za-z0-9][A-Za-z0-9_.:-]{0,127}$");

    @Inject GovernanceProperties properties;

    public static String require(String principal) {
        if (principal == null || !PRINCIPAL.matcher(principal).matches()) {
            throw new GovernanceException(ErrorCode.INVALID_PRINCIPAL, "Invalid principal: " + principal);
        }
        return principal;
    }

    public String external(String principal) {
        require(principal);
        if (isInternal(principal)) {
            throw new GovernanceException(ErrorCode.INVALID_PRINCIPAL,
                "Principal '" + principal + "' is reserved for the service itself");
        }
        return principal;
    }

    public boolean isInternal(String principal) {
        return principal.equals(properties.getOrchestratorPrincipal())
            || principal.equals(properties.getTimelock().getPrincipal());
    }

    public boolean isExcluded(String principal) {
        return properties.getVoting().getExcludedPrincipals().contains(principal);
    }
}
