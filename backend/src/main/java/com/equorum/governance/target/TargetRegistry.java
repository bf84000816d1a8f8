package com.equorum.governance.target;

import com.equorum.governance.error.ErrorCode;
import com.equorum.governance.error.GovernanceException;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Resolves action targets by name and validates calls against them before
 * anything is stored.
 */
@Singleton
public class TargetRegistry {

    private static final Logger log = LoggerFactory.getLogger(TargetRegistry.class);

    private final Map<String, ActionTarget> targets;
    private final CalldataCodec calldataCodec;

    @Inject
    public TargetRegistry(List<ActionTarget> targets, CalldataCodec calldataCodec) {
        this.targets = targets.stream()
            .collect(Collectors.toMap(ActionTarget::name, t -> t, (a, b) -> {
                throw new IllegalStateException("Duplicate action target name: " + a.name());
            }, TreeMap::new));
        this.calldataCodec = calldataCodec;
        log.info("Action targets registered: {}", this.targets.keySet());
    }

    public ActionTarget resolve(String name) {
        ActionTarget target = name == null ? null : targets.get(name);
        if (target == null) {
            throw new GovernanceException(ErrorCode.INVALID_TARGET, "Unknown target: " + name);
        }
        return target;
    }

    /** Calldata in the form it is stored and hashed under, for a call that passed {@link #validate}. */
    public String canonicalCalldata(ActionCall call) {
        return calldataCodec.encode(call.arguments());
    }

    public List<String> names() {
        return List.copyOf(targets.keySet());
    }

    /**
     * Full static check of one action: known target, supported signature,
     * calldata matching the signature, non-negative value.
     *
     * @return the call as it would be invoked by {@code caller}
     */
    public ActionCall validate(String caller, String target, BigInteger value, String signature, String calldata) {
        ActionTarget resolved = resolve(target);
        if (value == null || value.signum() < 0) {
            throw new GovernanceException(ErrorCode.INVALID_AMOUNT, "Action value must be >= 0");
        }
        CallSignature sig = CallSignature.parse(signature);
        if (!resolved.supports(sig)) {
            throw new GovernanceException(ErrorCode.INVALID_SIGNATURE,
                "Target '" + target + "' does not support " + sig.canonical());
        }
        List<String> args = calldataCodec.decode(calldata);
        sig.checkArguments(args);
        return new ActionCall(caller, target, value, sig, args);
    }
}
