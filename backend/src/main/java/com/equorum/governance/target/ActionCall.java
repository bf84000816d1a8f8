package com.equorum.governance.target;

import java.math.BigInteger;
import java.util.List;

/**
 * A decoded call handed to an {@link ActionTarget}.
 *
 * @param caller identity the call runs as (the timelock itself for queued entries)
 */
public record ActionCall(String caller, String target, BigInteger value, CallSignature signature, List<String> arguments) {

    public String argument(int index) {
        return arguments.get(index);
    }
}
