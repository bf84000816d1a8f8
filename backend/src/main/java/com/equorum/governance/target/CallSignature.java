package com.equorum.governance.target;

import com.equorum.governance.error.ErrorCode;
import com.equorum.governance.error.GovernanceException;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A human-readable function signature such as {@code setParameter(string,uint256)}.
 *
 * Supported parameter types: string, uint256, address, bool.
 */
public record CallSignature(String function, List<String> parameterTypes) {

    private static final Pattern SIGNATURE = Pattern.compile("^([A-Za-z_][A-Za-z0-9_]*)\\(([a-z0-9,]*)\\)$");
    private static final Pattern ADDRESS = Pattern.compile("^[A-Za-z0-9][A-Za-z0-9_.:-]{0,127}$");
    private static final List<String> TYPES = List.of("string", "uint256", "address", "bool");

    public static CallSignature parse(String signature) {
        if (signature == null) {
            throw new GovernanceException(ErrorCode.INVALID_SIGNATURE, "Signature is required");
        }
        Matcher m = SIGNATURE.matcher(signature.trim());
        if (!m.matches()) {
            throw new GovernanceException(ErrorCode.INVALID_SIGNATURE, "Malformed signature: " + signature);
        }
        List<String> types = m.group(2).isEmpty() ? List.of() : Arrays.asList(m.group(2).split(",", -1));
        for (String type : types) {
            if (!TYPES.contains(type)) {
                throw new GovernanceException(ErrorCode.INVALID_SIGNATURE,
                    "Unsupported parameter type '" + type + "' in " + signature);
            }
        }
        return new CallSignature(m.group(1), List.copyOf(types));
    }

    public int arity() {
        return parameterTypes.size();
    }

    /** Canonical text form, e.g. {@code changeAdmin(string)}. */
    public String canonical() {
        return function + "(" + String.join(",", parameterTypes) + ")";
    }

    /** Checks decoded arguments against the parameter types. */
    public void checkArguments(List<String> arguments) {
        if (arguments.size() != arity()) {
            throw new GovernanceException(ErrorCode.INVALID_CALLDATA,
                canonical() + " takes " + arity() + " argument(s), got " + arguments.size());
        }
        for (int i = 0; i < arguments.size(); i++) {
            String arg = arguments.get(i);
            String type = parameterTypes.get(i);
            if (arg == null || !accepts(type, arg)) {
                throw new GovernanceException(ErrorCode.INVALID_CALLDATA,
                    "Argument " + i + " of " + canonical() + " is not a valid " + type + ": " + arg);
            }
        }
    }

    private static boolean accepts(String type, String arg) {
        switch (type) {
            case "uint256":
                try {
                    return new BigInteger(arg).signum() >= 0;
                } catch (NumberFormatException e) {
                    return false;
                }
            case "address":
                return ADDRESS.matcher(arg).matches();
            case "bool":
                return "true".equals(arg) || "false".equals(arg);
            default:
                return true;
        }
    }

    @Override
    public String toString() {
        return canonical();
    }
}
