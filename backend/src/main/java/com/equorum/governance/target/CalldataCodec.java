package com.equorum.governance.target;

import com.equorum.governance.error.ErrorCode;
import com.equorum.governance.error.GovernanceException;
import io.micronaut.core.type.Argument;
import io.micronaut.serde.ObjectMapper;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;

import java.io.IOException;
import java.util.List;

/**
 * Encoded call arguments are a JSON array of strings, e.g. {@code ["baseApy","0"]}.
 * Stored and hashed calldata is always the compact form {@link #encode} writes.
 */
@Singleton
public class CalldataCodec {

    @Inject ObjectMapper objectMapper;

    public List<String> decode(String calldata) {
        if (calldata == null || calldata.isBlank()) {
            return List.of();
        }
        try {
            List<String> args = objectMapper.readValue(calldata, Argument.listOf(String.class));
            if (args == null) {
                throw new GovernanceException(ErrorCode.INVALID_CALLDATA, "Calldata must be a JSON array");
            }
            return args;
        } catch (IOException e) {
            throw new GovernanceException(ErrorCode.INVALID_CALLDATA, "Calldata is not a JSON array of strings", e);
        }
    }

    public String encode(List<String> arguments) {
        try {
            return objectMapper.writeValueAsString(arguments);
        } catch (IOException e) {
            throw new GovernanceException(ErrorCode.INVALID_CALLDATA, "Cannot encode call arguments", e);
        }
    }
}
