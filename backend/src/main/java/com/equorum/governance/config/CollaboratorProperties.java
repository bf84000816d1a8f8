package com.equorum.governance.config;

import io.micronaut.context.annotation.EachProperty;
import io.micronaut.context.annotation.Parameter;

import java.util.ArrayList;
import java.util.List;

/**
 * One entry per external collaborator (staking, faucet, vesting, reserve...)
 * that governance may reconfigure through {@code setParameter(string,uint256)}.
 *
 * <pre>
 * governance:
 *   collaborators:
 *     staking:
 *       parameters: [base-apy, max-apy]
 * </pre>
 */
@EachProperty("governance.collaborators")
public class CollaboratorProperties {

    private final String name;

    private List<String> parameters = new ArrayList<>();

    public CollaboratorProperties(@Parameter String name) {
        this.name = name;
    }

    public String getName() { return name; }

    public List<String> getParameters() { return parameters; }
    public void setParameters(List<String> parameters) { this.parameters = parameters; }
}
