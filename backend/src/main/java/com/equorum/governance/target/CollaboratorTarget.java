package com.equorum.governance.target;

import com.equorum.governance.config.CollaboratorProperties;
import com.equorum.governance.domain.CollaboratorParameter;
import com.equorum.governance.dto.CollaboratorParameterResponse;
import com.equorum.governance.error.ErrorCode;
import com.equorum.governance.error.GovernanceException;
import com.equorum.governance.repository.CollaboratorParameterRepository;
import io.micronaut.context.annotation.EachBean;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.time.Clock;
import java.util.List;

/**
 * An external collaborator (staking, faucet, vesting, reserve...) that
 * governance reconfigures with {@code setParameter(string,uint256)}.
 *
 * Only parameter names listed under {@code governance.collaborators.<name>.parameters}
 * are accepted. Values are recorded so the collaborator can pick them up.
 */
@EachBean(CollaboratorProperties.class)
public class CollaboratorTarget implements ActionTarget {

    private static final Logger log = LoggerFactory.getLogger(CollaboratorTarget.class);
    static final String SET_PARAMETER = "setParameter(string,uint256)";

    private final CollaboratorProperties config;

    @Inject CollaboratorParameterRepository parameterRepository;
    @Inject Clock clock;

    public CollaboratorTarget(CollaboratorProperties config) {
        this.config = config;
    }

    @Override
    public String name() {
        return config.getName();
    }

    @Override
    public boolean supports(CallSignature signature) {
        return SET_PARAMETER.equals(signature.canonical());
    }

    @Override
    @Transactional
    public void invoke(ActionCall call) {
        if (call.value().signum() != 0) {
            throw new GovernanceException(ErrorCode.TARGET_REVERTED, name() + " does not accept value");
        }
        String parameter = call.argument(0);
        if (!config.getParameters().contains(parameter)) {
            throw new GovernanceException(ErrorCode.TARGET_REVERTED,
                name() + " has no parameter '" + parameter + "'");
        }
        BigInteger value = new BigInteger(call.argument(1));

        CollaboratorParameter row = parameterRepository.findByCollaboratorAndName(name(), parameter)
            .orElseGet(() -> new CollaboratorParameter(name(), parameter));
        BigInteger previous = row.getValue();
        row.setValue(value);
        row.setUpdatedAt(clock.instant());
        if (row.getId() == null) {
            parameterRepository.save(row);
        } else {
            parameterRepository.update(row);
        }
        log.info("Collaborator parameter set: collaborator={} name={} value={} previous={}", name(), parameter, value, previous);
    }

    @Transactional
    public List<CollaboratorParameterResponse> parameters() {
        return parameterRepository.findByCollaboratorOrderByNameAsc(name()).stream()
            .map(p -> new CollaboratorParameterResponse(p.getCollaborator(), p.getName(), p.getValue(), p.getUpdatedAt()))
            .toList();
    }
}
