package com.equorum.governance;

import com.equorum.governance.error.ErrorCode;
import com.equorum.governance.error.GovernanceException;
import com.equorum.governance.ledger.HttpTokenLedger;
import com.equorum.governance.ledger.TokenLedger;
import io.micronaut.test.extensions.junit5.annotation.MicronautTest;
import jakarta.inject.Inject;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/** token-ledger.url points at a closed port in the test configuration. */
@MicronautTest
class HttpTokenLedgerTest {

    @Inject TokenLedger tokenLedger;

    @Test
    void balanceOf_unreachableLedger_ledgerUnavailable() {
        assertThat(tokenLedger).isInstanceOf(HttpTokenLedger.class);

        assertThatThrownBy(() -> tokenLedger.balanceOf("alice"))
            .isInstanceOfSatisfying(GovernanceException.class, e -> {
                assertThat(e.getCode()).isEqualTo(ErrorCode.LEDGER_UNAVAILABLE);
                assertThat(e.isRetryable()).isTrue();
            });
    }

    @Test
    void transferFrom_unreachableLedger_ledgerUnavailable() {
        assertThatThrownBy(() -> tokenLedger.transferFrom("alice", "governance", BigInteger.TEN))
            .isInstanceOfSatisfying(GovernanceException.class, e ->
                assertThat(e.getCode()).isEqualTo(ErrorCode.LEDGER_UNAVAILABLE));
    }
}
