package com.equorum.governance.ledger;

import java.math.BigInteger;

/**
 * The external fungible-token ledger, seen only through balance reads and
 * custody transfers.
 */
public interface TokenLedger {

    BigInteger balanceOf(String principal);

    /**
     * Moves {@code amount} minor units from {@code from} to {@code to}.
     *
     * @return false when the ledger declined the transfer
     */
    boolean transferFrom(String from, String to, BigInteger amount);
}
