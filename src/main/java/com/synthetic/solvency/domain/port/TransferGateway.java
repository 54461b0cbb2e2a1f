package com.synthetic.solvency.domain.port;

/**
 * Ledger substrate that moves value between identities. A transfer either
 * moves the full amount or nothing.
 */
public interface TransferGateway {

    /**
     * @return {@code true} when the amount moved, {@code false} when the ledger refused it
     */
    boolean transfer(long amount, String from, String to);

    String custodyIdentity();
}
