package org.dballot.ledger;

/**
 * Per-identity state within one round. {@code VOTED} and {@code DELEGATED} are terminal.
 */
public enum VoterStatus {
    NO_RIGHTS,
    HAS_RIGHTS,
    VOTED,
    DELEGATED
}
