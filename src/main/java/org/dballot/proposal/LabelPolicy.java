package org.dballot.proposal;

/**
 * What to do with a proposal name whose UTF-8 encoding exceeds {@link ProposalLabel#SIZE} bytes.
 */
public enum LabelPolicy {
    /** Keep the longest prefix that fits without splitting a character. */
    TRUNCATE,
    /** Refuse the name. */
    REJECT
}
