package org.dballot.governance;

/**
 * Rejection kinds of ballot operations. Every kind leaves the ballot untouched.
 */
public enum BallotError {

    NOT_AUTHORIZED(403),
    ALREADY_HAS_RIGHTS(409),
    NO_VOTING_RIGHTS(403),
    ALREADY_VOTED(409),
    SELF_DELEGATION(400),
    DELEGATION_CYCLE(409),
    INVALID_PROPOSAL(404),
    INVALID_INPUT(400);

    private final int httpStatus;

    BallotError(int httpStatus) {
        this.httpStatus = httpStatus;
    }

    public int httpStatus() {
        return httpStatus;
    }
}
