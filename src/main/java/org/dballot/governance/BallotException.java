package org.dballot.governance;

public class BallotException extends RuntimeException {

    private final BallotError error;

    public BallotException(BallotError error, String message) {
        super(message);
        this.error = error;
    }

    public BallotError getError() {
        return error;
    }

    @Override
    public String toString() {
        return "BallotException{" + error + ": " + getMessage() + '}';
    }
}
