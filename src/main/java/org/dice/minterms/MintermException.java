package org.dice.minterms;

/**
 * Raised for any malformed expression, incomplete assignment or invalid truth table.
 * The message is meant to be shown to the user as is.
 */
public class MintermException extends RuntimeException {

    private final MintermErrors error;

    public MintermException(MintermErrors error, String message) {
        super(message);
        this.error = error;
    }

    public MintermException(MintermErrors error, String message, Throwable cause) {
        super(message, cause);
        this.error = error;
    }

    public MintermErrors getError() {
        return error;
    }
}
