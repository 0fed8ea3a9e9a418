package org.pragmatica.plint.shared;

/// Unchecked carrier for a [PlintError] where a method cannot return normally.
public class PlintException extends RuntimeException {
    private final PlintError error;

    public PlintException(PlintError error) {
        super(error.message());
        this.error = error;
    }

    public PlintException(PlintError error, Throwable cause) {
        super(error.message(), cause);
        this.error = error;
    }

    public PlintError error() {
        return error;
    }
}
