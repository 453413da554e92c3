package com.thumbservice.thumbnail_engine.exception;

/**
 * An external tool could not be started, timed out, or exited non-zero.
 */
public class ExternalCommandException extends RuntimeException {

    private final int exitCode;

    public ExternalCommandException(String message, int exitCode) {
        super(message);
        this.exitCode = exitCode;
    }

    public ExternalCommandException(String message, Throwable cause) {
        super(message, cause);
        this.exitCode = -1;
    }

    /**
     * Process exit code, or -1 when the process never exited normally.
     */
    public int getExitCode() {
        return exitCode;
    }
}
