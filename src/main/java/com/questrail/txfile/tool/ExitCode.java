package com.questrail.txfile.tool;

/**
 * Process exit codes shared by the command-line tools.
 */
public enum ExitCode
{
    /** Successful execution. */
    SUCCESS(0),
    /** A file could not be opened, or a read, parse or write failed. */
    FAILURE(1),
    /** Command-line arguments were invalid. */
    INVALID_ARGS(2);

    private final int code;

    ExitCode(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }
}
