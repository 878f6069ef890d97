package com.solverhub.protocol;

/**
 * Process exit codes of the command-line transport. Zero is the only success.
 */
public enum ExitStatus {
    PLAN_FOUND(0),
    FAILURE(1),
    UNSOLVABLE(2),
    UNSUPPORTED(3);

    private final int code;

    ExitStatus(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    public static ExitStatus of(SolveOutcome outcome) {
        return switch (outcome.status()) {
            case PLAN_FOUND -> PLAN_FOUND;
            case UNSOLVABLE -> UNSOLVABLE;
            case UNSUPPORTED -> UNSUPPORTED;
            case FAILURE -> FAILURE;
        };
    }

    /**
     * Map an exit code back to a status. Any code this enum does not know is a failure.
     */
    public static ExitStatus fromCode(int code) {
        for (ExitStatus status : values()) {
            if (status.code == code) {
                return status;
            }
        }
        return FAILURE;
    }
}
