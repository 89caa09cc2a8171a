package com.pageready.loadable;

/**
 * The result of running one {@link LoadValidation} against its host.
 *
 * A validation either:
 *   - PASSED -- the host satisfies this check; evaluation moves to the next rule.
 *   - FAILED -- the host is not ready; evaluation stops here and the optional
 *               message becomes the host's load error.
 *
 * Immutable -- use the static factories.
 */
public final class LoadOutcome {

    public enum Status { PASSED, FAILED }

    private static final LoadOutcome PASSED = new LoadOutcome(Status.PASSED, null);
    private static final LoadOutcome FAILED_SILENTLY = new LoadOutcome(Status.FAILED, null);

    private final Status status;
    private final String message;   // null when passed or when the rule gave no reason

    private LoadOutcome(Status status, String message) {
        this.status  = status;
        this.message = message;
    }

    // ── Static factories ──────────────────────────────────────────────────────

    public static LoadOutcome passed() {
        return PASSED;
    }

    /** Failed without a diagnostic; the host's load error stays cleared. */
    public static LoadOutcome failed() {
        return FAILED_SILENTLY;
    }

    public static LoadOutcome failed(String message) {
        return message == null ? FAILED_SILENTLY : new LoadOutcome(Status.FAILED, message);
    }

    /**
     * Normalises a {@code (passed, message)} pair. A message attached to a
     * passing result is dropped.
     */
    public static LoadOutcome of(boolean passed, String message) {
        return passed ? PASSED : failed(message);
    }

    // ── Getters ───────────────────────────────────────────────────────────────

    public boolean isPassed() { return status == Status.PASSED; }
    public boolean isFailed() { return status == Status.FAILED; }

    public Status getStatus()  { return status; }
    public String getMessage() { return message; }

    @Override
    public String toString() {
        return status == Status.PASSED
            ? "LoadOutcome{PASSED}"
            : String.format("LoadOutcome{FAILED, message=%s}", message == null ? null : "'" + message + "'");
    }
}
