package com.pageready.loadable;

/**
 * Thrown when an object is required to be loaded and its load validations
 * did not all pass.
 *
 * Carries the diagnostic of the first failing validation only. Evaluation
 * short-circuits, so later validations were never run and have nothing to
 * report. {@link #getLoadError()} is {@code null} when the failing validation
 * supplied no message.
 *
 * Nothing is retried before this is thrown. Callers that want to wait for a
 * page should poll around the whole check, e.g. with
 * {@link com.pageready.page.LoadWait}.
 */
public class NotLoadedException extends RuntimeException {

    static final String NO_DIAGNOSTIC = "Object was not loaded; the failing load validation gave no reason.";

    private final String loadError;

    public NotLoadedException(String loadError) {
        super(loadError != null ? loadError : NO_DIAGNOSTIC);
        this.loadError = loadError;
    }

    public NotLoadedException(String loadError, Throwable cause) {
        super(loadError != null ? loadError : NO_DIAGNOSTIC, cause);
        this.loadError = loadError;
    }

    /** The failing validation's message, or {@code null} if it gave none. */
    public String getLoadError() {
        return loadError;
    }
}
