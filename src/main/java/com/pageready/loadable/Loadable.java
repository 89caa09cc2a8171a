package com.pageready.loadable;

/**
 * Implemented by every object whose readiness can be checked: pages, sections,
 * or any composite UI object.
 *
 * The rules themselves are not declared here. Each implementing class registers
 * them against its own type in a {@link LoadValidationRegistry}, and inherits
 * the rules of every {@code Loadable} superclass, most-ancestral first.
 *
 * Implementations must:
 *   - Hold one {@link LoadState} for their whole lifetime and return it from
 *     {@link #getLoadState()}
 *   - Leave that state alone; only {@link ReadinessEvaluator} writes to it
 */
public interface Loadable {

    LoadState getLoadState();

    /**
     * The registry whose rules apply to this object. Override to bind an
     * instance to a registry other than the process-wide one.
     */
    default LoadValidationRegistry getLoadValidationRegistry() {
        return LoadValidationRegistry.global();
    }

    /**
     * Runs this object's load validations, or returns {@code true} straight away
     * when called inside a {@code whenLoaded} action that already confirmed it.
     *
     * @see ReadinessEvaluator#isLoaded(Loadable)
     */
    default boolean isLoaded() {
        return new ReadinessEvaluator(getLoadValidationRegistry()).isLoaded(this);
    }

    /** Diagnostic from the last failing validation, or {@code null}. */
    default String getLoadError() {
        return getLoadState().getLoadError();
    }
}
