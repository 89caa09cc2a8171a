package com.pageready.loadable;

/**
 * Work to run once a host has been confirmed loaded.
 *
 * The exception type parameter lets an action throw a checked exception
 * through {@link ReadinessEvaluator#whenLoaded} without wrapping. Lambdas that
 * throw nothing infer {@code E} as {@link RuntimeException}.
 *
 * @param <T> host type
 * @param <R> result type
 * @param <E> checked exception the action may throw
 */
@FunctionalInterface
public interface LoadedAction<T, R, E extends Exception> {

    R apply(T host) throws E;

    /** Variant for actions with no result. */
    @FunctionalInterface
    interface Block<T, E extends Exception> {
        void run(T host) throws E;
    }
}
