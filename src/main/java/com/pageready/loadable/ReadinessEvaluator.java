package com.pageready.loadable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Answers "is this object ready to act on?" using the validations resolved by
 * a {@link LoadValidationRegistry}.
 *
 * <h3>Evaluation</h3>
 * Validations run in registry order (ancestors first). The first one that fails
 * stops evaluation; its message, if any, becomes the host's load error. Later
 * validations are not run, because they may rely on what the earlier ones
 * established. A host with no validations at all is loaded.
 *
 * <h3>Memoization</h3>
 * {@link #isLoaded} never caches. {@link #whenLoaded} caches a positive result
 * on the host for the duration of its action only, so nested readiness checks
 * made by the action (directly or through other page methods) return at once.
 * The previous value is put back on every exit path, which makes nested
 * {@code whenLoaded} calls safe:
 *
 * <pre>
 *   evaluator.whenLoaded(checkoutPage, page -> {
 *       page.fillAddress(address);                         // isLoaded() is cached here
 *       return evaluator.whenLoaded(page.paymentSection(), s -> s.submit());
 *   });
 *   // checkoutPage.getLoadState().getLoaded() is back to what it was before
 * </pre>
 *
 * Exceptions thrown by validations or actions are never caught here.
 */
public class ReadinessEvaluator {

    private static final Logger log = LoggerFactory.getLogger(ReadinessEvaluator.class);

    static final String MISSING_ACTION = "An action was expected, but none received.";

    private final LoadValidationRegistry registry;

    public ReadinessEvaluator(LoadValidationRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    /** An evaluator over the registry the host itself declares. */
    public static ReadinessEvaluator forHost(Loadable host) {
        return new ReadinessEvaluator(host.getLoadValidationRegistry());
    }

    // ── Primary API ───────────────────────────────────────────────────────────

    /**
     * Checks whether {@code host} is loaded.
     *
     * Always clears the host's load error first. Returns {@code true} without
     * running anything when an enclosing {@link #whenLoaded} has already cached
     * a positive result. Does not update the cached result itself.
     *
     * @return {@code true} if every validation passed
     */
    public boolean isLoaded(Loadable host) {
        LoadState state = host.getLoadState();
        state.setLoadError(null);

        if (state.isMemoizedLoaded()) {
            return true;
        }
        return validationsPass(host, state);
    }

    /**
     * Runs {@code action} against {@code host} if, and only if, the host is
     * loaded.
     *
     * @return whatever the action returns
     * @throws IllegalArgumentException if {@code action} is null; the host is not touched
     * @throws NotLoadedException       if a validation failed; the action is not run
     * @throws E                        if the action throws it
     */
    public <T extends Loadable, R, E extends Exception> R whenLoaded(T host, LoadedAction<? super T, R, E> action)
            throws E {
        LoadState state = host.getLoadState();
        // Saved before anything else so a nested call restores the outer call's value.
        Boolean previouslyLoaded = state.getLoaded();
        if (action == null) {
            throw new IllegalArgumentException(MISSING_ACTION);
        }

        try {
            state.setLoaded(isLoaded(host));
            if (!state.getLoaded()) {
                throw new NotLoadedException(state.getLoadError());
            }
            return action.apply(host);
        } finally {
            state.setLoaded(previouslyLoaded);
        }
    }

    /** {@link #whenLoaded} for actions that produce no result. */
    public <T extends Loadable, E extends Exception> void runWhenLoaded(T host, LoadedAction.Block<? super T, E> block)
            throws E {
        if (block == null) {
            throw new IllegalArgumentException(MISSING_ACTION);
        }
        whenLoaded(host, h -> {
            block.run(h);
            return null;
        });
    }

    // ── Internals ─────────────────────────────────────────────────────────────

    private boolean validationsPass(Loadable host, LoadState state) {
        List<LoadValidationRegistry.Registration<?>> validations = registry.effectiveRegistrations(host.getClass());
        log.debug("ReadinessEvaluator: evaluating {} validation(s) for {}",
            validations.size(), host.getClass().getSimpleName());

        for (int i = 0; i < validations.size(); i++) {
            LoadOutcome outcome = validations.get(i).validate(host);
            if (outcome == null) {
                throw new IllegalStateException(
                    "Load validation #" + (i + 1) + " for " + host.getClass().getName()
                    + " returned null instead of a LoadOutcome");
            }
            if (outcome.isFailed()) {
                if (outcome.getMessage() != null) {
                    state.setLoadError(outcome.getMessage());
                }
                log.debug("ReadinessEvaluator: {} not loaded -- validation #{} of {} failed: {}",
                    host.getClass().getSimpleName(), i + 1, validations.size(), outcome.getMessage());
                return false;
            }
        }
        return true;
    }
}
