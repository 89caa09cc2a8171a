package com.pageready.loadable;

import java.util.Objects;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * One readiness check, registered against a {@link Loadable} type and run
 * against each instance of that type (and of its subclasses).
 *
 * <pre>
 *   static {
 *       LoadValidationRegistry.global().register(SearchPage.class,
 *           LoadValidation.check(SearchPage::hasSearchBar, "Search bar was not displayed"));
 *   }
 * </pre>
 *
 * Implementations should be side-effect free apart from the queries they need.
 * Exceptions thrown here are not caught; they reach whoever asked whether the
 * host was loaded.
 *
 * @param <T> the host type the validation inspects
 */
@FunctionalInterface
public interface LoadValidation<T extends Loadable> {

    LoadOutcome validate(T host);

    /** A plain boolean check; a failure carries no message. */
    static <T extends Loadable> LoadValidation<T> check(Predicate<? super T> predicate) {
        Objects.requireNonNull(predicate, "predicate");
        return host -> LoadOutcome.of(predicate.test(host), null);
    }

    static <T extends Loadable> LoadValidation<T> check(Predicate<? super T> predicate, String failureMessage) {
        Objects.requireNonNull(predicate, "predicate");
        return host -> LoadOutcome.of(predicate.test(host), failureMessage);
    }

    /** The message is only built when the predicate fails. */
    static <T extends Loadable> LoadValidation<T> check(Predicate<? super T> predicate,
                                                        Function<? super T, String> failureMessage) {
        Objects.requireNonNull(predicate, "predicate");
        Objects.requireNonNull(failureMessage, "failureMessage");
        return host -> predicate.test(host)
            ? LoadOutcome.passed()
            : LoadOutcome.failed(failureMessage.apply(host));
    }
}
