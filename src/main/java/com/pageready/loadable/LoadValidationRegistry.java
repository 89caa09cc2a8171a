package com.pageready.loadable;

import com.pageready.core.PageReadyConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Holds the load validations declared by each {@link Loadable} class and
 * resolves the ordered list that applies to a given class.
 *
 * A class's effective validations are:
 *   1. the effective validations of its superclass, if that superclass is
 *      itself {@code Loadable} (resolved the same way, recursively)
 *   2. followed by the class's own validations, in registration order
 *
 * So for {@code BasePage -> AccountPage -> InvoicePage} the order is every
 * BasePage rule, then every AccountPage rule, then every InvoicePage rule.
 * Only the superclass chain is followed; rules registered against an interface
 * type are never picked up.
 *
 * Registrations are expected to happen in static initialisers of the page
 * classes, single-threaded and before the first evaluation. Resolution is done
 * on every call, so a late registration is still seen (but should be avoided).
 *
 * A root class (a {@code Loadable} whose superclass is not) may additionally be
 * seeded with a default validation via {@link #seedDefaultIfRoot}. Subclasses
 * inherit that default; they never get a copy of their own.
 */
public class LoadValidationRegistry {

    private static final Logger log = LoggerFactory.getLogger(LoadValidationRegistry.class);

    private final PageReadyConfig config;
    private final Map<Class<?>, List<Registration<?>>> ownValidations = new HashMap<>();
    private final Set<Class<?>> seededRoots = new HashSet<>();

    public LoadValidationRegistry(PageReadyConfig config) {
        this.config = Objects.requireNonNull(config, "config");
        log.debug("LoadValidationRegistry: created with {}", config);
    }

    /** The process-wide registry, configured from the environment on first use. */
    public static LoadValidationRegistry global() {
        return GlobalHolder.INSTANCE;
    }

    private static final class GlobalHolder {
        static final LoadValidationRegistry INSTANCE =
            new LoadValidationRegistry(PageReadyConfig.fromEnvironment());
    }

    // ── Registration ──────────────────────────────────────────────────────────

    /**
     * Appends a validation to {@code type}'s own list. Duplicates are kept; the
     * validation's behaviour is not checked until it runs.
     */
    public <T extends Loadable> void register(Class<T> type, LoadValidation<? super T> validation) {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(validation, "validation");
        List<Registration<?>> own = ownValidations.computeIfAbsent(type, k -> new ArrayList<>());
        own.add(new Registration<>(type, validation));
        log.debug("LoadValidationRegistry: registered validation #{} on {}", own.size(), type.getSimpleName());
    }

    /**
     * Installs {@code defaultValidation} as the first of {@code type}'s own
     * validations, provided that:
     *   - {@code type} is a root (its superclass is not {@code Loadable})
     *   - default load validations are enabled in the configuration
     *   - this root has not been seeded before
     *
     * A disabled configuration still counts as the one allowed seeding attempt.
     *
     * @return {@code true} if the default was installed by this call
     */
    public <T extends Loadable> boolean seedDefaultIfRoot(Class<T> type, LoadValidation<? super T> defaultValidation) {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(defaultValidation, "defaultValidation");

        if (!isRoot(type)) {
            log.debug("LoadValidationRegistry: {} inherits from {}, not seeding a default",
                type.getSimpleName(), type.getSuperclass().getSimpleName());
            return false;
        }
        if (!seededRoots.add(type)) {
            return false;
        }
        if (!config.isDefaultLoadValidations()) {
            log.debug("LoadValidationRegistry: default load validations disabled, {} left unseeded",
                type.getSimpleName());
            return false;
        }

        ownValidations.computeIfAbsent(type, k -> new ArrayList<>()).add(0, new Registration<>(type, defaultValidation));
        log.debug("LoadValidationRegistry: seeded default validation on root {}", type.getSimpleName());
        return true;
    }

    // ── Resolution ────────────────────────────────────────────────────────────

    /**
     * Returns the validations that apply to instances of {@code type}, ancestors
     * first. The returned list is a snapshot and cannot be modified.
     */
    public List<LoadValidation<?>> effectiveValidations(Class<? extends Loadable> type) {
        Objects.requireNonNull(type, "type");
        List<LoadValidation<?>> resolved = new ArrayList<>();
        for (Registration<?> registration : effectiveRegistrations(type)) {
            resolved.add(registration.getValidation());
        }
        return Collections.unmodifiableList(resolved);
    }

    /** Only the validations registered directly on {@code type}. */
    public List<LoadValidation<?>> ownValidations(Class<? extends Loadable> type) {
        List<LoadValidation<?>> own = new ArrayList<>();
        for (Registration<?> registration : ownValidations.getOrDefault(type, List.of())) {
            own.add(registration.getValidation());
        }
        return Collections.unmodifiableList(own);
    }

    public boolean isRoot(Class<? extends Loadable> type) {
        return !participates(type.getSuperclass());
    }

    /** Effective validations paired with the type each was registered on, ancestors first. */
    List<Registration<?>> effectiveRegistrations(Class<?> type) {
        List<Registration<?>> resolved = new ArrayList<>();
        collect(type, resolved);
        return resolved;
    }

    // ── Internals ─────────────────────────────────────────────────────────────

    private void collect(Class<?> type, List<Registration<?>> into) {
        Class<?> parent = type.getSuperclass();
        if (participates(parent)) {
            collect(parent, into);
        }
        into.addAll(ownValidations.getOrDefault(type, List.of()));
    }

    private static boolean participates(Class<?> type) {
        return type != null && !type.isInterface() && Loadable.class.isAssignableFrom(type);
    }

    /**
     * A validation together with the type it was registered on. The host is
     * narrowed with {@link Class#cast} before the validation sees it.
     */
    static final class Registration<T extends Loadable> {

        private final Class<T> type;
        private final LoadValidation<? super T> validation;

        Registration(Class<T> type, LoadValidation<? super T> validation) {
            this.type       = type;
            this.validation = validation;
        }

        LoadOutcome validate(Loadable host) {
            return validation.validate(type.cast(host));
        }

        LoadValidation<? super T> getValidation() {
            return validation;
        }
    }
}
