package com.pageready.loadable;

import org.reflections.Reflections;
import org.reflections.scanners.Scanners;
import org.reflections.util.ConfigurationBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Forces class initialisation of every {@link Loadable} class in a package.
 *
 * Load validations are registered in static initialisers, which the JVM only
 * runs when a class is first used. A page class that has not been touched yet
 * has therefore not registered its rules. Calling {@link #initialize} once
 * during suite setup makes every registration happen up front:
 *
 * <pre>
 *   {@literal @}BeforeSuite
 *   public void registerPages() {
 *       LoadableScanner.initialize("com.acme.tests.pages");
 *   }
 * </pre>
 *
 * Uses the Reflections library to find subtypes of {@link Loadable}. The
 * library's own base package is always scanned as well, so page classes that
 * extend {@link com.pageready.page.Page} or {@link com.pageready.page.Section}
 * are linked back to {@code Loadable}.
 */
public final class LoadableScanner {

    private static final Logger log = LoggerFactory.getLogger(LoadableScanner.class);
    private static final String LIBRARY_PACKAGE = "com.pageready";

    private LoadableScanner() {}

    /**
     * Initialises every concrete or abstract {@code Loadable} class under
     * {@code basePackage}, superclasses first.
     *
     * @return the classes that were initialised, in initialisation order
     * @throws IllegalStateException if a class fails to initialise
     */
    public static List<Class<? extends Loadable>> initialize(String basePackage) {
        Objects.requireNonNull(basePackage, "basePackage");
        if (basePackage.isBlank()) {
            throw new IllegalArgumentException("basePackage must not be blank");
        }

        Reflections reflections = new Reflections(
            new ConfigurationBuilder()
                .forPackages(basePackage, LIBRARY_PACKAGE)
                .setScanners(Scanners.SubTypes)
        );

        Set<Class<? extends Loadable>> found = reflections.getSubTypesOf(Loadable.class);
        String prefix = basePackage + ".";

        List<Class<? extends Loadable>> selected = new ArrayList<>();
        for (Class<? extends Loadable> cls : found) {
            if (cls.isInterface() || !cls.getName().startsWith(prefix)) {
                continue;
            }
            selected.add(cls);
        }
        selected.sort(Comparator.comparingInt(LoadableScanner::depth)
            .thenComparing(Class::getName));

        for (Class<? extends Loadable> cls : selected) {
            try {
                Class.forName(cls.getName(), true, cls.getClassLoader());
                log.debug("LoadableScanner: initialised {}{}", cls.getName(),
                    Modifier.isAbstract(cls.getModifiers()) ? " (abstract)" : "");
            } catch (ClassNotFoundException | ExceptionInInitializerError e) {
                throw new IllegalStateException("Failed to initialise loadable class " + cls.getName() + ".", e);
            }
        }

        log.info("LoadableScanner: {} loadable class(es) initialised under {}", selected.size(), basePackage);
        return List.copyOf(selected);
    }

    private static int depth(Class<?> cls) {
        int depth = 0;
        for (Class<?> c = cls.getSuperclass(); c != null; c = c.getSuperclass()) {
            depth++;
        }
        return depth;
    }
}
