package com.pageready.page;

import com.pageready.core.PageReadyConfig;
import com.pageready.loadable.Loadable;
import com.pageready.loadable.NotLoadedException;
import org.openqa.selenium.TimeoutException;
import org.openqa.selenium.support.ui.FluentWait;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;

/**
 * Polls {@link Loadable#isLoaded()} until it passes or a timeout expires.
 *
 * Readiness evaluation itself never retries. This is the wrapper for callers
 * who expect a page to become ready shortly, e.g. right after a navigation.
 * Each poll is a full, fresh evaluation. Exceptions thrown by a validation
 * end the wait immediately.
 */
public class LoadWait {

    private static final Logger log = LoggerFactory.getLogger(LoadWait.class);

    private final Duration timeout;
    private final Duration pollInterval;

    public LoadWait(Duration timeout, Duration pollInterval) {
        this.timeout      = Objects.requireNonNull(timeout, "timeout");
        this.pollInterval = Objects.requireNonNull(pollInterval, "pollInterval");
    }

    public LoadWait(PageReadyConfig config) {
        this(config.getLoadTimeout(), config.getPollInterval());
    }

    /**
     * Waits for {@code host} to load.
     *
     * @return the host, for chaining
     * @throws NotLoadedException with the last poll's load error if the timeout expires
     */
    public <T extends Loadable> T until(T host) {
        Objects.requireNonNull(host, "host");
        FluentWait<T> wait = new FluentWait<>(host)
            .withTimeout(timeout)
            .pollingEvery(pollInterval);
        try {
            wait.until(Loadable::isLoaded);
            log.debug("LoadWait: {} loaded", host.getClass().getSimpleName());
            return host;
        } catch (TimeoutException e) {
            log.info("LoadWait: {} not loaded after {} -- {}",
                host.getClass().getSimpleName(), timeout, host.getLoadError());
            throw new NotLoadedException(host.getLoadError(), e);
        }
    }

    public Duration getTimeout()      { return timeout; }
    public Duration getPollInterval() { return pollInterval; }
}
