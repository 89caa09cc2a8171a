package com.pageready.page;

import com.pageready.loadable.DefaultLoadValidations;
import com.pageready.loadable.Displayable;
import com.pageready.loadable.LoadState;
import com.pageready.loadable.LoadValidationRegistry;
import com.pageready.loadable.ReadinessEvaluator;
import org.openqa.selenium.WebDriver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Base class for page objects backed by a Selenium {@link WebDriver}.
 *
 * A page is displayed when the driver's current URL contains a match for
 * its URL matcher. {@code Page} is the root of the page hierarchy, so unless
 * default load validations are switched off, the registry a page is bound to
 * is seeded with that "displayed" check the first time such a page is built,
 * ahead of any validation its subclasses register:
 *
 * <pre>
 *   public class LoginPage extends Page {
 *       static {
 *           LoadValidationRegistry.global().register(LoginPage.class,
 *               LoadValidation.check(LoginPage::hasUsernameField, "Username field was not displayed"));
 *       }
 *
 *       public LoginPage(WebDriver driver) {
 *           super(driver, "https://example.com/login", Pattern.compile("/login$"));
 *       }
 *   }
 * </pre>
 */
public abstract class Page implements Displayable {

    private static final Logger log = LoggerFactory.getLogger(Page.class);

    private final WebDriver driver;
    private final String url;
    private final Pattern urlMatcher;
    private final LoadValidationRegistry registry;
    private final LoadState loadState = new LoadState();

    protected Page(WebDriver driver, String url, Pattern urlMatcher) {
        this(driver, url, urlMatcher, LoadValidationRegistry.global());
    }

    /**
     * @param url        where {@link #load()} navigates; may be null for pages only reached by clicking
     * @param urlMatcher matched against the current URL to decide whether this page is displayed
     * @param registry   where this page's validations are looked up
     */
    protected Page(WebDriver driver, String url, Pattern urlMatcher, LoadValidationRegistry registry) {
        this.driver     = Objects.requireNonNull(driver, "driver");
        this.url        = url;
        this.urlMatcher = Objects.requireNonNull(urlMatcher, "urlMatcher");
        this.registry   = Objects.requireNonNull(registry, "registry");
        // No-op after the first page bound to this registry.
        registry.seedDefaultIfRoot(Page.class, DefaultLoadValidations.displayed());
    }

    // ── Navigation ────────────────────────────────────────────────────────────

    /** Navigates to this page's URL. */
    public void load() {
        if (url == null) {
            throw new IllegalStateException(getClass().getSimpleName() + " has no URL to load");
        }
        load(url);
    }

    public void load(String target) {
        driver.get(target);
        log.info("Page: {} loaded {}", getClass().getSimpleName(), target);
    }

    // ── Displayable ───────────────────────────────────────────────────────────

    @Override
    public boolean isDisplayed() {
        String current = getCurrentUrl();
        return current != null && urlMatcher.matcher(current).find();
    }

    @Override
    public String getCurrentUrl() {
        return driver.getCurrentUrl();
    }

    @Override
    public String getUrlMatcherDescription() {
        return urlMatcher.pattern();
    }

    // ── Loadable ──────────────────────────────────────────────────────────────

    @Override
    public LoadState getLoadState() {
        return loadState;
    }

    @Override
    public LoadValidationRegistry getLoadValidationRegistry() {
        return registry;
    }

    /** Evaluator bound to this page's registry, for {@code whenLoaded} blocks. */
    public ReadinessEvaluator readiness() {
        return ReadinessEvaluator.forHost(this);
    }

    // ── Accessors ─────────────────────────────────────────────────────────────

    public WebDriver getDriver() { return driver; }
    public String    getUrl()    { return url; }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{url=" + url + ", matcher=" + urlMatcher.pattern() + "}";
    }
}
