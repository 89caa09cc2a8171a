package com.pageready.page;

import com.pageready.loadable.LoadState;
import com.pageready.loadable.Loadable;
import com.pageready.loadable.LoadValidationRegistry;
import com.pageready.loadable.ReadinessEvaluator;
import org.openqa.selenium.By;
import org.openqa.selenium.WebElement;

import java.util.List;
import java.util.Objects;

/**
 * A component inside a {@link Page}, located by a root selector.
 *
 * Sections have load validations of their own but no default one: a section
 * does not own a URL, so "displayed" means nothing for it. Register a
 * validation on {@link #isVisible()} where that is what readiness means.
 * Sections share their page's registry.
 */
public abstract class Section implements Loadable {

    private final Page parent;
    private final By rootLocator;
    private final LoadState loadState = new LoadState();

    protected Section(Page parent, By rootLocator) {
        this.parent      = Objects.requireNonNull(parent, "parent");
        this.rootLocator = Objects.requireNonNull(rootLocator, "rootLocator");
    }

    /** Whether the section's root element is present and visible. Never throws for a missing element. */
    public boolean isVisible() {
        List<WebElement> roots = parent.getDriver().findElements(rootLocator);
        return !roots.isEmpty() && roots.get(0).isDisplayed();
    }

    /** The section's root element; throws if it is not present. */
    public WebElement getRootElement() {
        return parent.getDriver().findElement(rootLocator);
    }

    @Override
    public LoadState getLoadState() {
        return loadState;
    }

    @Override
    public LoadValidationRegistry getLoadValidationRegistry() {
        return parent.getLoadValidationRegistry();
    }

    public ReadinessEvaluator readiness() {
        return ReadinessEvaluator.forHost(this);
    }

    public Page getParent()      { return parent; }
    public By   getRootLocator() { return rootLocator; }
}
