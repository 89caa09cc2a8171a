package com.pageready.loadable;

/**
 * Built-in load validations.
 */
public final class DefaultLoadValidations {

    private DefaultLoadValidations() {}

    /**
     * Passes when the host reports itself displayed. On failure the message
     * names both the observed and the expected location:
     * {@code Expected <current url> to match <matcher> but it did not.}
     */
    public static <T extends Displayable> LoadValidation<T> displayed() {
        return host -> LoadOutcome.of(
            host.isDisplayed(),
            "Expected " + host.getCurrentUrl() + " to match "
                + host.getUrlMatcherDescription() + " but it did not.");
    }
}
