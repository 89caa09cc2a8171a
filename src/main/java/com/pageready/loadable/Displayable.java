package com.pageready.loadable;

/**
 * What the built-in "displayed" load validation needs from its host.
 *
 * @see DefaultLoadValidations#displayed()
 */
public interface Displayable extends Loadable {

    /** Whether the host is currently the one being shown. */
    boolean isDisplayed();

    /** The location actually observed, for diagnostics. */
    String getCurrentUrl();

    /** Human-readable form of the expected location. */
    String getUrlMatcherDescription();
}
