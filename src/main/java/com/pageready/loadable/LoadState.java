package com.pageready.loadable;

/**
 * Per-instance readiness state of a {@link Loadable}.
 *
 * Both fields start unset. Only {@link ReadinessEvaluator} mutates them:
 *   loaded     -- memoized result of the enclosing {@code whenLoaded} call;
 *                 {@code null} means "not cached, evaluate the rules"
 *   loadError  -- diagnostic from the most recent failing rule, or {@code null}
 */
public class LoadState {

    private Boolean loaded;
    private String  loadError;

    public Boolean getLoaded()   { return loaded; }
    public String  getLoadError() { return loadError; }

    /** {@code true} only while a cached positive result is in effect. */
    public boolean isMemoizedLoaded() {
        return Boolean.TRUE.equals(loaded);
    }

    void setLoaded(Boolean loaded)      { this.loaded = loaded; }
    void setLoadError(String loadError) { this.loadError = loadError; }

    @Override
    public String toString() {
        return String.format("LoadState{loaded=%s, loadError=%s}", loaded,
            loadError == null ? null : "'" + loadError + "'");
    }
}
