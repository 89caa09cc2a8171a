package com.pageready.loadable;

import com.pageready.core.PageReadyConfig;
import com.pageready.loadable.fixtures.LeafHost;
import com.pageready.loadable.fixtures.MidHost;
import com.pageready.loadable.fixtures.RootHost;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Registration, ancestor-first resolution and default seeding.
 *
 * Every test works on a fresh registry so nothing leaks into the global one.
 */
public class LoadValidationRegistryTest {

    private static final LoadValidation<Loadable> ROOT_RULE = LoadValidation.check(h -> true);
    private static final LoadValidation<Loadable> MID_RULE  = LoadValidation.check(h -> true);
    private static final LoadValidation<Loadable> LEAF_RULE = LoadValidation.check(h -> true);

    private LoadValidationRegistry enabled;
    private LoadValidationRegistry disabled;

    @BeforeMethod
    public void setUp() {
        enabled  = new LoadValidationRegistry(PageReadyConfig.defaults());
        disabled = new LoadValidationRegistry(
            PageReadyConfig.builder().defaultLoadValidations(false).build());
    }

    // ════════════════════════════════════════════════════════════════════════
    // Resolution order
    // ════════════════════════════════════════════════════════════════════════

    @Test
    public void effectiveValidations_areAncestorFirst() {
        // Registered leaf-first on purpose: order comes from the hierarchy, not registration time
        disabled.register(LeafHost.class, LEAF_RULE);
        disabled.register(MidHost.class, MID_RULE);
        disabled.register(RootHost.class, ROOT_RULE);

        List<LoadValidation<?>> rules = disabled.effectiveValidations(LeafHost.class);

        assertThat(rules).containsExactly(ROOT_RULE, MID_RULE, LEAF_RULE);
    }

    @Test
    public void effectiveValidations_keepDeclarationOrderWithinAType() {
        LoadValidation<Loadable> second = LoadValidation.check(h -> false, "second");
        disabled.register(RootHost.class, ROOT_RULE);
        disabled.register(RootHost.class, second);

        assertThat(disabled.effectiveValidations(RootHost.class)).containsExactly(ROOT_RULE, second);
    }

    @Test
    public void effectiveValidations_ofAncestorDoNotIncludeDescendantRules() {
        disabled.register(RootHost.class, ROOT_RULE);
        disabled.register(LeafHost.class, LEAF_RULE);

        assertThat(disabled.effectiveValidations(RootHost.class)).containsExactly(ROOT_RULE);
        assertThat(disabled.effectiveValidations(MidHost.class)).containsExactly(ROOT_RULE);
    }

    @Test
    public void effectiveValidations_seeLateRegistrations() {
        disabled.register(RootHost.class, ROOT_RULE);
        assertThat(disabled.effectiveValidations(LeafHost.class)).hasSize(1);

        disabled.register(MidHost.class, MID_RULE);

        assertThat(disabled.effectiveValidations(LeafHost.class)).containsExactly(ROOT_RULE, MID_RULE);
    }

    @Test
    public void register_keepsDuplicates() {
        disabled.register(RootHost.class, ROOT_RULE);
        disabled.register(RootHost.class, ROOT_RULE);

        assertThat(disabled.ownValidations(RootHost.class)).hasSize(2);
    }

    @Test
    public void effectiveValidations_cannotBeModified() {
        disabled.register(RootHost.class, ROOT_RULE);

        List<LoadValidation<?>> rules = disabled.effectiveValidations(RootHost.class);

        assertThatThrownBy(() -> rules.add(MID_RULE)).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    public void register_rejectsNullValidation() {
        assertThatThrownBy(() -> disabled.register(RootHost.class, null))
            .isInstanceOf(NullPointerException.class);
    }

    // ════════════════════════════════════════════════════════════════════════
    // Default seeding
    // ════════════════════════════════════════════════════════════════════════

    @Test
    public void seed_enabledRootWithNoRulesHasOnlyTheDefault() {
        LoadValidation<RootHost> defaultRule = DefaultLoadValidations.displayed();

        boolean seeded = enabled.seedDefaultIfRoot(RootHost.class, defaultRule);

        assertThat(seeded).isTrue();
        assertThat(enabled.effectiveValidations(RootHost.class)).containsExactly(defaultRule);
    }

    @Test
    public void seed_disabledRootGetsNothing() {
        boolean seeded = disabled.seedDefaultIfRoot(RootHost.class, DefaultLoadValidations.displayed());

        assertThat(seeded).isFalse();
        assertThat(disabled.effectiveValidations(RootHost.class)).isEmpty();
    }

    @Test
    public void seed_nonRootNeverGetsItsOwnDefault() {
        LoadValidation<RootHost> defaultRule = DefaultLoadValidations.displayed();
        enabled.seedDefaultIfRoot(RootHost.class, defaultRule);

        boolean midSeeded = enabled.seedDefaultIfRoot(MidHost.class, DefaultLoadValidations.displayed());

        assertThat(midSeeded).isFalse();
        assertThat(enabled.ownValidations(MidHost.class)).isEmpty();
        assertThat(enabled.effectiveValidations(MidHost.class)).containsExactly(defaultRule);
        assertThat(enabled.effectiveValidations(LeafHost.class)).containsExactly(defaultRule);
    }

    @Test
    public void seed_happensAtMostOncePerRoot() {
        enabled.seedDefaultIfRoot(RootHost.class, DefaultLoadValidations.displayed());
        boolean again = enabled.seedDefaultIfRoot(RootHost.class, DefaultLoadValidations.displayed());

        assertThat(again).isFalse();
        assertThat(enabled.ownValidations(RootHost.class)).hasSize(1);
    }

    @Test
    public void seed_putsTheDefaultAheadOfEarlierRegistrations() {
        LoadValidation<RootHost> defaultRule = DefaultLoadValidations.displayed();
        enabled.register(RootHost.class, ROOT_RULE);

        enabled.seedDefaultIfRoot(RootHost.class, defaultRule);

        assertThat(enabled.effectiveValidations(RootHost.class)).containsExactly(defaultRule, ROOT_RULE);
    }

    @Test
    public void isRoot_onlyForTheTopOfTheHierarchy() {
        assertThat(enabled.isRoot(RootHost.class)).isTrue();
        assertThat(enabled.isRoot(MidHost.class)).isFalse();
        assertThat(enabled.isRoot(LeafHost.class)).isFalse();
    }
}
