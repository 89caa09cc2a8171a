package com.pageready.loadable;

import com.pageready.loadable.fixtures.scan.ScannedChildWidget;
import com.pageready.loadable.fixtures.scan.ScannedWidget;
import org.testng.annotations.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class LoadableScannerTest {

    private static final String SCAN_PACKAGE = "com.pageready.loadable.fixtures.scan";

    @Test
    public void initialize_findsLoadableClassesParentsFirst() {
        List<Class<? extends Loadable>> initialised = LoadableScanner.initialize(SCAN_PACKAGE);

        assertThat(initialised).containsExactly(ScannedWidget.class, ScannedChildWidget.class);
    }

    @Test
    public void initialize_runsStaticRegistrations() {
        LoadableScanner.initialize(SCAN_PACKAGE);

        LoadValidationRegistry global = LoadValidationRegistry.global();
        assertThat(global.ownValidations(ScannedWidget.class)).hasSize(1);
        assertThat(global.effectiveValidations(ScannedChildWidget.class)).hasSize(2);
    }

    @Test
    public void initialize_registeredValidationsApplyToInstances() {
        LoadableScanner.initialize(SCAN_PACKAGE);
        ScannedChildWidget widget = new ScannedChildWidget();

        assertThat(widget.isLoaded()).isFalse();
        assertThat(widget.getLoadError()).isEqualTo("Widget was not ready");

        widget.setReady(true);

        assertThat(widget.isLoaded()).isTrue();
    }

    @Test
    public void initialize_rejectsBlankPackage() {
        assertThatThrownBy(() -> LoadableScanner.initialize(" "))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
