package com.pageready.loadable.fixtures;

import com.pageready.loadable.LoadValidationRegistry;

public class MidHost extends RootHost {

    public MidHost() {}

    public MidHost(LoadValidationRegistry registry) {
        super(registry);
    }
}
