package com.xpdustry.lexiscan.common.factory;

@FunctionalInterface
public interface ObjectModule {

    void configure(final ObjectBinder binder);
}
