package com.xpdustry.lexiscan.common.factory;

import jakarta.inject.Provider;

/** Declares the singletons of an {@link ObjectModule}. Hidden bindings can only be injected within their module. */
public interface ObjectBinder {

    <T> BindingBuilder<T> bind(final Class<T> type);

    interface BindingBuilder<T> {

        BindingBuilder<T> visible(final boolean visible);

        void toImpl(final Class<? extends T> impl);

        void toInst(final T inst);

        void toProv(final Class<? extends Provider<? extends T>> prov);
    }
}
