package com.xpdustry.lexiscan.common.factory;

import com.google.inject.CreationException;

@SuppressWarnings("serial")
public final class ObjectFactoryInitializationException extends Exception {

    private final int modules;

    ObjectFactoryInitializationException(final int modules, final CreationException cause) {
        super("Failed to wire " + modules + " module(s) with " + cause.getErrorMessages().size() + " error(s)", cause);
        this.modules = modules;
    }

    public int modules() {
        return this.modules;
    }
}
