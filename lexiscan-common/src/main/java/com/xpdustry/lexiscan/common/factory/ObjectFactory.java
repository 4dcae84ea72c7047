package com.xpdustry.lexiscan.common.factory;

public interface ObjectFactory {

    static ObjectFactory create(final ObjectModule... modules) throws ObjectFactoryInitializationException {
        return new GuiceObjectFactory(modules);
    }

    <T> T get(final Class<T> type);
}
