package com.xpdustry.lexiscan.common.factory;

import com.google.inject.AbstractModule;
import com.google.inject.CreationException;
import com.google.inject.Guice;
import com.google.inject.Injector;
import com.google.inject.Key;
import com.google.inject.PrivateBinder;
import com.google.inject.PrivateModule;
import com.google.inject.Stage;
import jakarta.inject.Provider;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

final class GuiceObjectFactory implements ObjectFactory {

    private static final Logger LOGGER = LoggerFactory.getLogger(GuiceObjectFactory.class);

    private final Injector injector;

    GuiceObjectFactory(final ObjectModule... modules) throws ObjectFactoryInitializationException {
        try {
            this.injector = Guice.createInjector(Stage.PRODUCTION, new InternalObjectFactoryModule(List.of(modules)));
        } catch (final CreationException e) {
            throw new ObjectFactoryInitializationException(modules.length, e);
        }
        LOGGER.debug("Wired {} object module(s)", modules.length);
    }

    @Override
    public <T> T get(final Class<T> type) {
        return this.injector.getInstance(type);
    }

    private final class InternalObjectFactoryModule extends AbstractModule {

        private final List<ObjectModule> modules;

        private InternalObjectFactoryModule(final List<ObjectModule> modules) {
            this.modules = modules;
        }

        @Override
        protected void configure() {
            this.binder().skipSources(InternalObjectFactoryModule.class, ObjectModuleAdapter.class);
            this.binder().disableCircularProxies();
            this.binder().bind(ObjectFactory.class).toInstance(GuiceObjectFactory.this);
            for (final var module : this.modules) {
                this.install(new ObjectModuleAdapter(module));
            }
        }
    }

    private static final class ObjectModuleAdapter extends PrivateModule {

        private final ObjectModule module;

        private ObjectModuleAdapter(final ObjectModule module) {
            this.module = module;
        }

        @Override
        protected void configure() {
            this.module.configure(new GuiceObjectBinder(this.binder()));
        }
    }

    private record GuiceObjectBinder(PrivateBinder binder) implements ObjectBinder {

        @Override
        public <T> BindingBuilder<T> bind(final Class<T> type) {
            return new GuiceBindingBuilder<>(type);
        }

        private final class GuiceBindingBuilder<T> implements BindingBuilder<T> {

            private boolean visible = true;
            private final Key<T> key;

            private GuiceBindingBuilder(final Class<T> type) {
                this.key = Key.get(type);
            }

            @Override
            public BindingBuilder<T> visible(final boolean visible) {
                this.visible = visible;
                return this;
            }

            @Override
            public void toImpl(final Class<? extends T> type) {
                GuiceObjectBinder.this.binder.bind(this.key).to(type).asEagerSingleton();
                this.expose();
            }

            @Override
            public void toInst(final T instance) {
                GuiceObjectBinder.this.binder.bind(this.key).toInstance(instance);
                this.expose();
            }

            @Override
            public void toProv(final Class<? extends Provider<? extends T>> prov) {
                GuiceObjectBinder.this.binder.bind(this.key).toProvider(prov).asEagerSingleton();
                this.expose();
            }

            private void expose() {
                if (this.visible) {
                    GuiceObjectBinder.this.binder.expose(this.key);
                }
            }
        }
    }
}
