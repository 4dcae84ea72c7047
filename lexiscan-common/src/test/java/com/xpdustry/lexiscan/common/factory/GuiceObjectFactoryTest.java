package com.xpdustry.lexiscan.common.factory;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.google.inject.ConfigurationException;
import jakarta.inject.Inject;
import jakarta.inject.Provider;
import org.junit.jupiter.api.Test;

final class GuiceObjectFactoryTest {

    @Test
    void test_bindings() throws Exception {
        final var factory = ObjectFactory.create(binder -> {
            binder.bind(String.class).toInst("hello");
            binder.bind(Greeting.class).toProv(GreetingProvider.class);
            binder.bind(Greeter.class).toImpl(SimpleGreeter.class);
        });

        assertThat(factory.get(String.class)).isEqualTo("hello");
        assertThat(factory.get(Greeting.class)).isEqualTo(new Greeting("hi"));
        assertThat(factory.get(Greeter.class).greet()).isEqualTo("hi world");
        assertThat(factory.get(Greeter.class)).isSameAs(factory.get(Greeter.class));
        assertThat(factory.get(ObjectFactory.class)).isSameAs(factory);
    }

    @Test
    void test_hidden_binding() throws Exception {
        final var factory = ObjectFactory.create(binder -> {
            binder.bind(Greeting.class).visible(false).toInst(new Greeting("hidden"));
            binder.bind(Greeter.class).toImpl(SimpleGreeter.class);
        });

        assertThat(factory.get(Greeter.class).greet()).isEqualTo("hidden world");
        assertThatThrownBy(() -> factory.get(Greeting.class)).isInstanceOf(ConfigurationException.class);
    }

    @Test
    void test_conflicting_bindings() {
        assertThatThrownBy(() -> ObjectFactory.create(
                        binder -> binder.bind(Greeting.class).toInst(new Greeting("first")),
                        binder -> binder.bind(Greeting.class).toInst(new Greeting("second"))))
                .isInstanceOf(ObjectFactoryInitializationException.class)
                .hasMessageContaining("2 module(s)")
                .satisfies(e -> assertThat(((ObjectFactoryInitializationException) e).modules())
                        .isEqualTo(2));
    }

    record Greeting(String value) {}

    static final class GreetingProvider implements Provider<Greeting> {

        @Override
        public Greeting get() {
            return new Greeting("hi");
        }
    }

    interface Greeter {

        String greet();
    }

    static final class SimpleGreeter implements Greeter {

        private final Greeting greeting;

        @Inject
        SimpleGreeter(final Greeting greeting) {
            this.greeting = greeting;
        }

        @Override
        public String greet() {
            return this.greeting.value() + " world";
        }
    }
}
