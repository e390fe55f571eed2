package dev.eventsourced.components.eventsourced.aggregates;

import dev.eventsourced.components.eventsourced.aggregates.cart.Cart;
import dev.eventsourced.components.eventsourced.aggregates.cart.CartEvent.CartCreated;
import org.junit.jupiter.api.Test;

import java.time.OffsetDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class AggregateInstanceFactoryTest {
    @Test
    void verify_default_constructor_factory_uses_the_non_public_constructor() {
        // When
        var cart = AggregateInstanceFactory.defaultConstructorFactory().create(Cart.class);

        // Then
        assertThat(cart.version()).isEqualTo(0);
        assertThat(cart.pendingEvents()).isEmpty();
        assertThat(cart.hasIdentity()).isFalse();
        assertThat(cart.isNew()).isFalse();
    }

    @Test
    void verify_objenesis_factory_creates_a_usable_instance_without_calling_a_constructor() {
        // When
        var aggregate = AggregateInstanceFactory.objenesisFactory().create(NoDefaultConstructorAggregate.class);

        // Then
        assertThat(aggregate.constructorCalled).isFalse();
        assertThat(aggregate.version()).isEqualTo(0);
        assertThat(aggregate.pendingEvents()).isEmpty();

        // When
        aggregate.replay(List.of(new CartCreated("cart-1", "u1", OffsetDateTime.now())));

        // Then
        assertThat(aggregate.identity()).isEqualTo("cart-1");
        assertThat(aggregate.version()).isEqualTo(1);
    }

    @Test
    void verify_default_constructor_factory_fails_without_a_no_args_constructor() {
        assertThatThrownBy(() -> AggregateInstanceFactory.defaultConstructorFactory().create(NoDefaultConstructorAggregate.class))
                .isInstanceOf(AggregateInstantiationException.class)
                .hasMessageContaining(NoDefaultConstructorAggregate.class.getName());
    }

    @Test
    void verify_constructor_failures_are_wrapped() {
        assertThatThrownBy(() -> AggregateInstanceFactory.defaultConstructorFactory().create(FailingConstructorAggregate.class))
                .isInstanceOf(AggregateInstantiationException.class)
                .hasCauseInstanceOf(IllegalStateException.class);
    }

    static class NoDefaultConstructorAggregate extends AggregateRoot<CartCreated, NoDefaultConstructorAggregate> {
        boolean constructorCalled;

        NoDefaultConstructorAggregate(String cartId) {
            constructorCalled = true;
            applyChange(new CartCreated(cartId, "u1", OffsetDateTime.now()));
        }

        @Override
        protected void apply(CartCreated event) {
            assignIdentity(event.cartId());
        }
    }

    static class FailingConstructorAggregate extends AggregateRoot<CartCreated, FailingConstructorAggregate> {
        FailingConstructorAggregate() {
            throw new IllegalStateException("Not allowed");
        }

        @Override
        protected void apply(CartCreated event) {
            throw unsupportedEvent(event);
        }
    }
}
