package dev.eventsourced.components.eventsourced.aggregates.repository;

import dev.eventsourced.components.eventsourced.aggregates.*;
import dev.eventsourced.components.eventsourced.aggregates.cart.*;
import dev.eventsourced.components.eventsourced.aggregates.cart.CartEvent.*;
import dev.eventsourced.components.eventsourced.eventstore.*;
import org.junit.jupiter.api.*;

import java.math.BigDecimal;
import java.time.*;
import java.util.List;
import java.util.concurrent.*;

import static org.assertj.core.api.Assertions.*;

class AggregateRepositoryTest {
    private InMemoryEventStore<CartEvent>          eventStore;
    private RecordingEventPublisher<CartEvent>     eventPublisher;
    private AggregateRepository<CartEvent, Cart>   repository;

    @BeforeEach
    void setup() {
        eventStore = new InMemoryEventStore<>();
        eventPublisher = new RecordingEventPublisher<>();
        repository = AggregateRepository.from(eventStore,
                                              eventPublisher,
                                              AggregateInstanceFactory.defaultConstructorFactory(),
                                              Cart.class);
    }

    @Test
    void verify_save_persists_publishes_and_flushes() {
        // Given
        var cart = new Cart("cart-1", "u1");
        cart.addItem("i1", new BigDecimal("10.00"), 2);
        cart.addItem("i1", new BigDecimal("10.00"), 1);
        var pending = cart.pendingEvents();

        // When
        repository.save(cart);

        // Then
        var records = eventStore.loadRecords("cart-1");
        assertThat(records).hasSize(3);
        assertThat(records).extracting(record -> record.version).containsExactly(1L, 2L, 3L);
        assertThat(records).extracting(EventRecord::eventType).containsExactly("CartCreated", "ItemAdded", "ItemAdded");
        assertThat(eventPublisher.published).containsExactly(pending);
        assertThat(cart.pendingEvents()).isEmpty();
        assertThat(cart.version()).isEqualTo(3);
        assertThat(cart.isNew()).isFalse();
    }

    @Test
    void verify_load_replays_the_persisted_events() {
        // Given
        var cart = new Cart("cart-1", "u1");
        cart.addItem("i1", new BigDecimal("10.00"), 2);
        cart.addItem("i1", new BigDecimal("10.00"), 1);
        cart.addItem("i2", new BigDecimal("5.25"), 2);
        repository.save(cart);

        // When
        var loaded = repository.load("cart-1");

        // Then
        assertThat(loaded).isNotSameAs(cart);
        assertThat(loaded.identity()).isEqualTo("cart-1");
        assertThat(loaded.userId()).isEqualTo("u1");
        assertThat(loaded.version()).isEqualTo(cart.version()).isEqualTo(4);
        assertThat(loaded.lines().keySet()).containsExactly("i1", "i2");
        assertThat(loaded.lines().get("i1").quantity()).isEqualTo(3);
        assertThat(loaded.total()).isEqualByComparingTo(cart.total()).isEqualByComparingTo("40.50");
        assertThat(loaded.pendingEvents()).isEmpty();
        assertThat(loaded.hasBeenReplayed()).isTrue();
        assertThat(loaded.isNew()).isFalse();
    }

    @Test
    void verify_changes_to_a_loaded_aggregate_are_appended() {
        // Given
        repository.save(new Cart("cart-1", "u1"));
        var loaded = repository.load("cart-1");
        loaded.addItem("i1", new BigDecimal("10.00"), 1);

        // When
        repository.save(loaded, "checkout-flow-1");

        // Then
        var records = eventStore.loadRecords("cart-1");
        assertThat(records).hasSize(2);
        assertThat(records.get(0).correlationId).isEmpty();
        assertThat(records.get(1).correlationId).contains("checkout-flow-1");
        assertThat(eventPublisher.published).hasSize(2);
        assertThat(repository.load("cart-1").version()).isEqualTo(2);
    }

    @Test
    void verify_saving_without_pending_events_does_nothing() {
        // Given
        var cart = new Cart("cart-1", "u1");
        repository.save(cart);

        // When
        repository.save(cart);

        // Then
        assertThat(eventStore.saveCalls()).isEqualTo(1);
        assertThat(eventPublisher.published).hasSize(1);
    }

    @Test
    void verify_concurrent_modification_is_detected_by_the_store() {
        // Given
        repository.save(new Cart("cart-1", "u1"));
        var first  = repository.load("cart-1");
        var second = repository.load("cart-1");
        first.addItem("i1", new BigDecimal("10.00"), 1);
        second.addItem("i2", new BigDecimal("20.00"), 1);
        repository.save(first);

        // When
        var thrown = catchThrowable(() -> repository.save(second));

        // Then
        assertThat(thrown).isInstanceOf(OptimisticAppendToStreamException.class);
        var exception = (OptimisticAppendToStreamException) thrown;
        assertThat(exception.expectedVersion).isEqualTo(1);
        assertThat(exception.actualVersion).isEqualTo(2);
        assertThat(second.pendingEvents()).hasSize(1);
        assertThat(eventPublisher.allPublishedEvents()).hasSize(2);
        assertThat(repository.load("cart-1").lines()).containsOnlyKeys("i1");
    }

    @Test
    void verify_a_failing_store_neither_publishes_nor_flushes() {
        // Given
        var cart = new Cart("cart-1", "u1");
        eventStore.failNextSaveWith(new EventStoreException("Connection refused"));

        // When / Then
        assertThatThrownBy(() -> repository.save(cart))
                .isInstanceOf(EventStoreException.class)
                .hasMessage("Connection refused");
        assertThat(eventPublisher.published).isEmpty();
        assertThat(cart.pendingEvents()).hasSize(1);
        assertThat(cart.isNew()).isTrue();
    }

    @Test
    void verify_loading_an_unknown_aggregate() {
        assertThat(repository.tryLoad("unknown")).isEmpty();

        var thrown = catchThrowable(() -> repository.load("unknown"));
        assertThat(thrown).isInstanceOf(AggregateNotFoundException.class);
        var exception = (AggregateNotFoundException) thrown;
        assertThat(exception.aggregateId).isEqualTo("unknown");
        assertThat(exception.aggregateImplementationType).isEqualTo(Cart.class);
    }

    @Test
    void verify_load_with_expected_latest_version() {
        // Given
        var cart = new Cart("cart-1", "u1");
        cart.addItem("i1", new BigDecimal("10.00"), 1);
        repository.save(cart);

        // Then
        assertThat(repository.load("cart-1", 2L).version()).isEqualTo(2);
        var thrown = catchThrowable(() -> repository.tryLoad("cart-1", 1L));
        assertThat(thrown).isInstanceOf(OptimisticAggregateLoadException.class);
        var exception = (OptimisticAggregateLoadException) thrown;
        assertThat(exception.expectedLatestVersion).isEqualTo(1);
        assertThat(exception.actualLatestVersion).isEqualTo(2);
        assertThat(repository.tryLoad("unknown", 1L)).isEmpty();
    }

    @Test
    void test_loading_historic_views_of_an_aggregate() {
        // Given
        var start = OffsetDateTime.of(2024, 3, 1, 12, 0, 0, 0, ZoneOffset.UTC);
        eventStore.setClock(Clock.fixed(start.toInstant(), ZoneOffset.UTC));
        var cart = new Cart("cart-1", "u1");
        cart.addItem("i1", new BigDecimal("10.00"), 2);
        repository.save(cart);
        eventStore.setClock(Clock.fixed(start.plusHours(1).toInstant(), ZoneOffset.UTC));
        cart.addItem("i2", new BigDecimal("1.00"), 1);
        cart.removeItem("i1");
        repository.save(cart);

        // When
        var atVersion2 = repository.load("cart-1", EventStreamQuery.toVersion(2));
        var asOfStart  = repository.load("cart-1", EventStreamQuery.asOf(start.plusMinutes(30)));
        var current    = repository.load("cart-1");

        // Then
        assertThat(atVersion2.version()).isEqualTo(2);
        assertThat(atVersion2.lines()).containsOnlyKeys("i1");
        assertThat(asOfStart.version()).isEqualTo(2);
        assertThat(asOfStart.total()).isEqualByComparingTo("20.00");
        assertThat(current.version()).isEqualTo(4);
        assertThat(current.lines()).containsOnlyKeys("i2");
        assertThat(repository.tryLoad("cart-1", EventStreamQuery.asOf(start.minusDays(1)))).isEmpty();
    }

    @Test
    void verify_partial_stream_views_are_read_only() {
        // Given
        var cart = new Cart("cart-1", "u1");
        cart.addItem("i1", new BigDecimal("10.00"), 2);
        cart.addItem("i2", new BigDecimal("1.00"), 1);
        repository.save(cart);

        // When
        var view = repository.load("cart-1", EventStreamQuery.fromVersion(2));

        // Then
        assertThat(view.version()).isEqualTo(2);
        assertThat(view.lines()).containsOnlyKeys("i1", "i2");
        assertThat(view.hasIdentity()).isFalse();
        assertThatThrownBy(() -> view.addItem("i3", new BigDecimal("5.00"), 1))
                .isInstanceOf(IllegalStateException.class);
        assertThat(view.pendingEvents()).isEmpty();
        assertThat(eventStore.currentVersion("cart-1")).isEqualTo(3);
    }

    @Test
    void verify_save_all_saves_every_aggregate() {
        // Given
        var cart1 = new Cart("cart-1", "u1");
        var cart2 = new Cart("cart-2", "u2");
        cart2.addItem("i1", new BigDecimal("3.00"), 1);

        // When
        repository.saveAll(List.of(cart1, cart2));

        // Then
        assertThat(eventStore.currentVersion("cart-1")).isEqualTo(1);
        assertThat(eventStore.currentVersion("cart-2")).isEqualTo(2);
        assertThat(eventPublisher.published).hasSize(2);
    }

    @Test
    void test_async_save_and_load() throws Exception {
        // Given
        var executor = Executors.newSingleThreadExecutor();
        try {
            var cart = new Cart("cart-1", "u1");
            cart.addItem("i1", new BigDecimal("10.00"), 2);

            // When
            repository.saveAsync(cart, executor).get(5, TimeUnit.SECONDS);
            var loaded = repository.loadAsync("cart-1", executor).get(5, TimeUnit.SECONDS);

            // Then
            assertThat(loaded.version()).isEqualTo(2);
            assertThat(loaded.total()).isEqualByComparingTo("20.00");
            assertThat(repository.tryLoadAsync("unknown", executor).get(5, TimeUnit.SECONDS)).isEmpty();
            assertThatThrownBy(() -> repository.loadAsync("unknown", executor).get(5, TimeUnit.SECONDS))
                    .isInstanceOf(ExecutionException.class)
                    .hasCauseInstanceOf(AggregateNotFoundException.class);
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void verify_cancelling_an_async_save_before_it_starts_skips_the_store() throws Exception {
        // Given
        var executor = Executors.newSingleThreadExecutor();
        var release  = new CountDownLatch(1);
        try {
            executor.execute(() -> {
                try {
                    release.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            });
            var cart   = new Cart("cart-1", "u1");
            var future = repository.saveAsync(cart, executor);

            // When
            future.cancel(true);
            release.countDown();
            executor.submit(() -> null).get(5, TimeUnit.SECONDS);

            // Then
            assertThat(eventStore.saveCalls()).isEqualTo(0);
            assertThat(cart.pendingEvents()).hasSize(1);
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void verify_objenesis_created_aggregates_can_be_loaded() {
        // Given
        var objenesisRepository = AggregateRepository.from(eventStore,
                                                           AggregateInstanceFactory.objenesisFactory(),
                                                           Cart.class);
        var cart = new Cart("cart-1", "u1");
        cart.addItem("i1", new BigDecimal("10.00"), 2);
        objenesisRepository.save(cart);

        // When
        var loaded = objenesisRepository.load("cart-1");
        loaded.addItem("i2", new BigDecimal("2.00"), 1);

        // Then
        assertThat(loaded.version()).isEqualTo(3);
        assertThat(loaded.versionBeforePendingEvents()).isEqualTo(2);
        assertThat(loaded.total()).isEqualByComparingTo("22.00");
        assertThat(eventPublisher.published).isEmpty();
    }
}
