package dev.eventsourced.components.eventsourced.aggregates;

import org.objenesis.*;
import org.objenesis.instantiator.ObjectInstantiator;

import java.lang.reflect.InvocationTargetException;
import java.util.concurrent.*;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Factory that helps the {@link dev.eventsourced.components.eventsourced.aggregates.repository.AggregateRepository} create
 * the fresh aggregate instance that the persisted events are replayed into.
 *
 * @see #defaultConstructorFactory()
 * @see #objenesisFactory()
 */
public interface AggregateInstanceFactory {
    /**
     * An {@link AggregateInstanceFactory} that calls the no-arguments constructor (which may be non public) on the concrete aggregate type
     */
    AggregateInstanceFactory DEFAULT_CONSTRUCTOR_FACTORY = new DefaultConstructorAggregateInstanceFactory();
    /**
     * An {@link AggregateInstanceFactory} that uses {@link Objenesis} to create a new aggregate instance<br>
     * <b>Please note: Objenesis doesn't initialize fields nor call any constructors</b>, so your aggregate design needs to take
     * this into consideration.<br>
     * {@link AggregateRoot} has been prepared to be initialized by {@link Objenesis}
     */
    AggregateInstanceFactory OBJENESIS_FACTORY           = new ObjenesisAggregateInstanceFactory();

    /**
     * @throws AggregateInstantiationException if the instance couldn't be created
     */
    <AGGREGATE> AGGREGATE create(Class<AGGREGATE> aggregateType);

    static AggregateInstanceFactory defaultConstructorFactory() {
        return DEFAULT_CONSTRUCTOR_FACTORY;
    }

    static AggregateInstanceFactory objenesisFactory() {
        return OBJENESIS_FACTORY;
    }

    class DefaultConstructorAggregateInstanceFactory implements AggregateInstanceFactory {
        @Override
        public <AGGREGATE> AGGREGATE create(Class<AGGREGATE> aggregateType) {
            checkNotNull(aggregateType, "You must provide an aggregateType");
            try {
                var constructor = aggregateType.getDeclaredConstructor();
                constructor.setAccessible(true);
                return constructor.newInstance();
            } catch (InvocationTargetException e) {
                throw new AggregateInstantiationException(aggregateType, e.getCause() != null ? e.getCause() : e);
            } catch (ReflectiveOperationException | RuntimeException e) {
                throw new AggregateInstantiationException(aggregateType, e);
            }
        }

        @Override
        public String toString() {
            return "DefaultConstructorAggregateInstanceFactory";
        }
    }

    class ObjenesisAggregateInstanceFactory implements AggregateInstanceFactory {
        private final Objenesis                                      objenesis       = new ObjenesisStd();
        private final ConcurrentMap<Class<?>, ObjectInstantiator<?>> instantiatorMap = new ConcurrentHashMap<>();

        @SuppressWarnings("unchecked")
        @Override
        public <AGGREGATE> AGGREGATE create(Class<AGGREGATE> aggregateType) {
            checkNotNull(aggregateType, "You must provide an aggregateType");
            try {
                return (AGGREGATE) instantiatorMap.computeIfAbsent(aggregateType,
                                                                   objenesis::getInstantiatorOf)
                                                  .newInstance();
            } catch (ObjenesisException e) {
                throw new AggregateInstantiationException(aggregateType, e);
            }
        }

        @Override
        public String toString() {
            return "ObjenesisAggregateInstanceFactory";
        }
    }
}
