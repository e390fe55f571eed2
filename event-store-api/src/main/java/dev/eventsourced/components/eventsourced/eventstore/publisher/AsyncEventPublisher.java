package dev.eventsourced.components.eventsourced.eventstore.publisher;

import com.google.common.base.Strings;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import dev.eventsourced.components.common.Lifecycle;
import dev.eventsourced.components.eventsourced.eventstore.Event;
import org.slf4j.*;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.*;
import java.util.function.Consumer;

import static com.google.common.base.Preconditions.*;

/**
 * {@link EventPublisher} that delivers events through an {@link EventPublishingHandler}.<br>
 * {@link #publish(List)} calls the handler on the caller's thread.<br>
 * {@link #publishAndForget(List)} hands the events to a bounded pool of daemon worker threads (named <code>&lt;name&gt;-Publisher-&lt;n&gt;</code>)
 * and returns immediately. A failed delivery is retried according to the {@link PublishRedeliveryPolicy}.
 * The events are handed to the {@link DeadLetterHandler} when:
 * <ul>
 *     <li>all redeliveries failed</li>
 *     <li>the work queue is full</li>
 *     <li>the publisher isn't started, or was stopped before the events could be delivered</li>
 * </ul>
 *
 * @param <EVENT> the base type of the events published
 */
public class AsyncEventPublisher<EVENT extends Event> implements EventPublisher<EVENT>, Lifecycle {
    private static final Logger log = LoggerFactory.getLogger(AsyncEventPublisher.class);

    public static final int      DEFAULT_NUMBER_OF_WORKERS = 1;
    public static final int      DEFAULT_QUEUE_CAPACITY    = 1000;
    public static final Duration DEFAULT_SHUTDOWN_TIMEOUT  = Duration.ofSeconds(5);

    private final String                        name;
    private final EventPublishingHandler<EVENT> handler;
    private final int                           numberOfWorkers;
    private final int                           queueCapacity;
    private final PublishRedeliveryPolicy       redeliveryPolicy;
    private final DeadLetterHandler<EVENT>      deadLetterHandler;
    private final Duration                      shutdownTimeout;

    private volatile ThreadPoolExecutor workers;
    private volatile boolean            started;

    /**
     * Create a publisher with a single worker, a queue capacity of {@value #DEFAULT_QUEUE_CAPACITY},
     * 3 redeliveries with a fixed 100 ms backoff and a logging {@link DeadLetterHandler}
     *
     * @param name    the name of the publisher, used for thread names and logging
     * @param handler the handler performing the actual delivery
     */
    public AsyncEventPublisher(String name,
                               EventPublishingHandler<EVENT> handler) {
        this(name,
             handler,
             DEFAULT_NUMBER_OF_WORKERS,
             DEFAULT_QUEUE_CAPACITY,
             PublishRedeliveryPolicy.fixedBackoff(Duration.ofMillis(100), 3),
             DeadLetterHandler.logging());
    }

    public AsyncEventPublisher(String name,
                               EventPublishingHandler<EVENT> handler,
                               int numberOfWorkers,
                               int queueCapacity,
                               PublishRedeliveryPolicy redeliveryPolicy,
                               DeadLetterHandler<EVENT> deadLetterHandler) {
        this(name, handler, numberOfWorkers, queueCapacity, redeliveryPolicy, deadLetterHandler, DEFAULT_SHUTDOWN_TIMEOUT);
    }

    /**
     * @param name              the name of the publisher, used for thread names and logging
     * @param handler           the handler performing the actual delivery
     * @param numberOfWorkers   the number of worker threads delivering events in the background
     * @param queueCapacity     the maximum number of batches waiting for a worker
     * @param redeliveryPolicy  the policy controlling redelivery of failed batches
     * @param deadLetterHandler receives the batches that couldn't be delivered
     * @param shutdownTimeout   how long {@link #stop()} waits for queued and in-flight batches to be delivered
     */
    public AsyncEventPublisher(String name,
                               EventPublishingHandler<EVENT> handler,
                               int numberOfWorkers,
                               int queueCapacity,
                               PublishRedeliveryPolicy redeliveryPolicy,
                               DeadLetterHandler<EVENT> deadLetterHandler,
                               Duration shutdownTimeout) {
        this.name = checkNotNull(name, "You must specify a name");
        this.handler = checkNotNull(handler, "You must specify a handler");
        this.redeliveryPolicy = checkNotNull(redeliveryPolicy, "You must specify a redelivery policy");
        this.deadLetterHandler = checkNotNull(deadLetterHandler, "You must specify a deadLetterHandler");
        this.shutdownTimeout = checkNotNull(shutdownTimeout, "You must specify a shutdownTimeout");
        checkArgument(numberOfWorkers >= 1, "You must specify a numberOfWorkers >= 1");
        checkArgument(queueCapacity >= 1, "You must specify a queueCapacity >= 1");
        this.numberOfWorkers = numberOfWorkers;
        this.queueCapacity = queueCapacity;
    }

    @Override
    public synchronized void start() {
        if (!started) {
            log.info("[{}] Starting AsyncEventPublisher with {} worker(s), queue capacity {} and {}",
                     name,
                     numberOfWorkers,
                     queueCapacity,
                     redeliveryPolicy);
            workers = new ThreadPoolExecutor(numberOfWorkers,
                                             numberOfWorkers,
                                             0L,
                                             TimeUnit.MILLISECONDS,
                                             new ArrayBlockingQueue<>(queueCapacity),
                                             new ThreadFactoryBuilder()
                                                     .setNameFormat(name + "-Publisher-%d")
                                                     .setDaemon(true)
                                                     .build());
            started = true;
        }
    }

    @Override
    public synchronized void stop() {
        if (started) {
            log.info("[{}] Stopping AsyncEventPublisher", name);
            started = false;
            var executor = workers;
            executor.shutdown();
            try {
                if (!executor.awaitTermination(shutdownTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                    log.warn("[{}] Publisher didn't drain within {}. Interrupting the workers", name, shutdownTimeout);
                    deadLetterUndelivered(executor.shutdownNow());
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                deadLetterUndelivered(executor.shutdownNow());
            }
            log.info("[{}] AsyncEventPublisher stopped", name);
        }
    }

    @Override
    public boolean isStarted() {
        return started;
    }

    public String name() {
        return name;
    }

    public PublishRedeliveryPolicy redeliveryPolicy() {
        return redeliveryPolicy;
    }

    /**
     * @return the number of batches waiting for a worker
     */
    public int queuedBatches() {
        var executor = workers;
        return executor == null ? 0 : executor.getQueue().size();
    }

    @Override
    public void publish(List<? extends EVENT> events) {
        checkNotNull(events, "No events provided");
        if (events.isEmpty()) {
            return;
        }
        List<EVENT> batch = List.copyOf(events);
        try {
            handler.handle(batch);
        } catch (EventPublishingException e) {
            throw e;
        } catch (Exception e) {
            throw new EventPublishingException(Strings.lenientFormat("[%s] Failed to publish %s event(s)", name, batch.size()), e);
        }
    }

    @Override
    public void publishAndForget(List<? extends EVENT> events) {
        checkNotNull(events, "No events provided");
        if (events.isEmpty()) {
            return;
        }
        List<EVENT> batch = List.copyOf(events);
        var executor = workers;
        if (!started || executor == null) {
            deadLetter(batch, new EventPublishingException(Strings.lenientFormat("[%s] AsyncEventPublisher isn't started", name)));
            return;
        }
        try {
            executor.execute(new PublishTask<>(batch, this::deliver));
            log.trace("[{}] Queued {} event(s) for publishing", name, batch.size());
        } catch (RejectedExecutionException e) {
            deadLetter(batch, new EventPublishingException(Strings.lenientFormat("[%s] Publishing queue is full or the publisher is stopping", name), e));
        }
    }

    private void deliver(List<EVENT> batch) {
        var redeliveryAttempts = 0;
        while (true) {
            try {
                handler.handle(batch);
                log.trace("[{}] Published {} event(s). Redelivery attempts: {}", name, batch.size(), redeliveryAttempts);
                return;
            } catch (Throwable e) {
                if (redeliveryAttempts >= redeliveryPolicy.maximumNumberOfRedeliveries || Thread.currentThread().isInterrupted()) {
                    deadLetter(batch, asException(e));
                    return;
                }
                var redeliveryDelay = redeliveryPolicy.calculateNextRedeliveryDelay(redeliveryAttempts);
                redeliveryAttempts++;
                log.debug("[{}] Failed to publish {} event(s). Redelivery attempt {} in {} due to: {}",
                          name,
                          batch.size(),
                          redeliveryAttempts,
                          redeliveryDelay,
                          e.getMessage());
                try {
                    Thread.sleep(redeliveryDelay.toMillis());
                } catch (InterruptedException interrupted) {
                    Thread.currentThread().interrupt();
                    deadLetter(batch, asException(e));
                    return;
                }
            }
        }
    }

    private Exception asException(Throwable cause) {
        if (cause instanceof Exception) {
            return (Exception) cause;
        }
        return new EventPublishingException(Strings.lenientFormat("[%s] Handler failed with %s", name, cause.getClass().getName()), cause);
    }

    @SuppressWarnings("unchecked")
    private void deadLetterUndelivered(List<Runnable> undelivered) {
        for (var runnable : undelivered) {
            if (runnable instanceof PublishTask<?>) {
                var task = (PublishTask<EVENT>) runnable;
                deadLetter(task.batch, new EventPublishingException(Strings.lenientFormat("[%s] Publisher stopped before the events were delivered", name)));
            }
        }
    }

    private void deadLetter(List<EVENT> batch, Exception cause) {
        try {
            deadLetterHandler.onDeadLetter(batch, cause);
        } catch (Exception e) {
            log.error(Strings.lenientFormat("[%s] DeadLetterHandler failed to handle %s event(s). Original failure: %s",
                                            name,
                                            batch.size(),
                                            cause.getMessage()),
                      e);
        }
    }

    @Override
    public String toString() {
        return "AsyncEventPublisher{" +
                "name='" + name + '\'' +
                ", numberOfWorkers=" + numberOfWorkers +
                ", queueCapacity=" + queueCapacity +
                ", redeliveryPolicy=" + redeliveryPolicy +
                ", started=" + started +
                '}';
    }

    private static class PublishTask<EVENT extends Event> implements Runnable {
        private final List<EVENT>           batch;
        private final Consumer<List<EVENT>> delivery;

        private PublishTask(List<EVENT> batch, Consumer<List<EVENT>> delivery) {
            this.batch = batch;
            this.delivery = delivery;
        }

        @Override
        public void run() {
            delivery.accept(batch);
        }
    }
}
