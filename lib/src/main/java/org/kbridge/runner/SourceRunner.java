package org.kbridge.runner;

import java.lang.System.Logger;
import java.lang.System.Logger.Level;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Predicate;
import org.kbridge.channel.ChannelClosedException;
import org.kbridge.messaging.Event;
import org.kbridge.messaging.MessageNotFoundException;
import org.kbridge.messaging.Msg;
import org.kbridge.messaging.Source;
import org.kbridge.messaging.StopNotCalledException;
import org.kbridge.messaging.UnackedMessagesRemainException;
import org.kbridge.metrics.MetricsReporter;
import org.kbridge.metrics.SourceMetricsReporter;

/**
 * A thread-safe runner that drives a {@link Source}: it receives messages, hands them to a
 * processor, settles them and consumes the source's events.
 *
 * <p>The SourceRunner provides:
 *
 * <ul>
 *   <li>A receive worker acknowledging messages the processor accepts and failing the others
 *   <li>An event worker passing source events to a handler
 *   <li>Graceful shutdown following the stop, drain, close protocol of the source
 *   <li>Metrics reporting at configurable intervals
 * </ul>
 *
 * <p>Example usage:
 *
 * <pre>{@code
 * final var runner = SourceRunner.builder(KafkaSource.start(config))
 *     .withProcessor(new LoggingMessageHandler())
 *     .withShutdownHook(true)
 *     .withShutdownTimeout(10000)
 *     .build();
 *
 * runner.start();
 * runner.awaitShutdown();
 * }</pre>
 */
public class SourceRunner implements AutoCloseable {

  private static final Logger LOGGER = System.getLogger(SourceRunner.class.getName());
  private static final long CLOSE_RETRY_INTERVAL_MS = 100;

  // Source state
  private final Source source;
  private final AtomicBoolean started = new AtomicBoolean(false);
  private final AtomicBoolean closed = new AtomicBoolean(false);
  private final CountDownLatch shutdownLatch = new CountDownLatch(1);
  private volatile Thread receiveThread;
  private volatile Thread eventThread;
  private volatile long startTimeMs;

  // Configuration
  private final Predicate<Msg> processor;
  private final Consumer<Event> eventHandler;
  private final Predicate<Source> healthCheck;
  private final long shutdownTimeoutMs;

  // Metrics
  private final AtomicLong messagesReceived = new AtomicLong();
  private final AtomicLong messagesAcked = new AtomicLong();
  private final AtomicLong messagesFailed = new AtomicLong();
  private final AtomicLong eventsReceived = new AtomicLong();
  private final List<MetricsReporter> metricsReporters;
  private final long metricsInterval;
  private volatile Thread metricsThread;

  private SourceRunner(final Builder builder) {
    this.source = builder.source;
    this.processor = builder.processor;
    this.eventHandler = builder.eventHandler;
    this.healthCheck = builder.healthCheck;
    this.shutdownTimeoutMs = builder.shutdownTimeout;
    this.metricsReporters = new ArrayList<>(builder.metricsReporters);
    this.metricsInterval = builder.metricsInterval;

    if (builder.useShutdownHook) {
      Runtime.getRuntime().addShutdownHook(new Thread(this::close));
    }
  }

  /**
   * Creates a new builder for configuring a SourceRunner.
   *
   * @param source the source to drive
   * @return a new builder instance
   */
  public static Builder builder(final Source source) {
    return new Builder(source);
  }

  /**
   * Starts the workers if they haven't been started already.
   *
   * <p>This method is idempotent - calling it multiple times has no effect after the first call.
   */
  public void start() {
    if (!started.compareAndSet(false, true)) {
      return;
    }
    startTimeMs = System.currentTimeMillis();
    receiveThread = startWorker("kbridge-receive", this::receiveLoop);
    eventThread = startWorker("kbridge-events", this::eventLoop);
    startMetricsThread();
    LOGGER.log(Level.INFO, "Source runner started");
  }

  /**
   * Checks if the runner is healthy: started, not closed, the receive worker alive and the
   * configured health check passing.
   *
   * @return true if the runner is healthy, false otherwise
   */
  public boolean isHealthy() {
    final Predicate<Source> isNotClosed = s -> !closed.get();
    final Predicate<Source> isStarted = s -> started.get();
    final Predicate<Source> isReceiving = s -> receiveThread != null && receiveThread.isAlive();
    return isNotClosed.and(isStarted).and(isReceiving).and(healthCheck).test(source);
  }

  /**
   * Stops the source and closes it once every delivered message is settled.
   *
   * @param timeoutMs maximum time in milliseconds to wait for the source to close
   * @return true if the source closed, false if it timed out or failed
   */
  public boolean shutdownGracefully(final long timeoutMs) {
    if (!closed.compareAndSet(false, true)) {
      return true;
    }

    stopMetricsThread();
    try {
      final var completed = performGracefulSourceShutdown(source, timeoutMs);
      if (!completed) {
        Optional.ofNullable(receiveThread).ifPresent(Thread::interrupt);
        Optional.ofNullable(eventThread).ifPresent(Thread::interrupt);
      }
      return completed;
    } finally {
      shutdownLatch.countDown();
    }
  }

  /**
   * Waits for the runner to be shut down, indefinitely.
   *
   * @return true if the shutdown completed normally, false if the wait was interrupted
   */
  public boolean awaitShutdown() {
    return awaitShutdown(0);
  }

  /**
   * Waits up to the specified timeout for the runner to be shut down.
   *
   * @param timeoutMs maximum time in milliseconds to wait, 0 means wait indefinitely
   * @return true if the shutdown completed within the timeout, false otherwise
   */
  public boolean awaitShutdown(final long timeoutMs) {
    try {
      return timeoutMs > 0
        ? shutdownLatch.await(timeoutMs, TimeUnit.MILLISECONDS)
        : shutdownLatch.await(Long.MAX_VALUE, TimeUnit.NANOSECONDS);
    } catch (final InterruptedException e) {
      Thread.currentThread().interrupt();
      return false;
    }
  }

  /** Shuts down with the configured timeout. */
  @Override
  public void close() {
    shutdownGracefully(shutdownTimeoutMs);
  }

  /**
   * Returns a snapshot of the runner metrics.
   *
   * @return message and event counters plus the current unacknowledged count
   */
  public Map<String, Long> getMetrics() {
    return Map.of(
      SourceMetricsReporter.METRIC_MESSAGES_RECEIVED,
      messagesReceived.get(),
      SourceMetricsReporter.METRIC_MESSAGES_ACKED,
      messagesAcked.get(),
      SourceMetricsReporter.METRIC_MESSAGES_FAILED,
      messagesFailed.get(),
      SourceMetricsReporter.METRIC_EVENTS_RECEIVED,
      eventsReceived.get(),
      SourceMetricsReporter.METRIC_UNACKED,
      (long) source.unAcked().size()
    );
  }

  /**
   * Returns the time since {@link #start()}.
   *
   * @return uptime in milliseconds, 0 if not started
   */
  public long getUptimeMs() {
    return started.get() ? System.currentTimeMillis() - startTimeMs : 0;
  }

  /**
   * Stops a source, then retries closing it until it succeeds or the timeout passes.
   *
   * <p>Closing fails while the consume loop is still pushing a message or while delivered messages
   * are unsettled, both of which resolve as the workers drain the source.
   *
   * @param source the source to shut down
   * @param timeoutMs maximum time in milliseconds to keep retrying
   * @return {@code true} if the source closed, {@code false} otherwise
   */
  public static boolean performGracefulSourceShutdown(final Source source, final long timeoutMs) {
    source.stop();

    final var deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(timeoutMs);
    while (true) {
      try {
        source.close();
        LOGGER.log(Level.INFO, "Source closed, shutdown complete");
        return true;
      } catch (final StopNotCalledException | UnackedMessagesRemainException e) {
        if (System.nanoTime() >= deadline) {
          LOGGER.log(Level.WARNING, "Shutdown timeout reached: %s".formatted(e.getMessage()));
          return false;
        }
        LOGGER.log(Level.DEBUG, "Source not ready to close: {0}", e.getMessage());
      } catch (final RuntimeException e) {
        LOGGER.log(Level.WARNING, "Error during graceful shutdown", e);
        return false;
      }

      try {
        Thread.sleep(CLOSE_RETRY_INTERVAL_MS);
      } catch (final InterruptedException e) {
        Thread.currentThread().interrupt();
        LOGGER.log(Level.WARNING, "Interrupted while waiting for the source to close");
        return false;
      }
    }
  }

  private void receiveLoop() {
    try {
      final var messages = source.receive();
      while (!Thread.currentThread().isInterrupted()) {
        handleMessage(messages.receive());
      }
    } catch (final ChannelClosedException e) {
      LOGGER.log(Level.DEBUG, "Message channel closed, receive worker exiting");
    } catch (final InterruptedException e) {
      Thread.currentThread().interrupt();
      LOGGER.log(Level.INFO, "Receive worker interrupted");
    }
  }

  private void handleMessage(final Msg msg) {
    messagesReceived.incrementAndGet();

    boolean accepted;
    try {
      accepted = processor.test(msg);
    } catch (final Exception e) {
      LOGGER.log(Level.WARNING, "Processor failed on message %s".formatted(msg.id()), e);
      accepted = false;
    }

    try {
      if (accepted) {
        source.ack(msg);
        messagesAcked.incrementAndGet();
      } else {
        source.fail(msg);
        messagesFailed.incrementAndGet();
      }
    } catch (final MessageNotFoundException e) {
      LOGGER.log(Level.WARNING, "Message {0} was already settled", e.getMessageId());
    }
  }

  private void eventLoop() {
    try {
      final var events = source.events();
      while (!Thread.currentThread().isInterrupted()) {
        final var event = events.receive();
        eventsReceived.incrementAndGet();
        try {
          eventHandler.accept(event);
        } catch (final Exception e) {
          LOGGER.log(Level.WARNING, "Event handler failed on %s".formatted(event), e);
        }
      }
    } catch (final ChannelClosedException e) {
      LOGGER.log(Level.DEBUG, "Event channel closed, event worker exiting");
    } catch (final InterruptedException e) {
      Thread.currentThread().interrupt();
      LOGGER.log(Level.INFO, "Event worker interrupted");
    }
  }

  /**
   * Logs errors at WARNING and every other event at INFO.
   *
   * @param event the event to log
   */
  static void logEvent(final Event event) {
    if (event instanceof Event.CommitError commitError) {
      LOGGER.log(Level.WARNING, "Offset commit failed", commitError.error());
    } else if (event instanceof Event.BrokerError brokerError) {
      LOGGER.log(Level.WARNING, "Broker error", brokerError.error());
    } else {
      LOGGER.log(Level.INFO, "Source event: {0}", event);
    }
  }

  private static Thread startWorker(final String name, final Runnable task) {
    final var thread = new Thread(task, name);
    thread.setDaemon(true);
    thread.setUncaughtExceptionHandler((t, throwable) ->
      LOGGER.log(Level.ERROR, "Uncaught exception in worker thread: " + t.getName(), throwable)
    );
    thread.start();
    return thread;
  }

  private void startMetricsThread() {
    if (metricsReporters.isEmpty() || metricsInterval <= 0) {
      return;
    }

    final Runnable reportAllMetrics = () ->
      metricsReporters.forEach(reporter -> {
        try {
          reporter.reportMetrics();
        } catch (final Exception e) {
          LOGGER.log(Level.WARNING, "Error reporting metrics", e);
        }
      });

    final Predicate<Thread> shouldContinue = thread -> !closed.get() && !thread.isInterrupted();

    metricsThread =
      startWorker(
        "metrics-reporter",
        () -> {
          final var currentThread = Thread.currentThread();
          while (shouldContinue.test(currentThread)) {
            try {
              reportAllMetrics.run();
              Thread.sleep(metricsInterval);
            } catch (final InterruptedException e) {
              Thread.currentThread().interrupt();
              break;
            }
          }
        }
      );
  }

  private void stopMetricsThread() {
    Optional
      .ofNullable(metricsThread)
      .ifPresent(thread -> {
        thread.interrupt();
        try {
          thread.join(1000);
        } catch (final InterruptedException e) {
          Thread.currentThread().interrupt();
          LOGGER.log(Level.WARNING, "Interrupted while stopping metrics thread");
        } finally {
          metricsThread = null;
        }
      });
  }

  /** Builder for creating SourceRunner instances with custom configuration. */
  public static class Builder {

    private final Source source;
    private Predicate<Msg> processor;
    private Consumer<Event> eventHandler = SourceRunner::logEvent;
    private Predicate<Source> healthCheck = s -> true;
    private long shutdownTimeout = 30000;
    private boolean useShutdownHook = false;
    private final List<MetricsReporter> metricsReporters = new ArrayList<>();
    private long metricsInterval = 60000;

    private Builder(final Source source) {
      this.source = Objects.requireNonNull(source, "Source cannot be null");
    }

    /**
     * Sets the message processor. Messages it accepts are acknowledged; messages it rejects, or on
     * which it throws, are failed.
     *
     * @param processor the message processor
     * @return this builder instance
     */
    public Builder withProcessor(final Predicate<Msg> processor) {
      this.processor = processor;
      return this;
    }

    /**
     * Sets the handler receiving source events.
     *
     * @param eventHandler the event handler
     * @return this builder instance
     */
    public Builder withEventHandler(final Consumer<Event> eventHandler) {
      this.eventHandler = eventHandler;
      return this;
    }

    /**
     * Sets an additional predicate that determines if the source is healthy.
     *
     * @param healthCheck the predicate to use for health checks
     * @return this builder instance
     */
    public Builder withHealthCheck(final Predicate<Source> healthCheck) {
      this.healthCheck = healthCheck;
      return this;
    }

    /**
     * Sets the shutdown timeout in milliseconds.
     *
     * @param shutdownTimeout maximum time to wait during shutdown
     * @return this builder instance
     */
    public Builder withShutdownTimeout(final long shutdownTimeout) {
      this.shutdownTimeout = shutdownTimeout;
      return this;
    }

    /**
     * Configures whether to register a JVM shutdown hook that calls close().
     *
     * @param useShutdownHook true to register a shutdown hook, false otherwise
     * @return this builder instance
     */
    public Builder withShutdownHook(final boolean useShutdownHook) {
      this.useShutdownHook = useShutdownHook;
      return this;
    }

    /**
     * Adds metrics reporters to run periodically.
     *
     * @param reporters the metrics reporters to add
     * @return this builder instance
     */
    public Builder withMetricsReporters(final Collection<MetricsReporter> reporters) {
      this.metricsReporters.addAll(reporters);
      return this;
    }

    /**
     * Sets the interval in milliseconds between metrics reports.
     *
     * @param metricsInterval the reporting interval in milliseconds
     * @return this builder instance
     */
    public Builder withMetricsInterval(final long metricsInterval) {
      this.metricsInterval = metricsInterval;
      return this;
    }

    /**
     * Applies a custom configuration function to this builder.
     *
     * @param configurer a function that applies configuration to this builder
     * @return this builder instance
     */
    public Builder with(final Function<Builder, Builder> configurer) {
      return configurer.apply(this);
    }

    /**
     * Builds a new SourceRunner.
     *
     * @return a new SourceRunner instance
     * @throws NullPointerException if no processor was set
     */
    public SourceRunner build() {
      Objects.requireNonNull(processor, "Processor must be set");
      Objects.requireNonNull(eventHandler, "Event handler cannot be null");
      Objects.requireNonNull(healthCheck, "Health check cannot be null");
      return new SourceRunner(this);
    }
  }
}
