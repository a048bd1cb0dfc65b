/*-
 * =================================LICENSE_START==================================
 * grok-messaging-core
 * ====================================SECTION=====================================
 * Copyright (C) 2025 aleph0
 * ====================================SECTION=====================================
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 * 
 *      http://www.apache.org/licenses/LICENSE-2.0
 * 
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 * ==================================LICENSE_END===================================
 */
package io.aleph0.grok.messaging.core.subscriber;

import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Objects.requireNonNull;
import java.io.IOException;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import io.aleph0.grok.messaging.core.Acknowledgeable.AcknowledgementListener;
import io.aleph0.grok.messaging.core.Acknowledger;
import io.aleph0.grok.messaging.core.AcknowledgerMetrics;
import io.aleph0.grok.messaging.core.Measureable;
import io.aleph0.grok.messaging.core.Message;
import io.aleph0.grok.messaging.core.acknowledger.DefaultAcknowledger;
import io.aleph0.grok.messaging.core.producer.MessageProducer;
import io.aleph0.grok.messaging.core.provision.ResourceProvisioner;
import io.aleph0.grok.messaging.core.transport.MessageTransport;

/**
 * A subscriber that receives messages from a topic, passes each message body to a
 * {@link MessageHandler handler}, and applies a retry-then-dead-letter policy to failures on top of
 * the transport.
 *
 * <p>
 * Every delivered message is acknowledged when its attempt finishes, whatever the outcome. The
 * transport's own redelivery is not used for retries. Instead, a failed message is re-serialized
 * with the configured {@link SubscriberConfig#serializer() serializer} and republished to the same
 * topic as a new message with its {@value RetryAttributes#RETRIES_ATTRIBUTE} attribute
 * incremented, until the count reaches {@link SubscriberConfig#maxRetries() the maximum}. Past the
 * maximum, the original data is published to the dead-letter topic
 * {@code <topicId>}{@value RetryAttributes#DEAD_LETTER_TOPIC_SUFFIX} with an
 * {@value RetryAttributes#ERROR_ATTRIBUTE} attribute describing the failure.
 *
 * <p>
 * Failures are classified as follows:
 *
 * <ul>
 * <li>A body that cannot be deserialized is a permanent payload error. The raw data is
 * dead-lettered immediately and the handler is never called.</li>
 * <li>A handler that throws an unchecked throwable has crashed. The message is dead-lettered
 * immediately without retry.</li>
 * <li>A handler that throws a checked exception has failed. The message is retried if it has
 * retries left, and dead-lettered otherwise.</li>
 * </ul>
 *
 * <p>
 * Retry and dead-letter publications are best-effort. If one fails, the failure is logged and
 * counted, and by default the original message is still acknowledged, which drops it from the
 * pipeline. Configure {@link SubscriberConfig.Builder#acknowledgeOnForwardingFailure(boolean)} to
 * negatively acknowledge such messages instead.
 *
 * <p>
 * The subscriber does not extend ack deadlines itself. Transports with lease management, like the
 * Google Pub/Sub client, keep a message leased while its handler runs. On transports without it, a
 * handler that outlives the ack deadline may see the same message delivered again concurrently.
 *
 * @param <T> the type of the message body
 */
public class RetryingSubscriber<T> implements Measureable<SubscriberMetrics> {
  private static final Logger LOGGER = LoggerFactory.getLogger(RetryingSubscriber.class);

  private static record Outcome(Disposition disposition, boolean forwarded) {
  }

  private final AtomicLong receivedMetric = new AtomicLong(0);
  private final AtomicLong succeededMetric = new AtomicLong(0);
  private final AtomicLong retriedMetric = new AtomicLong(0);
  private final AtomicLong deadLetteredMetric = new AtomicLong(0);
  private final AtomicLong forwardingFailuresMetric = new AtomicLong(0);
  private final AtomicBoolean running = new AtomicBoolean(false);
  private volatile Acknowledger acknowledger = new DefaultAcknowledger();

  private final MessageTransport transport;
  private final ResourceProvisioner provisioner;
  private final MessageProducer producer;
  private final SubscriberConfig<T> config;
  private final MessageHandler<T> handler;

  public RetryingSubscriber(MessageTransport transport, SubscriberConfig<T> config,
      MessageHandler<T> handler) {
    this(transport, new ResourceProvisioner(transport), new MessageProducer(transport), config,
        handler);
  }

  public RetryingSubscriber(MessageTransport transport, ResourceProvisioner provisioner,
      MessageProducer producer, SubscriberConfig<T> config, MessageHandler<T> handler) {
    this.transport = requireNonNull(transport, "transport");
    this.provisioner = requireNonNull(provisioner, "provisioner");
    this.producer = requireNonNull(producer, "producer");
    this.config = requireNonNull(config, "config");
    this.handler = requireNonNull(handler, "handler");
  }

  /**
   * Provisions the subscription if necessary, then receives and handles messages until the calling
   * thread is interrupted or the transport fails. Before returning, waits for all outstanding
   * acknowledgements to complete.
   *
   * @throws IOException if the subscription could not be provisioned, in which case no message is
   *         received, or if the transport fails
   * @throws InterruptedException if the calling thread is interrupted
   * @throws IllegalStateException if this subscriber is already running
   */
  public void run() throws IOException, InterruptedException {
    if (!running.compareAndSet(false, true))
      throw new IllegalStateException("already running");
    try {
      try {
        provisioner.ensureSubscription(config.subscriptionId(), config.topicId(),
            config.ackDeadline());
      } catch (IOException e) {
        LOGGER.atError().setCause(e).addKeyValue("subscription", config.subscriptionId())
            .addKeyValue("topic", config.topicId())
            .log("Failed to provision subscription. Not starting...");
        throw e;
      }

      final Acknowledger theacknowledger = new DefaultAcknowledger();
      acknowledger = theacknowledger;
      try {
        LOGGER.atInfo().addKeyValue("subscription", config.subscriptionId())
            .addKeyValue("topic", config.topicId()).log("Starting subscriber");
        transport.receive(config.subscriptionId(), config.receiveSettings(),
            message -> receiveMessage(message, theacknowledger));
      } finally {
        theacknowledger.close();
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      LOGGER.atInfo().addKeyValue("subscription", config.subscriptionId())
          .log("Subscriber interrupted. Stopping...");
      throw e;
    } finally {
      running.set(false);
    }
  }

  private void receiveMessage(Message<byte[]> message, Acknowledger theacknowledger) {
    receivedMetric.incrementAndGet();

    final long started = System.nanoTime();

    LOGGER.atDebug().addKeyValue("messageId", message.id()).log("Processing message");

    final Outcome outcome = processMessage(message);

    final Duration elapsed = Duration.ofNanos(System.nanoTime() - started);
    if (outcome.forwarded() || config.acknowledgeOnForwardingFailure()) {
      if (outcome.disposition().isDeadLettered()) {
        LOGGER.atWarn().addKeyValue("messageId", message.id())
            .addKeyValue("disposition", outcome.disposition()).addKeyValue("elapsed", elapsed)
            .log("Acknowledging dead-lettered message");
      } else {
        LOGGER.atInfo().addKeyValue("messageId", message.id())
            .addKeyValue("disposition", outcome.disposition()).addKeyValue("elapsed", elapsed)
            .log("Acknowledging message");
      }
      settle(message, theacknowledger, true);
    } else {
      LOGGER.atWarn().addKeyValue("messageId", message.id())
          .addKeyValue("disposition", outcome.disposition()).addKeyValue("elapsed", elapsed)
          .log("Rejecting message for redelivery");
      settle(message, theacknowledger, false);
    }
  }

  /**
   * Settles the message through the acknowledger. A delivery that outlives the receive loop finds
   * the acknowledger closed, and is settled directly on the message instead.
   */
  private void settle(Message<byte[]> message, Acknowledger theacknowledger, boolean ack) {
    try {
      if (ack)
        theacknowledger.acknowledge(message);
      else
        theacknowledger.reject(message);
      return;
    } catch (IllegalStateException e) {
      LOGGER.atWarn().addKeyValue("messageId", message.id())
          .log("Subscriber stopped while message was in flight. Settling directly...");
    }

    final AcknowledgementListener listener = new AcknowledgementListener() {
      @Override
      public void onSuccess() {}

      @Override
      public void onFailure(Throwable cause) {
        LOGGER.atWarn().setCause(cause).addKeyValue("messageId", message.id())
            .log("Failed to settle message after stop. Transport will redeliver...");
      }
    };
    if (ack)
      message.ack(listener);
    else
      message.nack(listener);
  }

  private Outcome processMessage(Message<byte[]> message) {
    final T body;
    try {
      body = config.deserializer().deserialize(message.body());
    } catch (Exception e) {
      LOGGER.atError().setCause(e).addKeyValue("messageId", message.id())
          .addKeyValue("content", new String(message.body(), UTF_8))
          .log("Cannot deserialize message. Sending to dead-letter topic...");
      return deadLetter(message, Disposition.DEAD_LETTERED_UNREADABLE, describe(e));
    }
    if (body == null) {
      LOGGER.atError().addKeyValue("messageId", message.id())
          .addKeyValue("content", new String(message.body(), UTF_8))
          .log("Message deserialized to null. Sending to dead-letter topic...");
      return deadLetter(message, Disposition.DEAD_LETTERED_UNREADABLE,
          "message body deserialized to null");
    }

    boolean interrupted = false;
    final Exception failure;
    try {
      handler.handle(body);
      succeededMetric.incrementAndGet();
      return new Outcome(Disposition.SUCCEEDED, true);
    } catch (RuntimeException | Error e) {
      LOGGER.atWarn().setCause(e).addKeyValue("messageId", message.id())
          .addKeyValue("content", new String(message.body(), UTF_8))
          .log("Handler crashed. Sending to dead-letter topic...");
      return deadLetter(message, Disposition.DEAD_LETTERED_CRASHED, e.toString());
    } catch (InterruptedException e) {
      // Forward the message before restoring the interrupt, or the publish fails immediately
      interrupted = true;
      failure = e;
    } catch (Exception e) {
      failure = e;
    }

    try {
      LOGGER.atError().setCause(failure).addKeyValue("messageId", message.id())
          .log("Failed to process message");

      final int retryCount = RetryAttributes.retryCount(message.attributes());
      if (retryCount >= config.maxRetries())
        return deadLetter(message, Disposition.DEAD_LETTERED_EXHAUSTED, describe(failure));

      return retry(message, body, retryCount);
    } finally {
      if (interrupted)
        Thread.currentThread().interrupt();
    }
  }

  private Outcome retry(Message<byte[]> message, T body, int retryCount) {
    final Map<String, String> attributes =
        RetryAttributes.withRetryCount(message.attributes(), retryCount + 1);
    try {
      final byte[] data = config.serializer().serialize(body);
      producer.publishBytes(config.topicId(), data, attributes);
      retriedMetric.incrementAndGet();
      LOGGER.atInfo().addKeyValue("messageId", message.id())
          .addKeyValue("retries", retryCount + 1).log("Requeued message");
      return new Outcome(Disposition.RETRIED, true);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      forwardingFailed(message, Disposition.RETRIED, e);
      return new Outcome(Disposition.RETRIED, false);
    } catch (IOException | RuntimeException e) {
      forwardingFailed(message, Disposition.RETRIED, e);
      return new Outcome(Disposition.RETRIED, false);
    }
  }

  private Outcome deadLetter(Message<byte[]> message, Disposition disposition, String error) {
    final String deadLetterTopicId = config.deadLetterTopicId();

    LOGGER.atInfo().addKeyValue("messageId", message.id())
        .addKeyValue("topic", deadLetterTopicId).log("Sending message to dead-letter topic");

    try {
      provisioner.ensureTopic(deadLetterTopicId);
      producer.publishBytes(deadLetterTopicId, message.body(),
          RetryAttributes.deadLetterAttributes(error));
      deadLetteredMetric.incrementAndGet();
      return new Outcome(disposition, true);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      forwardingFailed(message, disposition, e);
      return new Outcome(disposition, false);
    } catch (IOException | RuntimeException e) {
      forwardingFailed(message, disposition, e);
      return new Outcome(disposition, false);
    }
  }

  private void forwardingFailed(Message<byte[]> message, Disposition disposition, Throwable cause) {
    forwardingFailuresMetric.incrementAndGet();
    if (config.acknowledgeOnForwardingFailure()) {
      LOGGER.atError().setCause(cause).addKeyValue("messageId", message.id())
          .addKeyValue("disposition", disposition)
          .log("Failed to forward message. Message will be acknowledged and lost...");
    } else {
      LOGGER.atError().setCause(cause).addKeyValue("messageId", message.id())
          .addKeyValue("disposition", disposition)
          .log("Failed to forward message. Message will be redelivered...");
    }
  }

  private static String describe(Throwable t) {
    final String message = t.getMessage();
    return message != null ? message : t.toString();
  }

  @Override
  public SubscriberMetrics checkMetrics() {
    final AcknowledgerMetrics ackMetrics = acknowledger.checkMetrics();
    return newMetrics(ackMetrics);
  }

  @Override
  public SubscriberMetrics flushMetrics() {
    final AcknowledgerMetrics ackMetrics = acknowledger.flushMetrics();
    final long received = receivedMetric.getAndSet(0);
    final long succeeded = succeededMetric.getAndSet(0);
    final long retried = retriedMetric.getAndSet(0);
    final long deadLettered = deadLetteredMetric.getAndSet(0);
    final long forwardingFailures = forwardingFailuresMetric.getAndSet(0);
    return new SubscriberMetrics(received, succeeded, retried, deadLettered, forwardingFailures,
        ackMetrics.retiredFailure(), ackMetrics.awaiting());
  }

  private SubscriberMetrics newMetrics(AcknowledgerMetrics ackMetrics) {
    final long received = receivedMetric.get();
    final long succeeded = succeededMetric.get();
    final long retried = retriedMetric.get();
    final long deadLettered = deadLetteredMetric.get();
    final long forwardingFailures = forwardingFailuresMetric.get();
    return new SubscriberMetrics(received, succeeded, retried, deadLettered, forwardingFailures,
        ackMetrics.retiredFailure(), ackMetrics.awaiting());
  }
}
