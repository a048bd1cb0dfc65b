/*-
 * =================================LICENSE_START==================================
 * grok-messaging-test
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
package io.aleph0.grok.messaging.test;

import static java.util.Objects.requireNonNull;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import io.aleph0.grok.messaging.core.Acknowledgeable.AcknowledgementListener;
import io.aleph0.grok.messaging.core.Message;
import io.aleph0.grok.messaging.core.transport.MessageReceiver;
import io.aleph0.grok.messaging.core.transport.MessageTransport;
import io.aleph0.grok.messaging.core.transport.ReceiveSettings;
import io.aleph0.grok.messaging.core.transport.ResourceAlreadyExistsException;

/**
 * A {@link MessageTransport} that keeps topics and subscriptions in memory. This is useful for
 * testing and local development, as it allows you to exercise subscribers without a real pub/sub
 * service.
 *
 * <p>
 * Publishing to a topic enqueues a copy of the message on every subscription bound to the topic.
 * {@link #receive(String, ReceiveSettings, MessageReceiver) Receiving} delivers queued messages on
 * worker threads, with at most {@link ReceiveSettings#maxOutstandingMessages()} unsettled messages
 * at a time. Negatively acknowledged messages are redelivered after a delay chosen by the
 * {@link Scheduler}. Ack deadlines are recorded but not enforced, so an unsettled message is never
 * redelivered on its own.
 *
 * <p>
 * Tests can make publishing to a topic {@link #failPublishes(String) fail}, make acknowledgements
 * {@link #failAcknowledgements(boolean) fail}, or make the transport {@link #fail(Throwable) fail}
 * entirely.
 */
public class InMemoryMessageTransport implements MessageTransport, AutoCloseable {
  private static final Logger LOGGER = LoggerFactory.getLogger(InMemoryMessageTransport.class);

  /**
   * The same default as the Google Pub/Sub client
   */
  public static final int DEFAULT_MAX_OUTSTANDING_MESSAGES = 1000;

  public static final Duration DEFAULT_SHUTDOWN_TIMEOUT = Duration.ofSeconds(5);

  private static final long POLL_INTERVAL_MILLIS = 50L;

  private static record Delivery(String messageId, byte[] data, Map<String, String> attributes) {
  }

  private static class Subscription {
    private final String topicId;
    private final Duration ackDeadline;
    private final BlockingQueue<Delivery> queue = new LinkedBlockingQueue<>();

    public Subscription(String topicId, Duration ackDeadline) {
      this.topicId = topicId;
      this.ackDeadline = ackDeadline;
    }
  }

  private class InMemoryMessage implements Message<byte[]> {
    private final AtomicBoolean settled = new AtomicBoolean(false);
    private final Delivery delivery;
    private final Subscription subscription;
    private final Semaphore permits;

    public InMemoryMessage(Delivery delivery, Subscription subscription, Semaphore permits) {
      this.delivery = delivery;
      this.subscription = subscription;
      this.permits = permits;
    }

    @Override
    public String id() {
      return delivery.messageId();
    }

    @Override
    public Map<String, String> attributes() {
      return delivery.attributes();
    }

    @Override
    public byte[] body() {
      return delivery.data();
    }

    @Override
    public void ack(AcknowledgementListener listener) {
      if (!settled.compareAndSet(false, true)) {
        listener.onFailure(new IllegalStateException("message already settled"));
        return;
      }
      permits.release();
      if (failingAcknowledgements.get()) {
        // The real thing would redeliver after the ack deadline
        try {
          redeliver(subscription, delivery);
        } catch (RejectedExecutionException e) {
          LOGGER.atDebug().setCause(e).addKeyValue("messageId", id())
              .log("Transport closed. Not redelivering...");
        }
        listener.onFailure(new IOException("simulated acknowledgement failure"));
        return;
      }
      acknowledgedCount.incrementAndGet();
      listener.onSuccess();
    }

    @Override
    public void nack(AcknowledgementListener listener) {
      if (!settled.compareAndSet(false, true)) {
        listener.onFailure(new IllegalStateException("message already settled"));
        return;
      }
      permits.release();
      try {
        redeliver(subscription, delivery);
      } catch (RejectedExecutionException e) {
        listener.onFailure(e);
        return;
      }
      rejectedCount.incrementAndGet();
      listener.onSuccess();
    }
  }

  private final ConcurrentMap<String, List<String>> topics = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Subscription> subscriptions = new ConcurrentHashMap<>();
  private final List<PublishedMessage> published = new ArrayList<>();
  private final Set<String> failingTopics = ConcurrentHashMap.newKeySet();
  private final AtomicBoolean failingAcknowledgements = new AtomicBoolean(false);
  private final AtomicReference<Throwable> failureCause = new AtomicReference<>(null);
  private final AtomicLong messageIds = new AtomicLong(0);
  private final AtomicInteger topicCreations = new AtomicInteger(0);
  private final AtomicInteger subscriptionCreations = new AtomicInteger(0);
  private final AtomicLong deliveredCount = new AtomicLong(0);
  private final AtomicLong acknowledgedCount = new AtomicLong(0);
  private final AtomicLong rejectedCount = new AtomicLong(0);
  private final ScheduledExecutorService redeliveryExecutor =
      Executors.newSingleThreadScheduledExecutor();

  private final Scheduler redeliveryScheduler;
  private final Duration shutdownTimeout;

  public InMemoryMessageTransport() {
    this(Scheduler.immediateScheduler(), DEFAULT_SHUTDOWN_TIMEOUT);
  }

  public InMemoryMessageTransport(Scheduler redeliveryScheduler, Duration shutdownTimeout) {
    this.redeliveryScheduler = requireNonNull(redeliveryScheduler, "redeliveryScheduler");
    this.shutdownTimeout = requireNonNull(shutdownTimeout, "shutdownTimeout");
    if (shutdownTimeout.isNegative())
      throw new IllegalArgumentException("shutdownTimeout must be non-negative");
  }

  @Override
  public boolean topicExists(String topicId) throws IOException {
    throwIfFailed();
    return topics.containsKey(requireNonNull(topicId, "topicId"));
  }

  @Override
  public void createTopic(String topicId) throws IOException {
    requireNonNull(topicId, "topicId");
    throwIfFailed();
    if (topics.putIfAbsent(topicId, new CopyOnWriteArrayList<>()) != null)
      throw new ResourceAlreadyExistsException(topicId);
    topicCreations.incrementAndGet();
  }

  @Override
  public boolean subscriptionExists(String subscriptionId) throws IOException {
    throwIfFailed();
    return subscriptions.containsKey(requireNonNull(subscriptionId, "subscriptionId"));
  }

  @Override
  public void createSubscription(String subscriptionId, String topicId, Duration ackDeadline)
      throws IOException {
    requireNonNull(subscriptionId, "subscriptionId");
    requireNonNull(topicId, "topicId");
    requireNonNull(ackDeadline, "ackDeadline");
    throwIfFailed();

    final List<String> bound = topics.get(topicId);
    if (bound == null)
      throw new IOException("topic not found: " + topicId);

    if (subscriptions.putIfAbsent(subscriptionId, new Subscription(topicId, ackDeadline)) != null)
      throw new ResourceAlreadyExistsException(subscriptionId);

    bound.add(subscriptionId);
    subscriptionCreations.incrementAndGet();
  }

  @Override
  public String publish(String topicId, byte[] data, Map<String, String> attributes)
      throws IOException {
    requireNonNull(topicId, "topicId");
    requireNonNull(data, "data");
    requireNonNull(attributes, "attributes");
    throwIfFailed();

    if (failingTopics.contains(topicId))
      throw new IOException("simulated publish failure: " + topicId);

    final List<String> bound = topics.get(topicId);
    if (bound == null)
      throw new IOException("topic not found: " + topicId);

    final String messageId = Long.toString(messageIds.incrementAndGet());
    final byte[] thedata = Arrays.copyOf(data, data.length);
    final Map<String, String> theattributes = Map.copyOf(attributes);

    synchronized (published) {
      published.add(new PublishedMessage(messageId, topicId, thedata, theattributes));
      published.notifyAll();
    }

    for (String subscriptionId : bound) {
      subscriptions.get(subscriptionId).queue
          .offer(new Delivery(messageId, thedata, theattributes));
    }

    return messageId;
  }

  @Override
  public void receive(String subscriptionId, ReceiveSettings settings, MessageReceiver receiver)
      throws IOException, InterruptedException {
    requireNonNull(subscriptionId, "subscriptionId");
    requireNonNull(settings, "settings");
    requireNonNull(receiver, "receiver");

    final Subscription subscription = subscriptions.get(subscriptionId);
    if (subscription == null)
      throw new IOException("subscription not found: " + subscriptionId);

    final Semaphore permits = new Semaphore(
        settings.maxOutstandingMessages().orElse(DEFAULT_MAX_OUTSTANDING_MESSAGES));

    final ExecutorService workers = Executors.newCachedThreadPool();
    try {
      LOGGER.atInfo().addKeyValue("subscription", subscriptionId)
          .addKeyValue("topic", subscription.topicId)
          .addKeyValue("ackDeadline", subscription.ackDeadline).log("Receiving messages");
      while (true) {
        throwIfFailed();

        if (Thread.interrupted())
          throw new InterruptedException();

        permits.acquire();

        final Delivery delivery =
            subscription.queue.poll(POLL_INTERVAL_MILLIS, TimeUnit.MILLISECONDS);
        if (delivery == null) {
          permits.release();
          continue;
        }

        deliveredCount.incrementAndGet();

        final InMemoryMessage message = new InMemoryMessage(delivery, subscription, permits);
        workers.execute(() -> {
          try {
            receiver.receiveMessage(message);
          } catch (RuntimeException e) {
            LOGGER.atWarn().setCause(e).addKeyValue("messageId", message.id())
                .log("Receiver failed. Redelivering...");
            message.nack(new AcknowledgementListener() {
              @Override
              public void onSuccess() {}

              @Override
              public void onFailure(Throwable t) {
                LOGGER.atDebug().setCause(t).addKeyValue("messageId", message.id())
                    .log("Message already settled by failed receiver");
              }
            });
          }
        });
      }
    } catch (InterruptedException e) {
      LOGGER.atInfo().addKeyValue("subscription", subscriptionId)
          .log("Interrupted. Waiting for in-flight deliveries...");
      throw e;
    } finally {
      workers.shutdown();
      boolean terminated;
      try {
        terminated = workers.awaitTermination(shutdownTimeout.toMillis(), TimeUnit.MILLISECONDS);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        terminated = false;
      }
      if (!terminated) {
        LOGGER.atWarn().addKeyValue("subscription", subscriptionId)
            .log("In-flight deliveries did not finish in time. Abandoning...");
        workers.shutdownNow();
      }
    }
  }

  private void redeliver(Subscription subscription, Delivery delivery) {
    final Duration delay = redeliveryScheduler.schedule();
    if (delay.isNegative())
      throw new IllegalArgumentException("scheduler returned negative delay");
    redeliveryExecutor.schedule(() -> subscription.queue.offer(delivery), delay.toNanos(),
        TimeUnit.NANOSECONDS);
  }

  private void throwIfFailed() throws IOException {
    final Throwable cause = failureCause.get();
    if (cause != null)
      throw new IOException("transport failed", cause);
  }

  /**
   * Makes every subsequent call to this transport fail with an {@link IOException} caused by the
   * given cause, including calls to {@code receive} already in progress.
   */
  public void fail(Throwable cause) {
    failureCause.compareAndSet(null, requireNonNull(cause, "cause"));
  }

  /**
   * Makes every subsequent publish to the given topic fail until {@link #restorePublishes(String)
   * restored}.
   */
  public void failPublishes(String topicId) {
    failingTopics.add(requireNonNull(topicId, "topicId"));
  }

  public void restorePublishes(String topicId) {
    failingTopics.remove(requireNonNull(topicId, "topicId"));
  }

  /**
   * If true, acknowledgements fail, and the message is redelivered as if its ack deadline expired.
   */
  public void failAcknowledgements(boolean failAcknowledgements) {
    failingAcknowledgements.set(failAcknowledgements);
  }

  /**
   * Returns all messages published to the given topic so far, in publication order.
   */
  public List<PublishedMessage> published(String topicId) {
    requireNonNull(topicId, "topicId");
    synchronized (published) {
      return published.stream().filter(m -> m.topicId().equals(topicId)).toList();
    }
  }

  /**
   * Waits until at least the given number of messages have been published to the given topic.
   *
   * @return all messages published to the topic so far, in publication order
   * @throws TimeoutException if fewer messages were published before the timeout
   */
  public List<PublishedMessage> awaitPublished(String topicId, int count, Duration timeout)
      throws InterruptedException, TimeoutException {
    requireNonNull(topicId, "topicId");
    final long deadline = System.nanoTime() + timeout.toNanos();
    synchronized (published) {
      List<PublishedMessage> result = published(topicId);
      while (result.size() < count) {
        final long remaining = deadline - System.nanoTime();
        if (remaining <= 0L)
          throw new TimeoutException(
              "expected " + count + " messages on " + topicId + ", got " + result.size());
        TimeUnit.NANOSECONDS.timedWait(published, remaining);
        result = published(topicId);
      }
      return result;
    }
  }

  public int topicCreations() {
    return topicCreations.get();
  }

  public int subscriptionCreations() {
    return subscriptionCreations.get();
  }

  public long deliveredCount() {
    return deliveredCount.get();
  }

  public long acknowledgedCount() {
    return acknowledgedCount.get();
  }

  public long rejectedCount() {
    return rejectedCount.get();
  }

  @Override
  public void close() {
    redeliveryExecutor.shutdownNow();
  }
}
