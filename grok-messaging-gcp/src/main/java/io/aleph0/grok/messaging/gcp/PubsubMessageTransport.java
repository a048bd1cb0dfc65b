/*-
 * =================================LICENSE_START==================================
 * grok-messaging-gcp
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
package io.aleph0.grok.messaging.gcp;

import static java.util.Objects.requireNonNull;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.Iterator;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import com.google.api.core.ApiFuture;
import com.google.api.core.ApiService;
import com.google.api.gax.batching.FlowControlSettings;
import com.google.api.gax.core.CredentialsProvider;
import com.google.api.gax.core.NoCredentialsProvider;
import com.google.api.gax.grpc.GrpcTransportChannel;
import com.google.api.gax.rpc.AlreadyExistsException;
import com.google.api.gax.rpc.ApiException;
import com.google.api.gax.rpc.FixedTransportChannelProvider;
import com.google.api.gax.rpc.NotFoundException;
import com.google.api.gax.rpc.TransportChannelProvider;
import com.google.cloud.pubsub.v1.MessageReceiverWithAckResponse;
import com.google.cloud.pubsub.v1.Publisher;
import com.google.cloud.pubsub.v1.Subscriber;
import com.google.cloud.pubsub.v1.SubscriptionAdminClient;
import com.google.cloud.pubsub.v1.SubscriptionAdminSettings;
import com.google.cloud.pubsub.v1.TopicAdminClient;
import com.google.cloud.pubsub.v1.TopicAdminSettings;
import com.google.common.util.concurrent.MoreExecutors;
import com.google.protobuf.ByteString;
import com.google.pubsub.v1.ProjectSubscriptionName;
import com.google.pubsub.v1.PubsubMessage;
import com.google.pubsub.v1.Subscription;
import com.google.pubsub.v1.SubscriptionName;
import com.google.pubsub.v1.TopicName;
import io.aleph0.grok.messaging.core.Acknowledgeable.AcknowledgementListener;
import io.aleph0.grok.messaging.core.transport.MessageReceiver;
import io.aleph0.grok.messaging.core.transport.MessageTransport;
import io.aleph0.grok.messaging.core.transport.ReceiveSettings;
import io.aleph0.grok.messaging.core.transport.ResourceAlreadyExistsException;
import io.grpc.ManagedChannel;
import io.grpc.ManagedChannelBuilder;

/**
 * A {@link MessageTransport} backed by Google Pub/Sub. All topic and subscription IDs are short
 * IDs within the transport's project.
 *
 * <p>
 * The Pub/Sub client extends the lease of each outstanding message automatically, so a message
 * stays leased while its receiver is still working on it, even past the subscription's ack
 * deadline.
 *
 * <p>
 * Publishers are created lazily, one per topic, and reused until the transport is
 * {@link #close() closed}. Each call to {@link #receive(String, ReceiveSettings, MessageReceiver)}
 * creates, runs, and stops its own {@link Subscriber}.
 *
 * <p>
 * Use {@link #builder(String)} to create an instance. Set the {@code PUBSUB_EMULATOR_HOST}
 * environment variable and call {@link Builder#fromEnvironment()} to run against the emulator.
 */
public class PubsubMessageTransport implements MessageTransport, AutoCloseable {
  private static final Logger LOGGER = LoggerFactory.getLogger(PubsubMessageTransport.class);

  public static final String EMULATOR_HOST_ENVIRONMENT_VARIABLE = "PUBSUB_EMULATOR_HOST";

  public static final Duration DEFAULT_SHUTDOWN_TIMEOUT = Duration.ofSeconds(5);

  /**
   * Pub/Sub only accepts ack deadlines in this range, in seconds.
   */
  private static final long MIN_ACK_DEADLINE_SECONDS = 10;
  private static final long MAX_ACK_DEADLINE_SECONDS = 600;

  /**
   * A factory for creating the {@link Publisher} for a topic. The transport calls this factory at
   * most once per topic and manages the lifecycle of the returned publisher.
   */
  @FunctionalInterface
  public static interface PublisherFactory {
    public Publisher newPublisher(TopicName topic) throws IOException;
  }

  /**
   * A factory for creating a {@link Subscriber}. The transport calls this factory once per call to
   * {@link PubsubMessageTransport#receive(String, ReceiveSettings, MessageReceiver) receive} and
   * manages the lifecycle of the returned subscriber, so the factory must return a new subscriber
   * each time.
   */
  @FunctionalInterface
  public static interface SubscriberFactory {
    public Subscriber newSubscriber(ProjectSubscriptionName subscription,
        MessageReceiverWithAckResponse receiver, ReceiveSettings settings);
  }

  public static Builder builder(String projectId) {
    return new Builder(projectId);
  }

  public static class Builder {
    private final String projectId;
    private TransportChannelProvider channelProvider;
    private CredentialsProvider credentialsProvider;
    private String emulatorHost;
    private Duration shutdownTimeout = DEFAULT_SHUTDOWN_TIMEOUT;
    private PublisherFactory publisherFactory;
    private SubscriberFactory subscriberFactory;

    private Builder(String projectId) {
      this.projectId = requireNonNull(projectId, "projectId");
    }

    public Builder channelProvider(TransportChannelProvider channelProvider) {
      this.channelProvider = requireNonNull(channelProvider, "channelProvider");
      return this;
    }

    public Builder credentialsProvider(CredentialsProvider credentialsProvider) {
      this.credentialsProvider = requireNonNull(credentialsProvider, "credentialsProvider");
      return this;
    }

    /**
     * Connects to the Pub/Sub emulator at the given {@code host:port} over plaintext without
     * credentials. Overrides any channel and credentials provider.
     */
    public Builder emulatorHost(String emulatorHost) {
      this.emulatorHost = requireNonNull(emulatorHost, "emulatorHost");
      return this;
    }

    /**
     * Reads settings from the process environment.
     */
    public Builder fromEnvironment() {
      return fromEnvironment(System.getenv());
    }

    /**
     * Reads settings from the given environment. Currently this is only
     * {@value PubsubMessageTransport#EMULATOR_HOST_ENVIRONMENT_VARIABLE}.
     */
    public Builder fromEnvironment(Map<String, String> environment) {
      final String host = environment.get(EMULATOR_HOST_ENVIRONMENT_VARIABLE);
      if (host != null && !host.isBlank())
        emulatorHost(host.trim());
      return this;
    }

    /**
     * How long to wait for in-flight deliveries to finish when a receive stops, and for publishers
     * to flush when the transport closes. Deliveries still unsettled after the timeout are nacked.
     * Defaults to 5 seconds.
     */
    public Builder shutdownTimeout(Duration shutdownTimeout) {
      requireNonNull(shutdownTimeout, "shutdownTimeout");
      if (shutdownTimeout.isNegative())
        throw new IllegalArgumentException("shutdownTimeout must not be negative");
      this.shutdownTimeout = shutdownTimeout;
      return this;
    }

    public Builder publisherFactory(PublisherFactory publisherFactory) {
      this.publisherFactory = requireNonNull(publisherFactory, "publisherFactory");
      return this;
    }

    public Builder subscriberFactory(SubscriberFactory subscriberFactory) {
      this.subscriberFactory = requireNonNull(subscriberFactory, "subscriberFactory");
      return this;
    }

    String emulatorHost() {
      return emulatorHost;
    }

    public PubsubMessageTransport build() throws IOException {
      ManagedChannel channel = null;
      TransportChannelProvider thechannelProvider = channelProvider;
      CredentialsProvider thecredentialsProvider = credentialsProvider;
      if (emulatorHost != null) {
        LOGGER.atInfo().addKeyValue("emulatorHost", emulatorHost)
            .log("Connecting to Pub/Sub emulator");
        channel = ManagedChannelBuilder.forTarget(emulatorHost).usePlaintext().build();
        thechannelProvider =
            FixedTransportChannelProvider.create(GrpcTransportChannel.create(channel));
        thecredentialsProvider = NoCredentialsProvider.create();
      }

      try {
        final TopicAdminSettings.Builder topicAdminSettings = TopicAdminSettings.newBuilder();
        final SubscriptionAdminSettings.Builder subscriptionAdminSettings =
            SubscriptionAdminSettings.newBuilder();
        if (thechannelProvider != null) {
          topicAdminSettings.setTransportChannelProvider(thechannelProvider);
          subscriptionAdminSettings.setTransportChannelProvider(thechannelProvider);
        }
        if (thecredentialsProvider != null) {
          topicAdminSettings.setCredentialsProvider(thecredentialsProvider);
          subscriptionAdminSettings.setCredentialsProvider(thecredentialsProvider);
        }

        final TransportChannelProvider finalChannelProvider = thechannelProvider;
        final CredentialsProvider finalCredentialsProvider = thecredentialsProvider;

        PublisherFactory thepublisherFactory = publisherFactory;
        if (thepublisherFactory == null) {
          thepublisherFactory = topic -> {
            final Publisher.Builder b = Publisher.newBuilder(topic);
            if (finalChannelProvider != null)
              b.setChannelProvider(finalChannelProvider);
            if (finalCredentialsProvider != null)
              b.setCredentialsProvider(finalCredentialsProvider);
            return b.build();
          };
        }

        SubscriberFactory thesubscriberFactory = subscriberFactory;
        if (thesubscriberFactory == null) {
          thesubscriberFactory = (subscription, receiver, settings) -> {
            final Subscriber.Builder b = Subscriber.newBuilder(subscription, receiver);
            if (finalChannelProvider != null)
              b.setChannelProvider(finalChannelProvider);
            if (finalCredentialsProvider != null)
              b.setCredentialsProvider(finalCredentialsProvider);
            if (settings.maxOutstandingMessages().isPresent()) {
              b.setFlowControlSettings(FlowControlSettings.newBuilder()
                  .setMaxOutstandingElementCount(
                      (long) settings.maxOutstandingMessages().getAsInt())
                  .build());
            }
            return b.build();
          };
        }

        final TopicAdminClient topicAdminClient =
            TopicAdminClient.create(topicAdminSettings.build());
        final SubscriptionAdminClient subscriptionAdminClient;
        try {
          subscriptionAdminClient =
              SubscriptionAdminClient.create(subscriptionAdminSettings.build());
        } catch (IOException e) {
          topicAdminClient.close();
          throw e;
        }

        return new PubsubMessageTransport(projectId, topicAdminClient, subscriptionAdminClient,
            thepublisherFactory, thesubscriberFactory, shutdownTimeout, channel);
      } catch (IOException | RuntimeException e) {
        if (channel != null)
          channel.shutdownNow();
        throw e;
      }
    }
  }

  private final ConcurrentMap<String, Publisher> publishers = new ConcurrentHashMap<>();
  private final String projectId;
  private final TopicAdminClient topicAdminClient;
  private final SubscriptionAdminClient subscriptionAdminClient;
  private final PublisherFactory publisherFactory;
  private final SubscriberFactory subscriberFactory;
  private final Duration shutdownTimeout;

  /**
   * The channel we opened ourselves, if any, which we must close
   */
  private final ManagedChannel channel;

  public PubsubMessageTransport(String projectId, TopicAdminClient topicAdminClient,
      SubscriptionAdminClient subscriptionAdminClient, PublisherFactory publisherFactory,
      SubscriberFactory subscriberFactory, Duration shutdownTimeout) {
    this(projectId, topicAdminClient, subscriptionAdminClient, publisherFactory, subscriberFactory,
        shutdownTimeout, null);
  }

  private PubsubMessageTransport(String projectId, TopicAdminClient topicAdminClient,
      SubscriptionAdminClient subscriptionAdminClient, PublisherFactory publisherFactory,
      SubscriberFactory subscriberFactory, Duration shutdownTimeout, ManagedChannel channel) {
    this.projectId = requireNonNull(projectId, "projectId");
    this.topicAdminClient = requireNonNull(topicAdminClient, "topicAdminClient");
    this.subscriptionAdminClient =
        requireNonNull(subscriptionAdminClient, "subscriptionAdminClient");
    this.publisherFactory = requireNonNull(publisherFactory, "publisherFactory");
    this.subscriberFactory = requireNonNull(subscriberFactory, "subscriberFactory");
    this.shutdownTimeout = requireNonNull(shutdownTimeout, "shutdownTimeout");
    this.channel = channel;
  }

  public String getProjectId() {
    return projectId;
  }

  @Override
  public boolean topicExists(String topicId) throws IOException {
    try {
      topicAdminClient.getTopic(TopicName.of(projectId, topicId));
      return true;
    } catch (NotFoundException e) {
      return false;
    } catch (ApiException e) {
      throw new IOException("Failed to check topic " + topicId, e);
    }
  }

  @Override
  public void createTopic(String topicId) throws IOException {
    try {
      topicAdminClient.createTopic(TopicName.of(projectId, topicId));
      LOGGER.atInfo().addKeyValue("topic", topicId).log("Created topic");
    } catch (AlreadyExistsException e) {
      throw new ResourceAlreadyExistsException(topicId, e);
    } catch (ApiException e) {
      throw new IOException("Failed to create topic " + topicId, e);
    }
  }

  @Override
  public boolean subscriptionExists(String subscriptionId) throws IOException {
    try {
      subscriptionAdminClient.getSubscription(SubscriptionName.of(projectId, subscriptionId));
      return true;
    } catch (NotFoundException e) {
      return false;
    } catch (ApiException e) {
      throw new IOException("Failed to check subscription " + subscriptionId, e);
    }
  }

  @Override
  public void createSubscription(String subscriptionId, String topicId, Duration ackDeadline)
      throws IOException {
    final long ackDeadlineSeconds = ackDeadline.toSeconds();
    if (ackDeadlineSeconds < MIN_ACK_DEADLINE_SECONDS
        || ackDeadlineSeconds > MAX_ACK_DEADLINE_SECONDS)
      throw new IllegalArgumentException("ackDeadline must be between " + MIN_ACK_DEADLINE_SECONDS
          + " and " + MAX_ACK_DEADLINE_SECONDS + " seconds");

    final Subscription subscription = Subscription.newBuilder()
        .setName(SubscriptionName.of(projectId, subscriptionId).toString())
        .setTopic(TopicName.of(projectId, topicId).toString())
        .setAckDeadlineSeconds((int) ackDeadlineSeconds).build();
    try {
      subscriptionAdminClient.createSubscription(subscription);
      LOGGER.atInfo().addKeyValue("subscription", subscriptionId).addKeyValue("topic", topicId)
          .log("Created subscription");
    } catch (AlreadyExistsException e) {
      throw new ResourceAlreadyExistsException(subscriptionId, e);
    } catch (ApiException e) {
      throw new IOException("Failed to create subscription " + subscriptionId, e);
    }
  }

  @Override
  public String publish(String topicId, byte[] data, Map<String, String> attributes)
      throws IOException, InterruptedException {
    final Publisher publisher = publisher(topicId);

    final PubsubMessage message = PubsubMessage.newBuilder().setData(ByteString.copyFrom(data))
        .putAllAttributes(attributes).build();

    final ApiFuture<String> future = publisher.publish(message);
    try {
      return future.get();
    } catch (ExecutionException e) {
      final Throwable cause = e.getCause();
      if (cause instanceof Error x)
        throw x;
      if (cause instanceof IOException x)
        throw x;
      if (cause instanceof Exception x)
        throw new IOException("Failed to publish message to topic " + topicId, x);
      throw new AssertionError("Unexpected error", e);
    }
  }

  private Publisher publisher(String topicId) throws IOException {
    try {
      return publishers.computeIfAbsent(topicId, id -> {
        try {
          LOGGER.atDebug().addKeyValue("topic", id).log("Creating publisher");
          return publisherFactory.newPublisher(TopicName.of(projectId, id));
        } catch (IOException e) {
          throw new UncheckedIOException(e);
        }
      });
    } catch (UncheckedIOException e) {
      throw e.getCause();
    }
  }

  @Override
  public void receive(String subscriptionId, ReceiveSettings settings, MessageReceiver receiver)
      throws IOException, InterruptedException {
    final BlockingQueue<Throwable> failureCauses = new ArrayBlockingQueue<>(1);
    final Set<PubsubReceivedMessage> outstanding = ConcurrentHashMap.newKeySet();

    final Subscriber subscriber =
        subscriberFactory.newSubscriber(ProjectSubscriptionName.of(projectId, subscriptionId),
            (message, consumer) -> {
              final PubsubReceivedMessage m =
                  new PubsubReceivedMessage(message, consumer, outstanding);
              outstanding.add(m);
              try {
                receiver.receiveMessage(m);
              } catch (RuntimeException e) {
                LOGGER.atError().setCause(e).addKeyValue("id", m.id())
                    .log("Receiver failed. Nacking message...");
                m.nack(new AcknowledgementListener() {
                  @Override
                  public void onSuccess() {}

                  @Override
                  public void onFailure(Throwable t) {
                    LOGGER.atDebug().setCause(t).addKeyValue("id", m.id())
                        .log("Failed to nack message after receiver failure");
                  }
                });
              }
            }, settings);

    subscriber.addListener(new ApiService.Listener() {
      @Override
      public void terminated(ApiService.State from) {
        LOGGER.atDebug().addKeyValue("from", from).log("Subscriber terminated");
      }

      @Override
      public void failed(ApiService.State from, Throwable failure) {
        LOGGER.atError().setCause(failure).addKeyValue("from", from).log("Subscriber failed");
        failureCauses.offer(failure);
      }
    }, MoreExecutors.directExecutor());

    try {
      subscriber.startAsync().awaitRunning();
    } catch (IllegalStateException e) {
      final Throwable cause = subscriber.failureCause();
      throw new IOException("Failed to start subscriber for " + subscriptionId,
          cause != null ? cause : e);
    }

    try {
      if (Thread.currentThread().isInterrupted())
        throw new InterruptedException();

      LOGGER.atInfo().addKeyValue("subscription", subscriptionId).log("Subscriber connected");

      final Throwable failureCause = failureCauses.take();
      if (failureCause instanceof Error e)
        throw e;
      throw new IOException("Subscriber for " + subscriptionId + " failed", failureCause);
    } catch (InterruptedException e) {
      LOGGER.atInfo().addKeyValue("subscription", subscriptionId)
          .log("Interrupted. Stopping subscriber...");
      throw e;
    } finally {
      stop(subscriber, outstanding);
    }
  }

  /**
   * Stops the subscriber. Deliveries already handed to the receiver may finish and settle for up
   * to the shutdown timeout. Whatever is still unsettled after that is nacked.
   */
  private void stop(Subscriber subscriber, Set<PubsubReceivedMessage> outstanding) {
    LOGGER.atDebug().addKeyValue("outstanding", outstanding.size()).log("Stopping subscriber");
    try {
      subscriber.stopAsync();
      try {
        subscriber.awaitTerminated(shutdownTimeout.toMillis(), TimeUnit.MILLISECONDS);
        LOGGER.atDebug().log("Subscriber stopped");
        return;
      } catch (TimeoutException e) {
        LOGGER.atWarn().addKeyValue("shutdownTimeout", shutdownTimeout)
            .addKeyValue("outstanding", outstanding.size())
            .log("In-flight deliveries did not finish in time. Nacking...");
      }

      // The subscriber does not terminate until every outstanding message is settled
      nackOutstandingMessages(outstanding);

      subscriber.awaitTerminated(shutdownTimeout.toMillis(), TimeUnit.MILLISECONDS);
      LOGGER.atDebug().log("Subscriber stopped");
    } catch (TimeoutException e) {
      LOGGER.atWarn().addKeyValue("shutdownTimeout", shutdownTimeout)
          .log("Subscriber did not stop in time. Abandoning in-flight deliveries...");
    } catch (IllegalStateException e) {
      LOGGER.atDebug().setCause(e).log("Subscriber already failed. Ignoring...");
    }
  }

  private static void nackOutstandingMessages(Set<PubsubReceivedMessage> outstanding) {
    final Iterator<PubsubReceivedMessage> iterator = outstanding.iterator();
    while (iterator.hasNext()) {
      final PubsubReceivedMessage message = iterator.next();
      message.nack(new AcknowledgementListener() {
        @Override
        public void onSuccess() {
          LOGGER.atTrace().addKeyValue("id", message.id())
              .log("Successfully nacked message at stop time");
        }

        @Override
        public void onFailure(Throwable t) {
          LOGGER.atTrace().setCause(t).addKeyValue("id", message.id())
              .log("Failed to nack message at stop time");
        }
      });
      iterator.remove();
    }
  }

  /**
   * Shuts down all publishers, flushing pending messages, and closes the admin clients.
   */
  @Override
  public void close() throws InterruptedException {
    for (Map.Entry<String, Publisher> e : publishers.entrySet()) {
      final Publisher publisher = e.getValue();
      publisher.shutdown();
      if (!publisher.awaitTermination(shutdownTimeout.toMillis(), TimeUnit.MILLISECONDS))
        LOGGER.atWarn().addKeyValue("topic", e.getKey())
            .log("Publisher did not shut down in time");
    }
    publishers.clear();
    topicAdminClient.close();
    subscriptionAdminClient.close();
    if (channel != null)
      channel.shutdownNow();
  }

  @Override
  public String toString() {
    return "PubsubMessageTransport [projectId=" + projectId + ", publishers=" + publishers.keySet()
        + "]";
  }
}
