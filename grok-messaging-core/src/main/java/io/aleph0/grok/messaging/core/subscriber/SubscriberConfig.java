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

import static java.util.Objects.requireNonNull;
import java.time.Duration;
import java.util.OptionalInt;
import io.aleph0.grok.messaging.core.transport.ReceiveSettings;

/**
 * The configuration of a {@link RetryingSubscriber}. Use {@link #builder(String, String,
 * MessageBodyDeserializer)} to create one.
 *
 * @param <T> the type of the message body
 */
public class SubscriberConfig<T> {
  public static final int DEFAULT_MAX_RETRIES = 5;

  public static final Duration DEFAULT_ACK_DEADLINE = Duration.ofSeconds(10);

  public static final boolean DEFAULT_ACKNOWLEDGE_ON_FORWARDING_FAILURE = true;

  public static <T> Builder<T> builder(String subscriptionId, String topicId,
      MessageBodyDeserializer<T> deserializer) {
    return new Builder<>(subscriptionId, topicId, deserializer);
  }

  public static class Builder<T> {
    private final String subscriptionId;
    private final String topicId;
    private final MessageBodyDeserializer<T> deserializer;
    private MessageBodySerializer<? super T> serializer;
    private int maxRetries = DEFAULT_MAX_RETRIES;
    private OptionalInt maxOutstandingMessages = OptionalInt.empty();
    private Duration ackDeadline = DEFAULT_ACK_DEADLINE;
    private boolean acknowledgeOnForwardingFailure = DEFAULT_ACKNOWLEDGE_ON_FORWARDING_FAILURE;

    private Builder(String subscriptionId, String topicId,
        MessageBodyDeserializer<T> deserializer) {
      this.subscriptionId = requireNonNull(subscriptionId, "subscriptionId");
      this.topicId = requireNonNull(topicId, "topicId");
      this.deserializer = requireNonNull(deserializer, "deserializer");
      this.serializer = deserializer.serializer();
    }

    /**
     * The serializer used to republish failed messages for retry. Defaults to the deserializer's
     * {@link MessageBodyDeserializer#serializer() serializer}.
     */
    public Builder<T> serializer(MessageBodySerializer<? super T> serializer) {
      this.serializer = requireNonNull(serializer, "serializer");
      return this;
    }

    /**
     * The number of times a failed message is retried before it is dead-lettered. Zero means
     * failed messages are dead-lettered on their first failure. Defaults to
     * {@value SubscriberConfig#DEFAULT_MAX_RETRIES}.
     */
    public Builder<T> maxRetries(int maxRetries) {
      if (maxRetries < 0)
        throw new IllegalArgumentException("maxRetries must not be negative");
      this.maxRetries = maxRetries;
      return this;
    }

    /**
     * The maximum number of messages delivered to the handler at once. Defaults to the transport
     * default.
     */
    public Builder<T> maxOutstandingMessages(int maxOutstandingMessages) {
      if (maxOutstandingMessages < 1)
        throw new IllegalArgumentException("maxOutstandingMessages must be positive");
      this.maxOutstandingMessages = OptionalInt.of(maxOutstandingMessages);
      return this;
    }

    /**
     * The ack deadline of the subscription, if the subscriber has to create it. An existing
     * subscription keeps its ack deadline. Defaults to 10 seconds.
     */
    public Builder<T> ackDeadline(Duration ackDeadline) {
      requireNonNull(ackDeadline, "ackDeadline");
      if (ackDeadline.isNegative() || ackDeadline.isZero())
        throw new IllegalArgumentException("ackDeadline must be positive");
      this.ackDeadline = ackDeadline;
      return this;
    }

    /**
     * Whether to acknowledge a message even if its retry or dead-letter publication failed. If
     * true, the message is lost from the pipeline, which is logged and counted in
     * {@link SubscriberMetrics#forwardingFailures()}. If false, the message is negatively
     * acknowledged instead, so the transport redelivers it with the same retry count. Defaults to
     * true.
     */
    public Builder<T> acknowledgeOnForwardingFailure(boolean acknowledgeOnForwardingFailure) {
      this.acknowledgeOnForwardingFailure = acknowledgeOnForwardingFailure;
      return this;
    }

    public SubscriberConfig<T> build() {
      return new SubscriberConfig<>(subscriptionId, topicId, deserializer, serializer, maxRetries,
          maxOutstandingMessages, ackDeadline, acknowledgeOnForwardingFailure);
    }
  }

  private final String subscriptionId;
  private final String topicId;
  private final MessageBodyDeserializer<T> deserializer;
  private final MessageBodySerializer<? super T> serializer;
  private final int maxRetries;
  private final OptionalInt maxOutstandingMessages;
  private final Duration ackDeadline;
  private final boolean acknowledgeOnForwardingFailure;

  private SubscriberConfig(String subscriptionId, String topicId,
      MessageBodyDeserializer<T> deserializer, MessageBodySerializer<? super T> serializer,
      int maxRetries, OptionalInt maxOutstandingMessages, Duration ackDeadline,
      boolean acknowledgeOnForwardingFailure) {
    this.subscriptionId = subscriptionId;
    this.topicId = topicId;
    this.deserializer = deserializer;
    this.serializer = serializer;
    this.maxRetries = maxRetries;
    this.maxOutstandingMessages = maxOutstandingMessages;
    this.ackDeadline = ackDeadline;
    this.acknowledgeOnForwardingFailure = acknowledgeOnForwardingFailure;
  }

  public String subscriptionId() {
    return subscriptionId;
  }

  public String topicId() {
    return topicId;
  }

  public String deadLetterTopicId() {
    return RetryAttributes.deadLetterTopicId(topicId);
  }

  public MessageBodyDeserializer<T> deserializer() {
    return deserializer;
  }

  public MessageBodySerializer<? super T> serializer() {
    return serializer;
  }

  public int maxRetries() {
    return maxRetries;
  }

  public OptionalInt maxOutstandingMessages() {
    return maxOutstandingMessages;
  }

  public Duration ackDeadline() {
    return ackDeadline;
  }

  public boolean acknowledgeOnForwardingFailure() {
    return acknowledgeOnForwardingFailure;
  }

  public ReceiveSettings receiveSettings() {
    return new ReceiveSettings(maxOutstandingMessages);
  }

  @Override
  public String toString() {
    return "SubscriberConfig [subscriptionId=" + subscriptionId + ", topicId=" + topicId
        + ", maxRetries=" + maxRetries + ", maxOutstandingMessages=" + maxOutstandingMessages
        + ", ackDeadline=" + ackDeadline + ", acknowledgeOnForwardingFailure="
        + acknowledgeOnForwardingFailure + "]";
  }
}
