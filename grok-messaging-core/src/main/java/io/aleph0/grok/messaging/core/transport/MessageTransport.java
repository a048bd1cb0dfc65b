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
package io.aleph0.grok.messaging.core.transport;

import java.io.IOException;
import java.time.Duration;
import java.util.Map;

/**
 * A pub/sub transport. The transport owns topic storage, message durability, and at-least-once
 * delivery. Everything built on top of it, for example retry and dead-lettering, treats it as the
 * source of truth for which resources exist.
 * 
 * <p>
 * Implementations must be thread-safe. A single transport is shared by all deliveries of all
 * subscribers that use it.
 */
public interface MessageTransport {
  public boolean topicExists(String topicId) throws IOException;

  /**
   * Creates the given topic.
   * 
   * @param topicId the topic to create
   * @throws ResourceAlreadyExistsException if the topic already exists
   * @throws IOException if the topic could not be created
   */
  public void createTopic(String topicId) throws IOException;

  public boolean subscriptionExists(String subscriptionId) throws IOException;

  /**
   * Creates the given subscription bound to the given topic. The binding and ack deadline cannot
   * be changed after creation.
   * 
   * @param subscriptionId the subscription to create
   * @param topicId the topic to bind the subscription to
   * @param ackDeadline the time the transport waits for an acknowledgement before it redelivers
   * @throws ResourceAlreadyExistsException if the subscription already exists
   * @throws IOException if the subscription could not be created, for example because the topic
   *         does not exist
   */
  public void createSubscription(String subscriptionId, String topicId, Duration ackDeadline)
      throws IOException;

  /**
   * Publishes the given data with the given attributes to the given topic. Blocks until the
   * transport accepts the message.
   * 
   * @param topicId the topic to publish to
   * @param data the message body
   * @param attributes the message attributes
   * @return the ID the transport assigned to the new message
   * @throws IOException if the transport did not accept the message
   * @throws InterruptedException if interrupted while waiting for the transport
   */
  public String publish(String topicId, byte[] data, Map<String, String> attributes)
      throws IOException, InterruptedException;

  /**
   * Receives messages from the given subscription and passes each to the given receiver. The
   * receiver may be called concurrently from multiple threads, up to the configured
   * {@link ReceiveSettings#maxOutstandingMessages() maximum number of outstanding messages}. A
   * message counts as outstanding until it is acknowledged or negatively acknowledged.
   * 
   * <p>
   * This method blocks until the calling thread is interrupted or the transport fails. On
   * interrupt, the transport stops accepting new deliveries, gives in-flight deliveries a bounded
   * amount of time to finish, and then throws {@link InterruptedException}.
   * 
   * @param subscriptionId the subscription to receive from
   * @param settings the receive settings
   * @param receiver the receiver to call for each delivered message
   * @throws IOException if the transport fails
   * @throws InterruptedException if the calling thread is interrupted
   */
  public void receive(String subscriptionId, ReceiveSettings settings, MessageReceiver receiver)
      throws IOException, InterruptedException;
}
