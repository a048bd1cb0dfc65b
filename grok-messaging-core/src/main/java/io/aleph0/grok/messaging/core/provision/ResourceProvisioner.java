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
package io.aleph0.grok.messaging.core.provision;

import static java.util.Objects.requireNonNull;
import java.io.IOException;
import java.time.Duration;
import java.util.Collections;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import io.aleph0.grok.messaging.core.transport.MessageTransport;
import io.aleph0.grok.messaging.core.transport.ResourceAlreadyExistsException;

/**
 * Creates topics and subscriptions if they do not exist yet.
 * 
 * <p>
 * Provisioning is check-then-create, so two processes provisioning the same resource at the same
 * time may both observe it as absent and both try to create it. The transport decides the winner,
 * and the loser's {@link ResourceAlreadyExistsException} is treated as success. Any other failure
 * is propagated to the caller without retry.
 * 
 * <p>
 * Topics this provisioner has seen to exist are remembered, so {@link #ensureTopic(String)} only
 * talks to the transport the first time it is called for a given topic.
 */
public class ResourceProvisioner {
  private static final Logger LOGGER = LoggerFactory.getLogger(ResourceProvisioner.class);

  private final Set<String> knownTopics = Collections.newSetFromMap(new ConcurrentHashMap<>());
  private final MessageTransport transport;

  public ResourceProvisioner(MessageTransport transport) {
    this.transport = requireNonNull(transport, "transport");
  }

  /**
   * Ensures the given subscription exists. If it does, returns immediately without checking or
   * changing its topic binding or ack deadline. Otherwise, ensures the topic exists and creates the
   * subscription bound to it.
   * 
   * @param subscriptionId the subscription
   * @param topicId the topic to bind a new subscription to
   * @param ackDeadline the ack deadline of a new subscription
   * @throws IOException if the subscription or topic could not be checked or created
   */
  public void ensureSubscription(String subscriptionId, String topicId, Duration ackDeadline)
      throws IOException {
    requireNonNull(subscriptionId, "subscriptionId");
    requireNonNull(topicId, "topicId");
    requireNonNull(ackDeadline, "ackDeadline");

    if (transport.subscriptionExists(subscriptionId)) {
      LOGGER.atDebug().addKeyValue("subscription", subscriptionId)
          .log("Subscription already exists");
      return;
    }

    ensureTopic(topicId);

    try {
      transport.createSubscription(subscriptionId, topicId, ackDeadline);
      LOGGER.atInfo().addKeyValue("subscription", subscriptionId).addKeyValue("topic", topicId)
          .addKeyValue("ackDeadline", ackDeadline).log("Created subscription");
    } catch (ResourceAlreadyExistsException e) {
      LOGGER.atDebug().addKeyValue("subscription", subscriptionId)
          .log("Subscription created concurrently. Continuing...");
    } catch (IOException e) {
      LOGGER.atError().setCause(e).addKeyValue("subscription", subscriptionId)
          .log("Failed to create subscription");
      throw e;
    }
  }

  /**
   * Ensures the given topic exists.
   * 
   * @param topicId the topic
   * @throws IOException if the topic could not be checked or created
   */
  public void ensureTopic(String topicId) throws IOException {
    requireNonNull(topicId, "topicId");

    if (knownTopics.contains(topicId))
      return;

    if (!transport.topicExists(topicId)) {
      try {
        transport.createTopic(topicId);
        LOGGER.atInfo().addKeyValue("topic", topicId).log("Created topic");
      } catch (ResourceAlreadyExistsException e) {
        LOGGER.atDebug().addKeyValue("topic", topicId)
            .log("Topic created concurrently. Continuing...");
      } catch (IOException e) {
        LOGGER.atError().setCause(e).addKeyValue("topic", topicId).log("Failed to create topic");
        throw e;
      }
    }

    knownTopics.add(topicId);
  }
}
