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
package io.aleph0.grok.messaging.core.producer;

import static java.util.Objects.requireNonNull;
import java.io.IOException;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.aleph0.grok.messaging.core.transport.MessageTransport;

/**
 * Publishes messages to a {@link MessageTransport}. Payloads are serialized as JSON.
 * 
 * <p>
 * The producer does not retry. If the transport does not accept a message, the error is returned
 * to the caller, who decides what to do about it.
 */
public class MessageProducer {
  private static final Logger LOGGER = LoggerFactory.getLogger(MessageProducer.class);

  private final MessageTransport transport;
  private final ObjectMapper mapper;

  public MessageProducer(MessageTransport transport) {
    this(transport, new ObjectMapper());
  }

  public MessageProducer(MessageTransport transport, ObjectMapper mapper) {
    this.transport = requireNonNull(transport, "transport");
    this.mapper = requireNonNull(mapper, "mapper");
  }

  /**
   * Serializes the given payload as JSON and publishes it with the given attributes attached
   * verbatim.
   * 
   * @param topicId the topic to publish to
   * @param payload the payload to serialize
   * @param attributes the attributes to attach
   * @return the ID of the published message
   * @throws JsonProcessingException if the payload cannot be serialized. Nothing is published.
   * @throws IOException if the transport does not accept the message
   * @throws InterruptedException if interrupted while waiting for the transport
   */
  public String publish(String topicId, Object payload, Map<String, String> attributes)
      throws IOException, InterruptedException {
    final byte[] data;
    try {
      data = mapper.writeValueAsBytes(payload);
    } catch (JsonProcessingException e) {
      LOGGER.atError().setCause(e).addKeyValue("topic", topicId)
          .log("Failed to serialize payload. Not publishing...");
      throw e;
    }
    return publishBytes(topicId, data, attributes);
  }

  /**
   * Publishes the given bytes unchanged with the given attributes attached verbatim.
   * 
   * @param topicId the topic to publish to
   * @param data the message body
   * @param attributes the attributes to attach
   * @return the ID of the published message
   * @throws IOException if the transport does not accept the message
   * @throws InterruptedException if interrupted while waiting for the transport
   */
  public String publishBytes(String topicId, byte[] data, Map<String, String> attributes)
      throws IOException, InterruptedException {
    requireNonNull(topicId, "topicId");
    requireNonNull(data, "data");
    requireNonNull(attributes, "attributes");

    final String messageId = transport.publish(topicId, data, attributes);

    LOGGER.atDebug().addKeyValue("topic", topicId).addKeyValue("messageId", messageId)
        .log("Published message");

    return messageId;
  }
}
