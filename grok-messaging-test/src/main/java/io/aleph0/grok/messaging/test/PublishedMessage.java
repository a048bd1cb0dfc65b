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

import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Collections.unmodifiableMap;
import static java.util.Objects.requireNonNull;
import java.util.Map;

/**
 * A message accepted by {@link InMemoryMessageTransport#publish(String, byte[], Map)}.
 *
 * @param id the ID the transport assigned
 * @param topicId the topic the message was published to
 * @param data the message body
 * @param attributes the message attributes
 */
public record PublishedMessage(String id, String topicId, byte[] data,
    Map<String, String> attributes) {
  public PublishedMessage {
    requireNonNull(id, "id");
    requireNonNull(topicId, "topicId");
    requireNonNull(data, "data");
    attributes = unmodifiableMap(requireNonNull(attributes, "attributes"));
  }

  public String dataAsString() {
    return new String(data, UTF_8);
  }

  @Override
  public String toString() {
    return "PublishedMessage [id=" + id + ", topicId=" + topicId + ", data=" + dataAsString()
        + ", attributes=" + attributes + "]";
  }
}
