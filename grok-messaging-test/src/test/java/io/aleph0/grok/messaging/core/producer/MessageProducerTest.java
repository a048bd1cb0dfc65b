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
package io.aleph0.grok.messaging.core.producer;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import java.io.IOException;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import com.fasterxml.jackson.core.JsonProcessingException;
import io.aleph0.grok.messaging.test.InMemoryMessageTransport;
import io.aleph0.grok.messaging.test.PublishedMessage;

public class MessageProducerTest {
  public static record Order(String id, int quantity) {
  }

  private InMemoryMessageTransport transport;

  @BeforeEach
  public void setupMessageProducerTest() throws IOException {
    transport = new InMemoryMessageTransport();
    transport.createTopic("orders");
  }

  @AfterEach
  public void cleanupMessageProducerTest() {
    transport.close();
  }

  @Test
  public void givenPayload_whenPublish_thenJsonPublishedWithAttributes() throws Exception {
    final MessageProducer producer = new MessageProducer(transport);

    final String id = producer.publish("orders", new Order("o-1", 2), Map.of("source", "test"));

    final List<PublishedMessage> published = transport.published("orders");
    assertThat(published).hasSize(1);
    assertThat(published.get(0).id()).isEqualTo(id);
    assertThat(published.get(0).dataAsString()).isEqualTo("{\"id\":\"o-1\",\"quantity\":2}");
    assertThat(published.get(0).attributes()).containsOnly(Map.entry("source", "test"));
  }

  @Test
  public void givenBytes_whenPublishBytes_thenPublishedVerbatim() throws Exception {
    final MessageProducer producer = new MessageProducer(transport);

    producer.publishBytes("orders", "not-json".getBytes(UTF_8), Map.of());

    assertThat(transport.published("orders").get(0).dataAsString()).isEqualTo("not-json");
  }

  @Test
  public void givenUnserializablePayload_whenPublish_thenJsonProcessingException() {
    final MessageProducer producer = new MessageProducer(transport);

    assertThatThrownBy(() -> producer.publish("orders", new Object(), Map.of()))
        .isInstanceOf(JsonProcessingException.class);
    assertThat(transport.published("orders")).isEmpty();
  }

  @Test
  public void givenMissingTopic_whenPublish_thenIOException() {
    final MessageProducer producer = new MessageProducer(transport);

    assertThatThrownBy(() -> producer.publish("payments", new Order("o-1", 2), Map.of()))
        .isInstanceOf(IOException.class);
  }
}
