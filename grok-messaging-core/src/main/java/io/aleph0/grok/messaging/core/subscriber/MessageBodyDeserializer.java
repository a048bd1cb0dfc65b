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
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Converts raw message data into the body type a subscriber's handler expects. Any exception is a
 * permanent payload error.
 *
 * <p>
 * The JSON deserializers pair with a {@link #serializer() serializer} that uses the same
 * {@link ObjectMapper}, so retried bodies read back the way they were first read.
 *
 * @param <T> the body type
 */
@FunctionalInterface
public interface MessageBodyDeserializer<T> {
  public static <T> MessageBodyDeserializer<T> json(Class<T> type) {
    return json(new ObjectMapper(), type);
  }

  public static <T> MessageBodyDeserializer<T> json(ObjectMapper mapper, Class<T> type) {
    requireNonNull(mapper, "mapper");
    return new JsonMessageBodyDeserializer<>(mapper,
        mapper.readerFor(requireNonNull(type, "type")));
  }

  public static <T> MessageBodyDeserializer<T> json(TypeReference<T> type) {
    return json(new ObjectMapper(), type);
  }

  public static <T> MessageBodyDeserializer<T> json(ObjectMapper mapper, TypeReference<T> type) {
    requireNonNull(mapper, "mapper");
    return new JsonMessageBodyDeserializer<>(mapper,
        mapper.readerFor(requireNonNull(type, "type")));
  }

  public T deserialize(byte[] data) throws Exception;

  /**
   * The serializer used to republish bodies read by this deserializer. Defaults to JSON with a
   * default {@link ObjectMapper}.
   */
  public default MessageBodySerializer<T> serializer() {
    return MessageBodySerializer.json();
  }
}
