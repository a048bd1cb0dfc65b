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
import java.io.IOException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;

/**
 * Reads JSON message bodies with a given {@link ObjectMapper}, and writes retried bodies back with
 * the same mapper.
 */
class JsonMessageBodyDeserializer<T> implements MessageBodyDeserializer<T> {
  private final ObjectMapper mapper;
  private final ObjectReader reader;

  public JsonMessageBodyDeserializer(ObjectMapper mapper, ObjectReader reader) {
    this.mapper = requireNonNull(mapper, "mapper");
    this.reader = requireNonNull(reader, "reader");
  }

  @Override
  public T deserialize(byte[] data) throws IOException {
    return reader.readValue(data);
  }

  @Override
  public MessageBodySerializer<T> serializer() {
    return MessageBodySerializer.json(mapper);
  }
}
