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
import com.fasterxml.jackson.databind.ObjectWriter;

/**
 * Converts a message body back into raw message data when a failed message is republished for
 * retry. Must produce data the subscriber's {@link MessageBodyDeserializer} can read.
 *
 * @param <T> the body type
 */
@FunctionalInterface
public interface MessageBodySerializer<T> {
  public static <T> MessageBodySerializer<T> json() {
    return json(new ObjectMapper());
  }

  public static <T> MessageBodySerializer<T> json(ObjectMapper mapper) {
    final ObjectWriter writer = requireNonNull(mapper, "mapper").writer();
    return writer::writeValueAsBytes;
  }

  public byte[] serialize(T body) throws IOException;
}
