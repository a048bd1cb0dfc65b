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
package io.aleph0.grok.messaging.core;

import java.util.Map;

/**
 * A message delivered by a {@link io.aleph0.grok.messaging.core.transport.MessageTransport
 * transport}. Messages are immutable. Changing a message means publishing a new one.
 *
 * @param <T> the type of the message body
 */
public interface Message<T> extends Acknowledgeable {
  /**
   * The message ID, assigned by the transport. Re-delivery of the same message by the transport
   * results in the same ID. Re-publication of the message results in a new ID.
   */
  public String id();

  /**
   * Key-value metadata associated with the message. Never null, possibly empty, and unmodifiable.
   */
  public Map<String, String> attributes();

  /**
   * The content of the message
   */
  public T body();
}
