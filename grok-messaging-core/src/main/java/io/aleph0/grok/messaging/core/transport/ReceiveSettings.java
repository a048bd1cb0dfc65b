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

import static java.util.Objects.requireNonNull;
import java.util.OptionalInt;

/**
 * Settings for {@link MessageTransport#receive(String, ReceiveSettings, MessageReceiver)}.
 *
 * @param maxOutstandingMessages the maximum number of messages delivered but not yet settled, or
 *        empty to use the transport default
 */
public record ReceiveSettings(OptionalInt maxOutstandingMessages) {
  public static ReceiveSettings defaultReceiveSettings() {
    return new ReceiveSettings(OptionalInt.empty());
  }

  public static ReceiveSettings withMaxOutstandingMessages(int maxOutstandingMessages) {
    return new ReceiveSettings(OptionalInt.of(maxOutstandingMessages));
  }

  public ReceiveSettings {
    requireNonNull(maxOutstandingMessages, "maxOutstandingMessages");
    if (maxOutstandingMessages.isPresent() && maxOutstandingMessages.getAsInt() < 1)
      throw new IllegalArgumentException("maxOutstandingMessages must be positive");
  }
}
