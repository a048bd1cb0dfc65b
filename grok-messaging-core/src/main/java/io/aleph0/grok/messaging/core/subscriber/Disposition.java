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

/**
 * What the subscriber decided to do with a single delivery.
 */
public enum Disposition {
  /**
   * The handler completed normally.
   */
  SUCCEEDED,

  /**
   * The handler failed and the message was republished to its topic with its retry count
   * incremented.
   */
  RETRIED,

  /**
   * The message body could not be deserialized. The raw data was sent to the dead-letter topic.
   */
  DEAD_LETTERED_UNREADABLE,

  /**
   * The handler crashed. The message was sent to the dead-letter topic without retry.
   */
  DEAD_LETTERED_CRASHED,

  /**
   * The handler failed and the message had no retries left. The message was sent to the
   * dead-letter topic.
   */
  DEAD_LETTERED_EXHAUSTED;

  public boolean isDeadLettered() {
    return this == DEAD_LETTERED_UNREADABLE || this == DEAD_LETTERED_CRASHED
        || this == DEAD_LETTERED_EXHAUSTED;
  }
}
