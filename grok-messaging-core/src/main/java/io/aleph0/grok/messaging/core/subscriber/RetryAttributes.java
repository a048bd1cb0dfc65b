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
import java.util.HashMap;
import java.util.Map;

/**
 * The message attribute conventions the subscriber uses to carry retry state between deliveries.
 * These names are shared with already-deployed consumers, so they must not change.
 */
public final class RetryAttributes {
  private RetryAttributes() {}

  /**
   * The attribute holding the number of times a message has been retried, as a decimal string.
   */
  public static final String RETRIES_ATTRIBUTE = "retries";

  /**
   * The attribute holding the reason a message was dead-lettered.
   */
  public static final String ERROR_ATTRIBUTE = "error";

  public static final String DEAD_LETTER_TOPIC_SUFFIX = "_dlq";

  public static String deadLetterTopicId(String topicId) {
    return requireNonNull(topicId, "topicId") + DEAD_LETTER_TOPIC_SUFFIX;
  }

  /**
   * Returns the retry count carried by the given attributes. A missing, malformed, or negative value
   * counts as zero, i.e., the message is assumed to be fresh.
   */
  public static int retryCount(Map<String, String> attributes) {
    final String value = attributes.get(RETRIES_ATTRIBUTE);
    if (value == null)
      return 0;

    final int result;
    try {
      result = Integer.parseInt(value.trim());
    } catch (NumberFormatException e) {
      return 0;
    }

    return Math.max(result, 0);
  }

  /**
   * Returns a copy of the given attributes with the retry count set to the given value.
   */
  public static Map<String, String> withRetryCount(Map<String, String> attributes,
      int retryCount) {
    if (retryCount < 0)
      throw new IllegalArgumentException("retryCount must not be negative");
    final Map<String, String> result = new HashMap<>(attributes);
    result.put(RETRIES_ATTRIBUTE, Integer.toString(retryCount));
    return result;
  }

  public static Map<String, String> deadLetterAttributes(String error) {
    return Map.of(ERROR_ATTRIBUTE, requireNonNull(error, "error"));
  }
}
