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

public interface Acknowledgeable {
  /**
   * A listener that is notified when an acknowledgement or negative acknowledgement is complete.
   */
  public static interface AcknowledgementListener {
    public void onSuccess();

    public void onFailure(Throwable t);
  }

  /**
   * Acknowledge this object. Used to indicate that the transport must not deliver this message
   * again.
   * 
   * <p>
   * This method guarantees that the given listener will be called exactly once, with either
   * {@link AcknowledgementListener#onSuccess() success} or
   * {@link AcknowledgementListener#onFailure(Throwable) failure}.
   * 
   * <p>
   * A message may be settled only once. If this message was already acknowledged or negatively
   * acknowledged, then the listener fails with an {@link IllegalStateException}.
   * 
   * @param listener the listener to notify when the acknowledgement is complete, either
   *        successfully or with an error.
   */
  public void ack(AcknowledgementListener listener);

  /**
   * Negatively acknowledge this object. Used to indicate that the transport should deliver this
   * message again according to its own redelivery semantics.
   * 
   * <p>
   * This method guarantees that the given listener will be called exactly once, with either
   * {@link AcknowledgementListener#onSuccess() success} or
   * {@link AcknowledgementListener#onFailure(Throwable) failure}.
   * 
   * <p>
   * A message may be settled only once. If this message was already acknowledged or negatively
   * acknowledged, then the listener fails with an {@link IllegalStateException}.
   * 
   * @param listener the listener to notify when the negative acknowledgement is complete, either
   *        successfully or with an error.
   */
  public void nack(AcknowledgementListener listener);
}
