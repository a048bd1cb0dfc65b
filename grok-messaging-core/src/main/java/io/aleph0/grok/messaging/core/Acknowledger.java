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

/**
 * An Acknowledger settles delivered messages on behalf of a subscriber. Settlement is asynchronous,
 * so the acknowledger tracks outstanding settlements and allows the owner to wait for them when
 * shutting down.
 * 
 * <p>
 * Settlement failures are not fatal. A message whose acknowledgement fails is simply redelivered
 * by the transport at some point in the future, so implementations log and count such failures
 * rather than propagating them.
 *
 * <p>
 * The acknowledger should be {@link #close() closed} when it is no longer needed, to ensure that
 * any outstanding settlements are completed.
 */
public interface Acknowledger extends Measureable<AcknowledgerMetrics>, AutoCloseable {
  /**
   * Acknowledges the given message. This method is asynchronous.
   * 
   * @param acknowledgeable the message to acknowledge
   * @throws IllegalStateException if the acknowledger is closed
   */
  void acknowledge(Acknowledgeable acknowledgeable);

  /**
   * Negatively acknowledges the given message. This method is asynchronous.
   * 
   * @param acknowledgeable the message to negatively acknowledge
   * @throws IllegalStateException if the acknowledger is closed
   */
  void reject(Acknowledgeable acknowledgeable);

  /**
   * Closes the acknowledger, preventing any new settlements from being initiated. This method will
   * wait for all outstanding settlements to complete before returning, even if the calling thread
   * is interrupted. If the acknowledger is already closed, this method will do nothing.
   */
  @Override
  void close();
}
