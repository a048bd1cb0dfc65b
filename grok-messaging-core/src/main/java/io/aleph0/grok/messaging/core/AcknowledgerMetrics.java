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
 * Settlement metrics of an {@link Acknowledger}.
 * 
 * @param acknowledged the number of acknowledgements initiated
 * @param rejected the number of negative acknowledgements initiated
 * @param retiredSuccess the number of settlements that completed successfully
 * @param retiredFailure the number of settlements that failed
 * @param awaiting the number of settlements still waiting for the transport to respond
 */
public record AcknowledgerMetrics(long acknowledged, long rejected, long retiredSuccess,
    long retiredFailure, long awaiting) {
  public long retired() {
    return retiredSuccess + retiredFailure;
  }
}
