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
 * Delivery metrics of a {@link RetryingSubscriber}.
 * 
 * @param received deliveries received from the transport
 * @param succeeded deliveries whose handler completed normally
 * @param retried deliveries republished for another attempt
 * @param deadLettered deliveries sent to the dead-letter topic, for any reason
 * @param forwardingFailures deliveries whose retry or dead-letter publication failed
 * @param acknowledgementFailures settlements the transport reported as failed
 * @param awaiting settlements still waiting for the transport to respond
 */
public record SubscriberMetrics(long received, long succeeded, long retried, long deadLettered,
    long forwardingFailures, long acknowledgementFailures, long awaiting) {
}
