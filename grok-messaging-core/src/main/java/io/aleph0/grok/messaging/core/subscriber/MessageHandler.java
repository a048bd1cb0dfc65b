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
 * Handles the body of a delivered message. Owns all business logic.
 * 
 * <p>
 * Handlers report failure by throwing. A checked {@link Exception} is an expected failure: the
 * message is retried until its retry budget runs out, then dead-lettered. An unchecked throwable
 * ({@link RuntimeException} or {@link Error}) is a crash: the message is dead-lettered immediately
 * and never retried.
 * 
 * <p>
 * Handlers are called concurrently from multiple threads, and must not retain the body after
 * returning.
 *
 * @param <T> the type of the message body
 */
@FunctionalInterface
public interface MessageHandler<T> {
  public void handle(T body) throws Exception;
}
