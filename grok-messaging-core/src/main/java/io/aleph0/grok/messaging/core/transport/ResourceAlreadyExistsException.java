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

import java.io.IOException;

/**
 * Thrown by a {@link MessageTransport} when asked to create a topic or subscription that already
 * exists. Callers that create resources idempotently treat this as success.
 */
public class ResourceAlreadyExistsException extends IOException {
  private static final long serialVersionUID = 6029186404217380593L;

  private final String resourceId;

  public ResourceAlreadyExistsException(String resourceId) {
    this(resourceId, null);
  }

  public ResourceAlreadyExistsException(String resourceId, Throwable cause) {
    super("resource already exists: " + resourceId, cause);
    this.resourceId = resourceId;
  }

  public String getResourceId() {
    return resourceId;
  }
}
