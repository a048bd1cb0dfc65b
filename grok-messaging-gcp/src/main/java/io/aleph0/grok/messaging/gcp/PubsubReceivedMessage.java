/*-
 * =================================LICENSE_START==================================
 * grok-messaging-gcp
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
package io.aleph0.grok.messaging.gcp;

import static java.util.Objects.requireNonNull;
import java.io.IOException;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;
import com.google.api.core.ApiFuture;
import com.google.api.core.ApiFutureCallback;
import com.google.api.core.ApiFutures;
import com.google.cloud.pubsub.v1.AckReplyConsumerWithResponse;
import com.google.cloud.pubsub.v1.AckResponse;
import com.google.common.util.concurrent.MoreExecutors;
import com.google.pubsub.v1.PubsubMessage;
import io.aleph0.grok.messaging.core.Message;

/**
 * A {@link Message} delivered by Google Pub/Sub. Settling the message reports the transport's
 * {@link AckResponse} to the listener. Anything other than {@link AckResponse#SUCCESSFUL} is a
 * failure.
 *
 * <p>
 * The transport adds each message to the outstanding set. A message leaves the set once it is
 * settled, so the transport can nack whatever is left when it stops the subscriber. A Pub/Sub
 * subscriber never terminates while messages are outstanding.
 */
class PubsubReceivedMessage implements Message<byte[]> {
  private final AtomicBoolean settled = new AtomicBoolean(false);
  private final PubsubMessage message;
  private final AckReplyConsumerWithResponse acker;
  private final Set<PubsubReceivedMessage> outstanding;
  private final byte[] body;

  public PubsubReceivedMessage(PubsubMessage message, AckReplyConsumerWithResponse acker,
      Set<PubsubReceivedMessage> outstanding) {
    this.message = requireNonNull(message, "message");
    this.acker = requireNonNull(acker, "acker");
    this.outstanding = requireNonNull(outstanding, "outstanding");
    this.body = message.getData().toByteArray();
  }

  @Override
  public String id() {
    return message.getMessageId();
  }

  @Override
  public Map<String, String> attributes() {
    return message.getAttributesMap();
  }

  @Override
  public byte[] body() {
    return body;
  }

  @Override
  public void ack(AcknowledgementListener listener) {
    if (!settled.compareAndSet(false, true)) {
      listener.onFailure(new IllegalStateException("message already settled"));
      return;
    }
    outstanding.remove(this);
    settle("ack", acker.ack(), listener);
  }

  @Override
  public void nack(AcknowledgementListener listener) {
    if (!settled.compareAndSet(false, true)) {
      listener.onFailure(new IllegalStateException("message already settled"));
      return;
    }
    outstanding.remove(this);
    settle("nack", acker.nack(), listener);
  }

  private static void settle(String operation, Future<AckResponse> future,
      AcknowledgementListener listener) {
    if (future instanceof ApiFuture<AckResponse> apiFuture) {
      ApiFutures.addCallback(apiFuture, new ApiFutureCallback<AckResponse>() {
        @Override
        public void onSuccess(AckResponse result) {
          if (result == AckResponse.SUCCESSFUL)
            listener.onSuccess();
          else
            listener.onFailure(new IOException(operation + " failed with response " + result));
        }

        @Override
        public void onFailure(Throwable t) {
          listener.onFailure(t);
        }
      }, MoreExecutors.directExecutor());
      return;
    }

    final AckResponse result;
    try {
      result = future.get();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      listener.onFailure(e);
      return;
    } catch (ExecutionException e) {
      listener.onFailure(e.getCause());
      return;
    }

    if (result == AckResponse.SUCCESSFUL)
      listener.onSuccess();
    else
      listener.onFailure(new IOException(operation + " failed with response " + result));
  }

  @Override
  public String toString() {
    return "PubsubReceivedMessage [id=" + id() + ", attributes=" + attributes() + "]";
  }
}
