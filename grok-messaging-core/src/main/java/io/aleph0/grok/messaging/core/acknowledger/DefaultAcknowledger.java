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
package io.aleph0.grok.messaging.core.acknowledger;

import java.util.concurrent.Phaser;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import io.aleph0.grok.messaging.core.Acknowledgeable;
import io.aleph0.grok.messaging.core.Acknowledger;
import io.aleph0.grok.messaging.core.AcknowledgerMetrics;

/**
 * Default implementation of the {@link Acknowledger} interface. This class handles the mechanics of
 * settling messages, including tracking metrics and logging failures. The class is thread-safe, so
 * one instance can be shared by all deliveries of a subscriber.
 */
public class DefaultAcknowledger implements Acknowledger {
  private static final Logger LOGGER = LoggerFactory.getLogger(DefaultAcknowledger.class);

  private final AtomicLong acknowledgedMetric = new AtomicLong(0);
  private final AtomicLong rejectedMetric = new AtomicLong(0);
  private final AtomicLong retiredSuccessMetric = new AtomicLong(0);
  private final AtomicLong retiredFailureMetric = new AtomicLong(0);
  private final AtomicLong awaitingMetric = new AtomicLong(0);

  /**
   * We start at 1 so we can await in the close method after the last settlement completes
   */
  private final Phaser phaser = new Phaser(1);
  private final AtomicBoolean closed = new AtomicBoolean(false);

  @Override
  public void acknowledge(Acknowledgeable acknowledgeable) {
    if (closed.get())
      throw new IllegalStateException("closed");

    acknowledgedMetric.incrementAndGet();
    awaitingMetric.incrementAndGet();
    phaser.register();

    acknowledgeable.ack(newListener("acknowledge"));
  }

  @Override
  public void reject(Acknowledgeable acknowledgeable) {
    if (closed.get())
      throw new IllegalStateException("closed");

    rejectedMetric.incrementAndGet();
    awaitingMetric.incrementAndGet();
    phaser.register();

    acknowledgeable.nack(newListener("reject"));
  }

  private Acknowledgeable.AcknowledgementListener newListener(String operation) {
    return new Acknowledgeable.AcknowledgementListener() {
      @Override
      public void onSuccess() {
        retiredSuccessMetric.incrementAndGet();
        awaitingMetric.decrementAndGet();
        phaser.arriveAndDeregister();
      }

      @Override
      public void onFailure(Throwable cause) {
        retiredFailureMetric.incrementAndGet();
        awaitingMetric.decrementAndGet();
        phaser.arriveAndDeregister();
        if (cause instanceof InterruptedException) {
          Thread.currentThread().interrupt();
          LOGGER.atWarn().setCause(cause).addKeyValue("operation", operation)
              .log("Interrupted while trying to settle message. Transport will redeliver...");
        } else {
          LOGGER.atWarn().setCause(cause).addKeyValue("operation", operation)
              .log("Failed to settle message. Transport will redeliver...");
        }
      }
    };
  }

  @Override
  public void close() {
    if (closed.compareAndSet(false, true)) {
      // Wait for all settlements to complete
      phaser.arriveAndAwaitAdvance();
    }
  }

  @Override
  public AcknowledgerMetrics checkMetrics() {
    final long acknowledged = acknowledgedMetric.get();
    final long rejected = rejectedMetric.get();
    final long retiredSuccess = retiredSuccessMetric.get();
    final long retiredFailure = retiredFailureMetric.get();
    final long awaiting = awaitingMetric.get();
    return new AcknowledgerMetrics(acknowledged, rejected, retiredSuccess, retiredFailure,
        awaiting);
  }

  @Override
  public AcknowledgerMetrics flushMetrics() {
    final long acknowledged = acknowledgedMetric.getAndSet(0);
    final long rejected = rejectedMetric.getAndSet(0);
    final long retiredSuccess = retiredSuccessMetric.getAndSet(0);
    final long retiredFailure = retiredFailureMetric.getAndSet(0);
    final long awaiting = awaitingMetric.get();
    return new AcknowledgerMetrics(acknowledged, rejected, retiredSuccess, retiredFailure,
        awaiting);
  }
}
