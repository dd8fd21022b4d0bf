// Copyright (c) 2025 Broadcom. All Rights Reserved.
// The term "Broadcom" refers to Broadcom Inc. and/or its subsidiaries.
//
// This software, the RabbitMQ Queue Worker Java library, is dual-licensed under the
// Mozilla Public License 2.0 ("MPL"), and the Apache License version 2 ("ASL").
// For the MPL, please see LICENSE-MPL-RabbitMQ. For the ASL,
// please see LICENSE-APACHE2.
//
// This software is distributed on an "AS IS" basis, WITHOUT WARRANTY OF ANY KIND,
// either express or implied. See the LICENSE file for specific language governing
// rights and limitations of this software.
//
// If you have any questions regarding licensing, please contact us at
// info@rabbitmq.com.
package com.rabbitmq.worker.impl;

import com.rabbitmq.worker.AckFailurePolicy;
import com.rabbitmq.worker.Delivery;
import com.rabbitmq.worker.DeserializationException;
import com.rabbitmq.worker.PayloadCodec;
import com.rabbitmq.worker.ResolutionException;
import com.rabbitmq.worker.metrics.MetricsCollector;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decodes deliveries and resolves them.
 *
 * <p>All the resolution calls of the worker go through this class, so a delivery that cannot be
 * decoded is always rejected without requeuing and a failed acknowledgment always goes through
 * the {@link AckFailurePolicy}.
 */
final class MessageConsumer {

  private static final Logger LOGGER = LoggerFactory.getLogger(MessageConsumer.class);

  private final AckFailurePolicy ackFailurePolicy;
  private final MetricsCollector metricsCollector;

  MessageConsumer(AckFailurePolicy ackFailurePolicy, MetricsCollector metricsCollector) {
    this.ackFailurePolicy = ackFailurePolicy;
    this.metricsCollector = metricsCollector;
  }

  /**
   * Decode a delivery and acknowledge it if requested.
   *
   * @return the decoded message, null if decoding or acknowledgment failed
   * @throws ResolutionException if the fallback rejection fails
   */
  <T> T consume(Delivery delivery, PayloadCodec<T> codec, boolean ack) {
    T message;
    try {
      message = codec.decode(delivery.body());
      if (message == null) {
        throw new DeserializationException("Codec returned null");
      }
    } catch (RuntimeException e) {
      this.metricsCollector.deserializationFailed();
      LOGGER.warn(
          "Could not decode message {} (queue '{}'), rejecting it without requeuing",
          delivery.deliveryTag(),
          delivery.queue(),
          e);
      reject(delivery, false);
      return null;
    }
    if (ack && !acknowledge(delivery)) {
      return null;
    }
    return message;
  }

  /**
   * Acknowledge a delivery, applying the {@link AckFailurePolicy} if the acknowledgment fails.
   *
   * @return true if the delivery has been acknowledged, false if it has been rejected instead
   * @throws ResolutionException if the fallback rejection fails
   */
  boolean acknowledge(Delivery delivery) {
    int failedAttempts = 0;
    while (true) {
      try {
        delivery.ack();
        this.metricsCollector.acked();
        LOGGER.debug("Acknowledged message {}", delivery.deliveryTag());
        return true;
      } catch (ResolutionException e) {
        failedAttempts++;
        Duration delay = this.ackFailurePolicy.delay(failedAttempts);
        if (delay == null || delay.isNegative()) {
          LOGGER.warn(
              "Ack failure policy {} returned an invalid delay ({}), giving up",
              this.ackFailurePolicy,
              delay);
          delay = AckFailurePolicy.GIVE_UP;
        }
        if (AckFailurePolicy.GIVE_UP.equals(delay)) {
          LOGGER.warn(
              "Could not acknowledge message {} after {} attempt(s), "
                  + "rejecting it without requeuing",
              delivery.deliveryTag(),
              failedAttempts,
              e);
          reject(delivery, false);
          return false;
        }
        LOGGER.debug(
            "Acknowledgment of message {} failed ({}), retrying in {}",
            delivery.deliveryTag(),
            e.getMessage(),
            delay);
        try {
          Thread.sleep(delay.toMillis());
        } catch (InterruptedException ie) {
          Thread.currentThread().interrupt();
          LOGGER.info(
              "Interrupted while retrying acknowledgment of message {}, rejecting it",
              delivery.deliveryTag());
          reject(delivery, false);
          return false;
        }
      }
    }
  }

  /**
   * Reject a delivery.
   *
   * @throws ResolutionException if the rejection fails, there is no fallback
   */
  void reject(Delivery delivery, boolean requeue) {
    delivery.reject(requeue);
    this.metricsCollector.rejected(requeue);
    LOGGER.debug("Rejected message {} (requeue: {})", delivery.deliveryTag(), requeue);
  }
}
