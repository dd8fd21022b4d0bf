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

import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import com.rabbitmq.worker.Delivery;
import com.rabbitmq.worker.MessageHandler;
import com.rabbitmq.worker.PayloadCodec;
import com.rabbitmq.worker.ProcessingSummary;
import com.rabbitmq.worker.ResolutionChannel;
import com.rabbitmq.worker.metrics.MetricsCollector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fetches, processes, and resolves messages one at a time on a dedicated channel.
 *
 * <p>A message is always resolved before the next one is fetched.
 */
final class ProcessingLoop {

  private static final Logger LOGGER = LoggerFactory.getLogger(ProcessingLoop.class);

  private final Connection connection;
  private final MessageConsumer messageConsumer;
  private final MetricsCollector metricsCollector;

  ProcessingLoop(
      Connection connection, MessageConsumer messageConsumer, MetricsCollector metricsCollector) {
    this.connection = connection;
    this.messageConsumer = messageConsumer;
    this.metricsCollector = metricsCollector;
  }

  <T> ProcessingSummary process(
      String queue, PayloadCodec<T> codec, int count, MessageHandler<T> handler) {
    Utils.checkQueue(queue);
    Utils.checkNotNull(codec, "codec");
    Utils.checkNotNull(handler, "message handler");
    if (count < 0) {
      throw new IllegalArgumentException("The number of messages to process must be positive");
    }
    int fetched = 0, empty = 0, acked = 0, requeued = 0, dropped = 0;
    if (count == 0) {
      return new ProcessingSummary(fetched, empty, acked, requeued, dropped);
    }
    Channel channel = Utils.openChannel(this.connection);
    ResolutionChannel resolutionChannel = new AmqpResolutionChannel(channel);
    try {
      for (int i = 0; i < count; i++) {
        Delivery delivery = Utils.fetch(channel, resolutionChannel, queue, this.metricsCollector);
        if (delivery == null) {
          empty++;
          continue;
        }
        fetched++;
        T message = this.messageConsumer.consume(delivery, codec, false);
        if (message == null) {
          // rejected without requeuing already
          dropped++;
          continue;
        }
        boolean interrupted = false;
        boolean processed;
        try {
          handler.handle(message);
          processed = true;
        } catch (Exception | Error e) {
          processed = false;
          interrupted = e instanceof InterruptedException;
          this.metricsCollector.processingFailed();
          LOGGER.warn(
              "Error while processing message {} from queue '{}', requeuing it",
              delivery.deliveryTag(),
              queue,
              e);
        }
        if (processed) {
          if (this.messageConsumer.acknowledge(delivery)) {
            acked++;
          } else {
            dropped++;
          }
        } else {
          this.messageConsumer.reject(delivery, true);
          requeued++;
        }
        if (interrupted || Thread.currentThread().isInterrupted()) {
          Thread.currentThread().interrupt();
          LOGGER.info(
              "Processing loop on queue '{}' interrupted after {} iteration(s)", queue, i + 1);
          break;
        }
      }
    } finally {
      Utils.closeChannel(channel);
    }
    ProcessingSummary summary = new ProcessingSummary(fetched, empty, acked, requeued, dropped);
    LOGGER.debug("Processing loop on queue '{}' done: {}", queue, summary);
    return summary;
  }
}
