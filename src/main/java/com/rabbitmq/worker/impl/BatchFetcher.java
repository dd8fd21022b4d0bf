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
import com.rabbitmq.worker.PayloadCodec;
import com.rabbitmq.worker.ResolutionChannel;
import com.rabbitmq.worker.metrics.MetricsCollector;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Pulls a fixed number of messages from a queue on a dedicated channel. */
final class BatchFetcher {

  private static final Logger LOGGER = LoggerFactory.getLogger(BatchFetcher.class);

  private final Connection connection;
  private final MessageConsumer messageConsumer;
  private final MetricsCollector metricsCollector;

  BatchFetcher(
      Connection connection, MessageConsumer messageConsumer, MetricsCollector metricsCollector) {
    this.connection = connection;
    this.messageConsumer = messageConsumer;
    this.metricsCollector = metricsCollector;
  }

  <T> List<T> fetch(String queue, PayloadCodec<T> codec, boolean ack, int count) {
    Utils.checkQueue(queue);
    Utils.checkNotNull(codec, "codec");
    if (count < 0) {
      throw new IllegalArgumentException("The number of messages to fetch must be positive");
    }
    List<T> messages = new ArrayList<>(count);
    if (count == 0) {
      return messages;
    }
    Channel channel = Utils.openChannel(this.connection);
    ResolutionChannel resolutionChannel = new AmqpResolutionChannel(channel);
    try {
      for (int i = 0; i < count; i++) {
        Delivery delivery = Utils.fetch(channel, resolutionChannel, queue, this.metricsCollector);
        if (delivery == null) {
          messages.add(null);
        } else {
          messages.add(this.messageConsumer.consume(delivery, codec, ack));
        }
      }
    } finally {
      Utils.closeChannel(channel);
    }
    LOGGER.debug("Fetched {} message slot(s) from queue '{}' (ack: {})", count, queue, ack);
    return messages;
  }
}
