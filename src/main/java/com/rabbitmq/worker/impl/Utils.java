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

import com.rabbitmq.client.AlreadyClosedException;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.GetResponse;
import com.rabbitmq.client.ShutdownSignalException;
import com.rabbitmq.worker.Delivery;
import com.rabbitmq.worker.ResolutionChannel;
import com.rabbitmq.worker.WorkerException;
import com.rabbitmq.worker.metrics.MetricsCollector;
import java.io.IOException;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

final class Utils {

  private static final Logger LOGGER = LoggerFactory.getLogger(Utils.class);

  private Utils() {}

  static Channel openChannel(Connection connection) {
    Channel channel;
    try {
      channel = connection.createChannel();
    } catch (IOException | ShutdownSignalException e) {
      throw new WorkerException("Error while opening channel", e);
    }
    if (channel == null) {
      throw new WorkerException("No channel available on connection (channel max reached)");
    }
    return channel;
  }

  static void closeChannel(Channel channel) {
    try {
      channel.close();
    } catch (AlreadyClosedException e) {
      LOGGER.debug("Channel {} already closed", channel.getChannelNumber());
    } catch (IOException | TimeoutException | ShutdownSignalException e) {
      LOGGER.warn("Error while closing channel {}: {}", channel.getChannelNumber(), e.getMessage());
    }
  }

  /**
   * Fetch one message without waiting.
   *
   * @return the delivery, null if the queue is empty
   */
  static Delivery fetch(
      Channel channel,
      ResolutionChannel resolutionChannel,
      String queue,
      MetricsCollector metricsCollector) {
    GetResponse response;
    try {
      response = channel.basicGet(queue, false);
    } catch (IOException | ShutdownSignalException e) {
      throw new WorkerException("Error while fetching message from queue '" + queue + "'", e);
    }
    if (response == null) {
      metricsCollector.emptyFetch();
      return null;
    }
    metricsCollector.fetched();
    return new Delivery(
        response.getEnvelope().getDeliveryTag(),
        response.getBody(),
        resolutionChannel,
        response.getEnvelope().isRedeliver(),
        queue);
  }

  static void checkQueue(String queue) {
    if (queue == null || queue.isEmpty()) {
      throw new IllegalArgumentException("A queue must be specified");
    }
  }

  static void checkNotNull(Object value, String name) {
    if (value == null) {
      throw new IllegalArgumentException("The " + name + " cannot be null");
    }
  }
}
