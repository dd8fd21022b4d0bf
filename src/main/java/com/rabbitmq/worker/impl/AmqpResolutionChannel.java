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
import com.rabbitmq.client.ShutdownSignalException;
import com.rabbitmq.worker.Resolution;
import com.rabbitmq.worker.ResolutionChannel;
import com.rabbitmq.worker.ResolutionException;
import java.io.IOException;

/** {@link ResolutionChannel} on top of an AMQP 0.9.1 {@link Channel}. */
final class AmqpResolutionChannel implements ResolutionChannel {

  private final Channel channel;

  AmqpResolutionChannel(Channel channel) {
    this.channel = channel;
  }

  @Override
  public void ack(long deliveryTag) {
    try {
      this.channel.basicAck(deliveryTag, false);
    } catch (IOException | ShutdownSignalException e) {
      throw new ResolutionException(deliveryTag, Resolution.ACK, e);
    }
  }

  @Override
  public void reject(long deliveryTag, boolean requeue) {
    try {
      this.channel.basicReject(deliveryTag, requeue);
    } catch (IOException | ShutdownSignalException e) {
      throw new ResolutionException(
          deliveryTag, requeue ? Resolution.REJECT_REQUEUE : Resolution.REJECT_DROP, e);
    }
  }

  @Override
  public boolean isOpen() {
    return this.channel.isOpen();
  }

  @Override
  public String toString() {
    return "AmqpResolutionChannel{channel=" + channel.getChannelNumber() + '}';
  }
}
