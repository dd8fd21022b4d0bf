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
package com.rabbitmq.worker;

/**
 * A message received from a queue, with the channel it must be resolved on.
 *
 * <p>The delivery tag and the channel are bound at creation time. A delivery must be resolved
 * exactly once (acknowledged or rejected) and must not be kept afterwards.
 */
public final class Delivery {

  private final long deliveryTag;
  private final byte[] body;
  private final ResolutionChannel channel;
  private final boolean redelivered;
  private final String queue;

  public Delivery(long deliveryTag, byte[] body, ResolutionChannel channel) {
    this(deliveryTag, body, channel, false, null);
  }

  public Delivery(
      long deliveryTag,
      byte[] body,
      ResolutionChannel channel,
      boolean redelivered,
      String queue) {
    if (channel == null) {
      throw new IllegalArgumentException("The channel of a delivery cannot be null");
    }
    this.deliveryTag = deliveryTag;
    this.body = body;
    this.channel = channel;
    this.redelivered = redelivered;
    this.queue = queue;
  }

  public long deliveryTag() {
    return this.deliveryTag;
  }

  public byte[] body() {
    return this.body;
  }

  public ResolutionChannel channel() {
    return this.channel;
  }

  /**
   * Whether the broker flagged the message as redelivered.
   *
   * @return true if the message may have been delivered before
   */
  public boolean redelivered() {
    return this.redelivered;
  }

  /**
   * The queue the message comes from, if known.
   *
   * @return the queue, can be null
   */
  public String queue() {
    return this.queue;
  }

  /** Acknowledge the delivery on its channel. */
  public void ack() {
    this.channel.ack(this.deliveryTag);
  }

  /**
   * Reject the delivery on its channel.
   *
   * @param requeue whether the message should go back to the queue
   */
  public void reject(boolean requeue) {
    this.channel.reject(this.deliveryTag, requeue);
  }

  @Override
  public String toString() {
    return "Delivery{"
        + "deliveryTag="
        + deliveryTag
        + ", queue='"
        + queue
        + '\''
        + ", redelivered="
        + redelivered
        + ", size="
        + (body == null ? 0 : body.length)
        + '}';
  }
}
