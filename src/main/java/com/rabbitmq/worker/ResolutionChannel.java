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
 * Acknowledgment primitives of a single broker channel.
 *
 * <p>A delivery tag is meaningful only on the channel it was received from, this is why a {@link
 * Delivery} always carries the {@link ResolutionChannel} it must be resolved on.
 *
 * <p>Implementations are not expected to be thread-safe: a channel is owned by one consumption
 * unit at a time.
 */
public interface ResolutionChannel {

  /**
   * Acknowledge a delivery.
   *
   * @param deliveryTag the tag of the delivery
   * @throws ResolutionException if the channel is closed or the tag is unknown
   */
  void ack(long deliveryTag);

  /**
   * Reject a delivery.
   *
   * @param deliveryTag the tag of the delivery
   * @param requeue whether the broker should requeue the message or drop it
   * @throws ResolutionException if the channel is closed or the tag is unknown
   */
  void reject(long deliveryTag, boolean requeue);

  /**
   * Whether the underlying channel is still usable.
   *
   * @return true if the channel is open
   */
  boolean isOpen();
}
