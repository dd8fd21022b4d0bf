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
 * Exception thrown when an acknowledgment or a rejection cannot be sent to the broker, e.g.
 * because the channel is closed or the delivery tag is unknown.
 */
public class ResolutionException extends WorkerException {

  private static final long serialVersionUID = 2047398716535112390L;

  private final long deliveryTag;
  private final Resolution resolution;

  public ResolutionException(long deliveryTag, Resolution resolution, Throwable cause) {
    super(
        String.format(
            "Error while sending %s for delivery tag %d: %s",
            resolution, deliveryTag, cause == null ? "" : cause.getMessage()),
        cause);
    this.deliveryTag = deliveryTag;
    this.resolution = resolution;
  }

  public long getDeliveryTag() {
    return deliveryTag;
  }

  public Resolution getResolution() {
    return resolution;
  }
}
