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
 * A pool of push-mode workers consuming from a queue.
 *
 * <p>Each worker owns its channel and processes one message at a time: the message is decoded,
 * handed to the {@link MessageHandler}, then acknowledged if the handler returns normally or
 * rejected without requeuing if it throws.
 *
 * @see SubscriberBuilder
 */
public interface Subscriber extends AutoCloseable {

  /**
   * Whether the subscriber has not been closed yet.
   *
   * @return true if the subscriber is open
   */
  boolean isOpen();

  /**
   * Stop the workers and close their channels.
   *
   * <p>Workers stop taking new messages, in-flight processing gets some time to complete, then
   * the channels are closed. Unresolved messages are redelivered by the broker.
   */
  @Override
  void close();
}
