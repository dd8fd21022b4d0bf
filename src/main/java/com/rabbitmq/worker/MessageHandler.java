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
 * Application logic for inbound messages.
 *
 * <p>A normal return means the message has been processed and it is acknowledged. An exception
 * means the processing failed and the message is rejected: it is requeued in pull mode (see {@link
 * Environment#processMessages(String, PayloadCodec, int, MessageHandler)}) and dropped in push mode
 * (see {@link Subscriber}).
 *
 * @param <T> type of the decoded messages
 */
@FunctionalInterface
public interface MessageHandler<T> {

  /**
   * Process a decoded message.
   *
   * @param message the decoded message
   * @throws Exception if the processing fails
   */
  void handle(T message) throws Exception;
}
