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

import java.time.Duration;

/**
 * API to configure and start a {@link Subscriber}.
 *
 * @param <T> type of the decoded messages
 */
public interface SubscriberBuilder<T> {

  /**
   * The queue to consume from.
   *
   * @param queue
   * @return this builder instance
   */
  SubscriberBuilder<T> queue(String queue);

  /**
   * The callback for inbound messages.
   *
   * @param messageHandler
   * @return this builder instance
   */
  SubscriberBuilder<T> messageHandler(MessageHandler<T> messageHandler);

  /**
   * The number of concurrent workers, each with its own channel.
   *
   * <p>Default is 1.
   *
   * @param workers
   * @return this builder instance
   */
  SubscriberBuilder<T> workers(int workers);

  /**
   * The maximum number of unacknowledged messages on each worker channel.
   *
   * <p>Default is 1, 0 means no limit.
   *
   * @param prefetchCount
   * @return this builder instance
   */
  SubscriberBuilder<T> prefetchCount(int prefetchCount);

  /**
   * Prefix for the consumer tags, the worker index is appended to it.
   *
   * <p>The broker generates the consumer tags if not set.
   *
   * @param consumerTagPrefix
   * @return this builder instance
   */
  SubscriberBuilder<T> consumerTagPrefix(String consumerTagPrefix);

  /**
   * The time given to in-flight messages to complete when the subscriber is closed.
   *
   * <p>Default is 10 seconds.
   *
   * @param shutdownTimeout
   * @return this builder instance
   */
  SubscriberBuilder<T> shutdownTimeout(Duration shutdownTimeout);

  /**
   * Start the {@link Subscriber}.
   *
   * @return the started subscriber
   */
  Subscriber build();
}
