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

import com.rabbitmq.client.Connection;
import com.rabbitmq.worker.metrics.MetricsCollector;

/**
 * API to configure and create an {@link Environment}.
 *
 * @see Environment
 */
public interface EnvironmentBuilder {

  /**
   * The AMQP connection to open channels on.
   *
   * <p>The connection is borrowed: the environment never closes it.
   *
   * @param connection
   * @return this builder instance
   */
  EnvironmentBuilder connection(Connection connection);

  /**
   * What to do when the acknowledgment of a processed message fails.
   *
   * <p>The default is {@link AckFailurePolicy#rejectDrop()}.
   *
   * @param ackFailurePolicy
   * @return this builder instance
   */
  EnvironmentBuilder ackFailurePolicy(AckFailurePolicy ackFailurePolicy);

  /**
   * Set up a {@link MetricsCollector}.
   *
   * <p>The default is a no-op collector.
   *
   * @param metricsCollector
   * @return this builder instance
   * @see com.rabbitmq.worker.metrics.MicrometerMetricsCollector
   */
  EnvironmentBuilder metricsCollector(MetricsCollector metricsCollector);

  /**
   * The prefix of the names of the threads the environment creates.
   *
   * <p>The default is <code>rabbitmq-worker-</code>.
   *
   * @param threadPrefix
   * @return this builder instance
   */
  EnvironmentBuilder threadPrefix(String threadPrefix);

  /**
   * Create the {@link Environment} instance.
   *
   * @return the configured environment
   */
  Environment build();
}
